package com.weatherline.backend.dto;

import com.weatherline.backend.model.WeatherObservation;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Weather reading pushed by the weather supplier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Weather reading for a production site")
public class WeatherObservationRequest {

    @NotNull
    private Instant timestamp;

    @NotBlank
    @Schema(example = "seguin")
    private String locationId;

    @Schema(description = "Fahrenheit", example = "88.5")
    private double temperature;

    @DecimalMin("0")
    @DecimalMax("100")
    @Schema(description = "Relative humidity, percent", example = "72")
    private double humidity;

    @Schema(description = "inHg", example = "29.92")
    private double pressure;

    @PositiveOrZero
    @Schema(description = "mph")
    private double windSpeed;

    @PositiveOrZero
    @Schema(description = "Rain over the hour before the reading, inches")
    private double precipitation;

    @DecimalMin("0")
    @DecimalMax("100")
    @Schema(description = "Probability of precipitation over the next six hours, percent")
    private Double precipitationProbability;

    private String conditionCode;

    @DecimalMin("0")
    @DecimalMax("1")
    @Schema(description = "Reading quality, 0 to 1; 1 when omitted")
    private Double qualityScore;

    public WeatherObservation toObservation() {
        return WeatherObservation.builder()
                .timestamp(timestamp)
                .locationId(locationId)
                .temperature(temperature)
                .humidity(humidity)
                .pressure(pressure)
                .windSpeed(windSpeed)
                .precipitation(precipitation)
                .precipitationProbability(precipitationProbability)
                .conditionCode(conditionCode)
                .qualityScore(qualityScore != null ? qualityScore : 1.0)
                .build();
    }
}
