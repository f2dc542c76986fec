package com.weatherline.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Duration;
import java.time.Instant;

/**
 * A single weather reading for a production location.
 * Readings are never edited once stored; a newer reading supersedes an older one
 * in the live cache while the historical store keeps all of them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "weather_readings")
@CompoundIndex(name = "location_timestamp", def = "{'locationId': 1, 'timestamp': 1}")
public class WeatherObservation {

    /**
     * Span that {@link #precipitation} accumulates over, ending at the reading's timestamp.
     */
    public static final Duration PRECIPITATION_PERIOD = Duration.ofHours(1);

    @Id
    private String id;

    private Instant timestamp;
    private String locationId;

    // Fahrenheit
    private double temperature;
    // Percent
    private double humidity;
    // inHg
    private double pressure;
    // mph
    private double windSpeed;
    /**
     * Rain in inches over the {@link #PRECIPITATION_PERIOD} before {@link #timestamp}.
     * Readings taken more often than hourly report overlapping amounts.
     */
    private double precipitation;

    /**
     * Forecast probability of precipitation over the next six hours, in percent.
     * Not every supplier provides it.
     */
    private Double precipitationProbability;

    private String conditionCode;

    /**
     * Completeness/consistency score of the reading, 0 to 1.
     */
    @Builder.Default
    private double qualityScore = 1.0;
}
