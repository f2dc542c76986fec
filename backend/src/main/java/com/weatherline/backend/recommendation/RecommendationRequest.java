package com.weatherline.backend.recommendation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Site conditions a recommendation is computed from. Unset fields take neutral values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationRequest {

    private String siteId;

    // inches
    @Builder.Default
    private double rainfallLast24h = 0.0;

    // percent
    @Builder.Default
    private double rainProbabilityNext6h = 0.0;

    /**
     * Material moisture in percent; the configured baseline applies when absent.
     */
    private Double moistureLevel;

    @Builder.Default
    private double temperatureAmbient = 75.0;

    @Builder.Default
    private double humidityRelative = 50.0;

    // units/hour
    private Double lineSpeed;

    private String productType;
    private String machineClass;

    // ratio to baseline
    @Builder.Default
    private double currentEfficiency = 1.0;

    @Builder.Default
    private double sensorDataQuality = 1.0;
}
