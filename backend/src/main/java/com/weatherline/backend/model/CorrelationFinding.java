package com.weatherline.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pearson correlation between one weather factor and one production metric.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationFinding {

    private WeatherFactor weatherFactor;
    private ProductionMetric productionMetric;

    // [-1, 1]
    private double coefficient;
    // [0, 1]
    @JsonProperty("pValue")
    private double pValue;

    private Significance significance;
    private int sampleSize;

    private double confidenceLow;
    private double confidenceHigh;

    public boolean isSignificant() {
        return significance == Significance.SIGNIFICANT;
    }
}
