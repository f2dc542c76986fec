package com.weatherline.backend.model;

/**
 * Key of a correlation finding.
 */
public record FactorMetricPair(WeatherFactor factor, ProductionMetric metric) {

    @Override
    public String toString() {
        return factor.name().toLowerCase() + ":" + metric.name().toLowerCase();
    }
}
