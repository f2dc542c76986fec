package com.weatherline.backend.correlation;

import com.weatherline.backend.model.ProductionMetric;
import com.weatherline.backend.model.WeatherFactor;

import java.util.Map;

/**
 * Production metric summaries for the pairs that fell into one band of a weather factor.
 */
public record BandStatistics(
        WeatherFactor factor,
        WeatherBand band,
        int sampleCount,
        Map<ProductionMetric, MetricSummary> metrics,
        double compositeScore) {
}
