package com.weatherline.backend.correlation;

/**
 * Mean and sample standard deviation of one metric within a band. {@code std} is NaN for a single sample.
 */
public record MetricSummary(double mean, double std, int count) {
}
