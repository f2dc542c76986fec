package com.weatherline.backend.model;

/**
 * Production performance metrics correlated against weather factors.
 */
public enum ProductionMetric {
    CYCLE_TIME,
    EFFICIENCY,
    QUALITY_SCORE,
    ENERGY_USAGE,
    STATUS_GAIN
}
