package com.weatherline.backend.model;

/**
 * Weather risk derived from factor impact assessment.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public RiskLevel max(RiskLevel other) {
        return compareTo(other) >= 0 ? this : other;
    }
}
