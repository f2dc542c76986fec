package com.weatherline.backend.recommendation;

/**
 * Estimated material moisture after rainfall and humidity, against the baseline.
 */
public record MoistureImpact(double adjustedMoisture, double deviation) {

    public double excess() {
        return Math.max(0.0, deviation);
    }
}
