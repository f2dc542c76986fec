package com.weatherline.backend.correlation;

import java.time.Instant;
import java.util.List;

/**
 * Rapid pressure changes and how production behaved around them compared with the
 * non-front baseline. Impacts are NaN when either side has no samples.
 */
public record WeatherFrontAnalysis(
        int frontEventsDetected,
        List<Instant> frontTimestamps,
        double averageQualityImpact,
        double averageCycleTimeImpact) {

    public static WeatherFrontAnalysis none() {
        return new WeatherFrontAnalysis(0, List.of(), Double.NaN, Double.NaN);
    }
}
