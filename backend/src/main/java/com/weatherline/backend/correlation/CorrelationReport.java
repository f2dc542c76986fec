package com.weatherline.backend.correlation;

import com.weatherline.backend.model.CorrelationFinding;
import com.weatherline.backend.model.WeatherFactor;
import com.weatherline.backend.prediction.FittedPredictor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Correlation analysis of a location over a closed time range.
 */
public record CorrelationReport(
        String locationId,
        Instant from,
        Instant to,
        Instant generatedAt,
        int sampleSize,
        List<CorrelationFinding> findings,
        Map<WeatherFactor, List<BandStatistics>> bandStatistics,
        Map<WeatherFactor, OptimalRange> optimalRanges,
        WeatherFrontAnalysis weatherFronts,
        List<FittedPredictor> predictors) {
}
