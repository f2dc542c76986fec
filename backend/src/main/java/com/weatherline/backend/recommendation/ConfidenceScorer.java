package com.weatherline.backend.recommendation;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.AlertLevel;
import org.springframework.stereotype.Component;

/**
 * Confidence of a validated recommendation, always within the configured bounds.
 * CRITICAL recommendations get the fixed critical confidence.
 */
@Component
public class ConfidenceScorer {

    private final WeatherlineProperties.Recommender settings;

    public ConfidenceScorer(WeatherlineProperties properties) {
        this.settings = properties.getRecommender();
    }

    public Recommendation score(Recommendation recommendation, RecommendationRequest request) {
        return recommendation.toBuilder()
                .confidenceScore(confidence(recommendation, request))
                .build();
    }

    double confidence(Recommendation recommendation, RecommendationRequest request) {
        if (recommendation.getAlertLevel() == AlertLevel.CRITICAL) {
            return clamp(settings.getCriticalConfidence());
        }
        double confidence = settings.getBaseConfidence();
        if (request.getSensorDataQuality() < settings.getLowSensorQualityThreshold()) {
            confidence -= settings.getLowSensorQualityPenalty();
        }
        if (recommendation.getRationaleText().length() < settings.getShortRationaleLength()) {
            confidence -= settings.getShortRationalePenalty();
        }
        return clamp(confidence);
    }

    private double clamp(double value) {
        return Math.max(settings.getMinConfidence(), Math.min(settings.getMaxConfidence(), value));
    }
}
