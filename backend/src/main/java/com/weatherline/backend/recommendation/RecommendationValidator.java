package com.weatherline.backend.recommendation;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.AlertLevel;
import org.springframework.stereotype.Component;

/**
 * Bounds and consistency checks applied after the rule fold.
 */
@Component
public class RecommendationValidator {

    public static final String STANDARD_OPERATION =
            "Standard operating parameters - no weather adjustments needed.";

    private final WeatherlineProperties.Recommender settings;

    public RecommendationValidator(WeatherlineProperties properties) {
        this.settings = properties.getRecommender();
    }

    public Recommendation validate(Recommendation recommendation) {
        Recommendation.RecommendationBuilder next = recommendation.toBuilder()
                .recommendedDryerTemp(clamp(recommendation.getRecommendedDryerTemp(),
                        settings.getMinDryerTemp(), settings.getMaxDryerTemp()))
                .preMixTimeDelta((int) clamp(recommendation.getPreMixTimeDelta(),
                        settings.getMinPreMixDelta(), settings.getMaxPreMixDelta()));

        if (recommendation.isHold()) {
            next.alertLevel(recommendation.getAlertLevel().atLeast(AlertLevel.HIGH));
        }
        if (recommendation.getRationale().isEmpty()) {
            next.reason(STANDARD_OPERATION).alertLevel(AlertLevel.LOW);
        }
        return next.build();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
