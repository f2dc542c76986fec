package com.weatherline.backend.recommendation;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.AlertLevel;
import com.weatherline.backend.model.HoldReleaseFlag;
import org.springframework.stereotype.Component;

/**
 * Scores combined weather hazards and overrides everything before it when conditions are unsafe.
 */
@Component
public class SafetyRule implements RecommendationRule<SafetyAssessment> {

    private final WeatherlineProperties.Recommender settings;

    public SafetyRule(WeatherlineProperties properties) {
        this.settings = properties.getRecommender();
    }

    @Override
    public String name() {
        return "safety";
    }

    @Override
    public SafetyAssessment assess(RecommendationRequest request) {
        double score = 1.0;
        if (request.getRainfallLast24h() > settings.getSafetyRainfallInches()) {
            score -= settings.getSafetyRainfallPenalty();
        }
        if (request.getRainProbabilityNext6h() > settings.getSafetyRainProbability()) {
            score -= settings.getSafetyRainProbabilityPenalty();
        }
        double temperature = request.getTemperatureAmbient();
        if (temperature < settings.getSafetyColdThreshold() || temperature > settings.getSafetyHeatThreshold()) {
            score -= settings.getSafetyTemperaturePenalty();
        }
        if (request.getHumidityRelative() > settings.getSafetyHumidityThreshold()) {
            score -= settings.getSafetyHumidityPenalty();
        }
        return new SafetyAssessment(Math.max(0.0, score),
                score < settings.getSafetyCriticalScore(),
                score < settings.getSafetyWarningScore());
    }

    @Override
    public Recommendation apply(Recommendation current, SafetyAssessment assessment, RecommendationRequest request) {
        if (assessment.critical()) {
            return current.toBuilder()
                    .holdReleaseFlag(HoldReleaseFlag.HOLD)
                    .alertLevel(AlertLevel.CRITICAL)
                    .confidenceScore(settings.getCriticalConfidence())
                    .reason("CRITICAL SAFETY CONDITIONS - All production halted.")
                    .build();
        }
        if (assessment.warning()) {
            return current.toBuilder()
                    .alertLevel(current.getAlertLevel().atLeast(AlertLevel.HIGH))
                    .reason("Safety warning conditions present - enhanced monitoring required.")
                    .build();
        }
        return current;
    }
}
