package com.weatherline.backend.recommendation;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.AlertLevel;
import com.weatherline.backend.model.HoldReleaseFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Rule-based production parameter recommender.
 * <p>
 * Starts from safe defaults and folds the rules in priority order: moisture, precipitation,
 * temperature, efficiency, then safety. The result is bounds-checked and scored. Any failure
 * returns a low-confidence fallback instead of propagating.
 */
@Service
public class WeatherProductionRecommender {

    private static final Logger log = LoggerFactory.getLogger(WeatherProductionRecommender.class);

    private final List<RecommendationRule<?>> rules;
    private final RecommendationValidator validator;
    private final ConfidenceScorer confidenceScorer;
    private final WeatherlineProperties.Recommender settings;
    private final Clock clock;

    public WeatherProductionRecommender(MoistureRule moistureRule,
            PrecipitationRule precipitationRule,
            TemperatureRule temperatureRule,
            EfficiencyRule efficiencyRule,
            SafetyRule safetyRule,
            RecommendationValidator validator,
            ConfidenceScorer confidenceScorer,
            WeatherlineProperties properties,
            Clock clock) {
        this.rules = List.of(moistureRule, precipitationRule, temperatureRule, efficiencyRule, safetyRule);
        this.validator = validator;
        this.confidenceScorer = confidenceScorer;
        this.settings = properties.getRecommender();
        this.clock = clock;
    }

    public Recommendation recommend(RecommendationRequest request) {
        String siteId = request != null && request.getSiteId() != null ? request.getSiteId() : "unknown";
        log.info("[RECOMMENDER] Generating recommendation for site: {}", siteId);

        try {
            Recommendation recommendation = defaults(siteId);
            for (RecommendationRule<?> rule : rules) {
                recommendation = rule.evaluate(recommendation, request);
                log.debug("[RECOMMENDER] Site: {} | After {}: alert={} hold={}", siteId, rule.name(),
                        recommendation.getAlertLevel(), recommendation.getHoldReleaseFlag());
            }
            recommendation = validator.validate(recommendation);
            recommendation = confidenceScorer.score(recommendation, request);

            log.info("[RECOMMENDER] AUDIT site: {} | Alert: {} | Hold: {} | Dryer: {} | PreMixDelta: {} | Confidence: {}",
                    siteId, recommendation.getAlertLevel(), recommendation.getHoldReleaseFlag(),
                    recommendation.getRecommendedDryerTemp(), recommendation.getPreMixTimeDelta(),
                    String.format("%.2f", recommendation.getConfidenceScore()));
            return recommendation;
        } catch (RuntimeException e) {
            log.error("[RECOMMENDER] Failed to generate recommendation for site: {}", siteId, e);
            return fallback(siteId, e);
        }
    }

    private Recommendation defaults(String siteId) {
        return Recommendation.builder()
                .siteId(siteId)
                .recommendedDryerTemp(settings.getDefaultDryerTemp())
                .preMixTimeDelta(0)
                .holdReleaseFlag(HoldReleaseFlag.CONTINUE)
                .alertLevel(AlertLevel.LOW)
                .confidenceScore(settings.getDefaultConfidence())
                .timestamp(clock.instant())
                .build();
    }

    private Recommendation fallback(String siteId, RuntimeException cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return defaults(siteId).toBuilder()
                .alertLevel(AlertLevel.MEDIUM)
                .confidenceScore(settings.getFallbackConfidence())
                .clearRationale()
                .reason("System error - using safe defaults. Error: " + message)
                .systemError(true)
                .build();
    }
}
