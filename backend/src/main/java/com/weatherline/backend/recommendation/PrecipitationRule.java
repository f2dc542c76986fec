package com.weatherline.backend.recommendation;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.AlertLevel;
import com.weatherline.backend.model.HoldReleaseFlag;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Holds production after heavy rainfall; otherwise speeds mixing up ahead of likely rain.
 */
@Component
public class PrecipitationRule implements RecommendationRule<PrecipitationRisk> {

    private final WeatherlineProperties.Recommender settings;

    public PrecipitationRule(WeatherlineProperties properties) {
        this.settings = properties.getRecommender();
    }

    @Override
    public String name() {
        return "precipitation";
    }

    @Override
    public PrecipitationRisk assess(RecommendationRequest request) {
        return new PrecipitationRisk(
                request.getRainfallLast24h(),
                request.getRainProbabilityNext6h(),
                request.getRainfallLast24h() > settings.getHeavyRainfallInches(),
                request.getRainProbabilityNext6h() > settings.getRainProbabilityThreshold());
    }

    @Override
    public Recommendation apply(Recommendation current, PrecipitationRisk risk, RecommendationRequest request) {
        if (risk.heavyRainfall()) {
            return current.toBuilder()
                    .holdReleaseFlag(HoldReleaseFlag.HOLD)
                    .alertLevel(current.getAlertLevel().atLeast(AlertLevel.HIGH))
                    .reason(String.format(Locale.ROOT,
                            "Heavy rainfall (%.2f in) in last 24h. Production hold recommended.",
                            risk.rainfallLast24h()))
                    .build();
        }
        if (risk.highRainProbability()) {
            return current.toBuilder()
                    .preMixTimeDelta(current.getPreMixTimeDelta() - settings.getRainPreMixReduction())
                    .alertLevel(current.getAlertLevel().atLeast(AlertLevel.MEDIUM))
                    .reason(String.format(Locale.ROOT,
                            "High rain probability (%.0f%%) - accelerating production.",
                            risk.rainProbabilityNext6h()))
                    .build();
        }
        return current;
    }
}
