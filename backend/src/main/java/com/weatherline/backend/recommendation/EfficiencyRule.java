package com.weatherline.backend.recommendation;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.AlertLevel;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Pushes drying and mixing up when the line runs below its baseline efficiency.
 */
@Component
public class EfficiencyRule implements RecommendationRule<EfficiencyAssessment> {

    private final WeatherlineProperties.Recommender settings;

    public EfficiencyRule(WeatherlineProperties properties) {
        this.settings = properties.getRecommender();
    }

    @Override
    public String name() {
        return "efficiency";
    }

    @Override
    public EfficiencyAssessment assess(RecommendationRequest request) {
        double loss = 1.0 - request.getCurrentEfficiency();
        return new EfficiencyAssessment(Math.max(0.0, loss),
                loss > settings.getCriticalEfficiencyLoss(),
                loss > settings.getEfficiencyLossThreshold());
    }

    @Override
    public Recommendation apply(Recommendation current, EfficiencyAssessment assessment, RecommendationRequest request) {
        double lossPercent = assessment.efficiencyLoss() * 100.0;
        if (assessment.critical()) {
            return current.toBuilder()
                    .recommendedDryerTemp(current.getRecommendedDryerTemp() + settings.getCriticalDryerIncrease())
                    .preMixTimeDelta(current.getPreMixTimeDelta() + settings.getCriticalPreMixIncrease())
                    .alertLevel(current.getAlertLevel().atLeast(AlertLevel.HIGH))
                    .reason(String.format(Locale.ROOT,
                            "Critical efficiency loss (%.1f%%) - aggressive parameter adjustment.", lossPercent))
                    .build();
        }
        if (assessment.adjustmentNeeded()) {
            return current.toBuilder()
                    .recommendedDryerTemp(current.getRecommendedDryerTemp() + settings.getModerateDryerIncrease())
                    .preMixTimeDelta(current.getPreMixTimeDelta() + settings.getModeratePreMixIncrease())
                    .alertLevel(current.getAlertLevel().atLeast(AlertLevel.MEDIUM))
                    .reason(String.format(Locale.ROOT,
                            "Efficiency decline detected (%.1f%%) - parameter optimization applied.", lossPercent))
                    .build();
        }
        return current;
    }
}
