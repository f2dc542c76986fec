package com.weatherline.backend.recommendation;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.AlertLevel;
import com.weatherline.backend.model.HoldReleaseFlag;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Compensates dryer temperature and mixing for hot or cold ambient conditions and holds
 * production below freezing or in extreme heat.
 */
@Component
public class TemperatureRule implements RecommendationRule<TemperatureAdjustment> {

    private final WeatherlineProperties.Recommender settings;

    public TemperatureRule(WeatherlineProperties properties) {
        this.settings = properties.getRecommender();
    }

    @Override
    public String name() {
        return "temperature";
    }

    @Override
    public TemperatureAdjustment assess(RecommendationRequest request) {
        double temperature = request.getTemperatureAmbient();
        double offset = temperature - settings.getOptimalTemperature();
        return new TemperatureAdjustment(
                temperature,
                offset,
                Math.max(0.0, temperature - settings.getHotThreshold()),
                Math.max(0.0, settings.getColdThreshold() - temperature),
                Math.abs(offset) > settings.getExtremeDeviation());
    }

    @Override
    public Recommendation apply(Recommendation current, TemperatureAdjustment adjustment, RecommendationRequest request) {
        Recommendation.RecommendationBuilder next = current.toBuilder();
        double dryer = current.getRecommendedDryerTemp();

        if (adjustment.hotExcess() > 0) {
            dryer -= Math.min(adjustment.hotExcess() * settings.getHotDryerFactor(), settings.getHotDryerCap());
            next.recommendedDryerTemp(dryer)
                    .preMixTimeDelta(current.getPreMixTimeDelta() + settings.getHotPreMixIncrease())
                    .reason(String.format(Locale.ROOT, "Hot weather (%.1fF) compensation.", adjustment.temperature()));
        } else if (adjustment.coldDeficit() > 0) {
            dryer += Math.min(adjustment.coldDeficit() * settings.getColdDryerFactor(), settings.getColdDryerCap());
            next.recommendedDryerTemp(dryer)
                    .reason(String.format(Locale.ROOT, "Cold weather (%.1fF) compensation.", adjustment.temperature()));
        }

        if (adjustment.extreme()) {
            next.alertLevel(current.getAlertLevel().atLeast(AlertLevel.HIGH));
            if (adjustment.temperature() < settings.getFreezingThreshold()) {
                next.holdReleaseFlag(HoldReleaseFlag.HOLD)
                        .reason("FREEZING CONDITIONS - Production hold required for safety.");
            } else if (adjustment.temperature() > settings.getExtremeHeatThreshold()) {
                next.holdReleaseFlag(HoldReleaseFlag.HOLD)
                        .reason("EXTREME HEAT - Production hold required for safety.");
            }
        }
        return next.build();
    }
}
