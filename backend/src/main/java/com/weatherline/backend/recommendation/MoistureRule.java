package com.weatherline.backend.recommendation;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.AlertLevel;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Raises drying and mixing when rainfall and humidity push material moisture above the baseline.
 */
@Component
public class MoistureRule implements RecommendationRule<MoistureImpact> {

    private final WeatherlineProperties.Recommender settings;

    public MoistureRule(WeatherlineProperties properties) {
        this.settings = properties.getRecommender();
    }

    @Override
    public String name() {
        return "moisture";
    }

    @Override
    public MoistureImpact assess(RecommendationRequest request) {
        double base = settings.getBaseMoisture();
        double current = request.getMoistureLevel() != null ? request.getMoistureLevel() : base;
        double rainfallFactor = Math.min(request.getRainfallLast24h() * settings.getRainfallMoistureFactor(),
                settings.getRainfallMoistureCap());
        double humidityFactor = (request.getHumidityRelative() - 50.0) / 100.0;
        double adjusted = current + rainfallFactor + humidityFactor;
        return new MoistureImpact(adjusted, adjusted - base);
    }

    @Override
    public Recommendation apply(Recommendation current, MoistureImpact impact, RecommendationRequest request) {
        double excess = impact.excess();
        if (excess > settings.getMoistureMajorDeviation()) {
            double dryerIncrease = Math.min(excess * settings.getMoistureDryerPerUnit(), settings.getMoistureDryerCap());
            return current.toBuilder()
                    .recommendedDryerTemp(current.getRecommendedDryerTemp() + dryerIncrease)
                    .preMixTimeDelta(current.getPreMixTimeDelta() + (int) (excess * settings.getMoisturePreMixPerUnit()))
                    .alertLevel(current.getAlertLevel().atLeast(AlertLevel.MEDIUM))
                    .reason(String.format(Locale.ROOT, "Excess moisture (%.1f%%) detected.", excess))
                    .build();
        }
        if (excess > settings.getMoistureMinorDeviation()) {
            return current.toBuilder()
                    .recommendedDryerTemp(current.getRecommendedDryerTemp() + settings.getMoistureMinorDryerIncrease())
                    .preMixTimeDelta(current.getPreMixTimeDelta() + settings.getMoistureMinorPreMixIncrease())
                    .build();
        }
        return current;
    }
}
