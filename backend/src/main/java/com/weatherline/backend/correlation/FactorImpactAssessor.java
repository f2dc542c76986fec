package com.weatherline.backend.correlation;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.CorrelationFinding;
import com.weatherline.backend.model.ProductionEvent;
import com.weatherline.backend.model.ProductionStatus;
import com.weatherline.backend.model.RiskLevel;
import com.weatherline.backend.model.WeatherContext;
import com.weatherline.backend.model.WeatherFactor;
import com.weatherline.backend.model.WeatherObservation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Flags the weather factors that plausibly affected a production event.
 * <p>
 * Humidity and temperature impacts ask for an optimization; a pressure trend is reported
 * and contributes to the dispatcher's expected improvement but does not trigger one alone.
 */
@Component
public class FactorImpactAssessor {

    public static final String ACTION_INCREASE_PRE_MIX = "Increase pre-mix time";
    public static final String ACTION_REDUCE_DRYER = "Reduce dryer temperature";
    public static final String ACTION_ADJUST_HOLD_RELEASE = "Adjust hold/release timing";

    private final WeatherlineProperties.Impact settings;

    public FactorImpactAssessor(WeatherlineProperties properties) {
        this.settings = properties.getImpact();
    }

    /**
     * @param pressureTrend latest minus previous pressure reading for the location, empty when unknown
     * @param findings      rolling findings for the location; only significant ones are kept
     */
    public FactorImpactAssessment assess(ProductionEvent event, WeatherContext context,
                                         OptionalDouble pressureTrend, List<CorrelationFinding> findings) {
        WeatherObservation weather = context.getObservation();
        List<FactorImpact> impacts = new ArrayList<>();
        List<String> actions = new ArrayList<>();
        RiskLevel risk = RiskLevel.LOW;
        boolean requiresOptimization = false;

        ProductionStatus status = event.getStatus();
        if (weather.getHumidity() > settings.getHumidityThreshold() && status != null && status.isDegraded()) {
            impacts.add(new FactorImpact(WeatherFactor.HUMIDITY, weather.getHumidity(), Double.NaN,
                    RiskLevel.HIGH, settings.getHumidityConfidence()));
            actions.add(ACTION_INCREASE_PRE_MIX);
            risk = RiskLevel.HIGH;
            requiresOptimization = true;
        }

        if (weather.getTemperature() > settings.getTemperatureThreshold()) {
            double efficiencyImpact = temperatureEfficiencyImpact(weather.getTemperature());
            if (efficiencyImpact > settings.getTemperatureImpactMin()) {
                RiskLevel level = efficiencyImpact < settings.getTemperatureImpactHigh() ? RiskLevel.MEDIUM : RiskLevel.HIGH;
                impacts.add(new FactorImpact(WeatherFactor.TEMPERATURE, weather.getTemperature(), Double.NaN,
                        level, settings.getTemperatureConfidence()));
                actions.add(ACTION_REDUCE_DRYER);
                requiresOptimization = true;
            }
        }

        if (pressureTrend.isPresent() && Math.abs(pressureTrend.getAsDouble()) > settings.getPressureTrendThreshold()) {
            impacts.add(new FactorImpact(WeatherFactor.PRESSURE, weather.getPressure(), pressureTrend.getAsDouble(),
                    RiskLevel.MEDIUM, settings.getPressureConfidence()));
            actions.add(ACTION_ADJUST_HOLD_RELEASE);
        }

        Set<WeatherFactor> impacted = EnumSet.noneOf(WeatherFactor.class);
        impacts.forEach(i -> impacted.add(i.factor()));
        List<CorrelationFinding> supporting = findings.stream()
                .filter(CorrelationFinding::isSignificant)
                .filter(f -> impacted.contains(f.getWeatherFactor()))
                .toList();

        return new FactorImpactAssessment(risk, requiresOptimization, impacts, actions, supporting);
    }

    /**
     * Fractional efficiency loss at an ambient temperature: linear between the threshold and
     * the severe threshold, steeper above it.
     */
    public double temperatureEfficiencyImpact(double temperature) {
        if (temperature <= settings.getTemperatureThreshold()) {
            return 0.0;
        }
        if (temperature <= settings.getTemperatureSevereThreshold()) {
            return (temperature - settings.getTemperatureThreshold()) * settings.getTemperatureLinearRate();
        }
        return settings.getTemperatureSevereBase()
                + (temperature - settings.getTemperatureSevereThreshold()) * settings.getTemperatureSevereRate();
    }
}
