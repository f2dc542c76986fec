package com.weatherline.backend.weather;

import com.weatherline.backend.config.WeatherlineProperties;
import com.weatherline.backend.model.AlertLevel;
import com.weatherline.backend.model.WeatherAlert;
import com.weatherline.backend.model.WeatherAlertType;
import com.weatherline.backend.model.WeatherObservation;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Checks a weather reading against the alert thresholds.
 */
@Component
public class WeatherAlertEvaluator {

    private final WeatherlineProperties.Alerts settings;

    public WeatherAlertEvaluator(WeatherlineProperties properties) {
        this.settings = properties.getAlerts();
    }

    /**
     * @param pressureChange change against the previous reading for the location, empty when unknown
     * @param issuedAt       start of the validity window
     */
    public List<WeatherAlert> evaluate(WeatherObservation weather, OptionalDouble pressureChange, Instant issuedAt) {
        List<WeatherAlert> alerts = new ArrayList<>();
        String location = weather.getLocationId();
        long epochSeconds = weather.getTimestamp().getEpochSecond();

        if (weather.getTemperature() > settings.getTemperatureCritical()) {
            alerts.add(alert("temp_high_" + location + "_" + epochSeconds, location, WeatherAlertType.TEMPERATURE,
                    AlertLevel.CRITICAL,
                    String.format(Locale.ROOT, "Extreme temperature %.1fF at %s", weather.getTemperature(), location),
                    List.of("Consider production hold",
                            "Activate enhanced cooling systems",
                            "Monitor equipment temperatures"),
                    "HIGH - Efficiency drop expected",
                    issuedAt, settings.getTemperatureCriticalValidity()));
        } else if (weather.getTemperature() > settings.getTemperatureHigh()) {
            alerts.add(alert("temp_high_" + location + "_" + epochSeconds, location, WeatherAlertType.TEMPERATURE,
                    AlertLevel.HIGH,
                    String.format(Locale.ROOT, "High temperature %.1fF at %s", weather.getTemperature(), location),
                    List.of("Reduce dryer temperature by 10F",
                            "Increase cooling system load",
                            "Monitor production efficiency"),
                    "MEDIUM - 10-15% efficiency reduction",
                    issuedAt, settings.getTemperatureHighValidity()));
        }

        if (weather.getHumidity() > settings.getHumidityHigh()) {
            alerts.add(alert("humidity_high_" + location + "_" + epochSeconds, location, WeatherAlertType.HUMIDITY,
                    AlertLevel.HIGH,
                    String.format(Locale.ROOT, "High humidity %.1f%% at %s", weather.getHumidity(), location),
                    List.of("Increase pre-mix time by 20%",
                            "Activate dehumidification systems",
                            "Monitor curing quality closely"),
                    "HIGH - Curing time increase expected",
                    issuedAt, settings.getHumidityValidity()));
        }

        if (pressureChange.isPresent() && Math.abs(pressureChange.getAsDouble()) > settings.getPressureChange()) {
            alerts.add(alert("pressure_change_" + location + "_" + epochSeconds, location, WeatherAlertType.PRESSURE,
                    AlertLevel.MEDIUM,
                    String.format(Locale.ROOT, "Rapid pressure change %+.2f inHg at %s", pressureChange.getAsDouble(), location),
                    List.of("Adjust hold/release timing",
                            "Monitor material handling",
                            "Prepare for weather front"),
                    "MEDIUM - Material handling affected",
                    issuedAt, settings.getPressureValidity()));
        }

        return alerts;
    }

    private static WeatherAlert alert(String id, String locationId, WeatherAlertType type, AlertLevel severity,
                                      String message, List<String> actions, String impact,
                                      Instant issuedAt, Duration validity) {
        return WeatherAlert.builder()
                .id(id)
                .locationId(locationId)
                .alertType(type)
                .severity(severity)
                .message(message)
                .recommendedActions(new ArrayList<>(actions))
                .productionImpact(impact)
                .issuedAt(issuedAt)
                .validUntil(issuedAt.plus(validity))
                .build();
    }
}
