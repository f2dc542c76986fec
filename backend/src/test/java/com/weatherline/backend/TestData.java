package com.weatherline.backend;

import com.weatherline.backend.model.ProductionEvent;
import com.weatherline.backend.model.ProductionStatus;
import com.weatherline.backend.model.WeatherObservation;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Builders for the domain objects used across tests.
 */
public final class TestData {

    public static final Instant T0 = Instant.parse("2024-06-01T12:00:00Z");

    private TestData() {
    }

    public static WeatherObservation observation(String locationId, Instant timestamp) {
        return observation(locationId, timestamp, 75.0, 50.0, 30.0);
    }

    public static WeatherObservation observation(String locationId, Instant timestamp,
            double temperature, double humidity, double pressure) {
        return WeatherObservation.builder()
                .id(locationId + "_" + timestamp.toEpochMilli())
                .locationId(locationId)
                .timestamp(timestamp)
                .temperature(temperature)
                .humidity(humidity)
                .pressure(pressure)
                .windSpeed(5.0)
                .precipitation(0.0)
                .build();
    }

    public static ProductionEvent event(String eventId, String locationId, Instant timestamp) {
        return event(eventId, locationId, timestamp, ProductionStatus.GAIN, 40.0, Map.of());
    }

    public static ProductionEvent event(String eventId, String locationId, Instant timestamp,
            ProductionStatus status, double cycleTime, Map<String, Double> details) {
        return ProductionEvent.builder()
                .eventId(eventId)
                .locationId(locationId)
                .machineId("M-01")
                .machineClass("Variant")
                .timestamp(timestamp)
                .status(status)
                .cycleTime(cycleTime)
                .detailParameters(new HashMap<>(details))
                .build();
    }
}
