package com.weatherline.backend.alignment;

import com.weatherline.backend.model.WeatherObservation;

import java.time.Instant;
import java.util.List;

/**
 * Range access to stored weather readings.
 */
public interface HistoricalWeatherStore {

    /**
     * Readings for the location with {@code from <= timestamp <= to}.
     */
    List<WeatherObservation> findInRange(String locationId, Instant from, Instant to);
}
