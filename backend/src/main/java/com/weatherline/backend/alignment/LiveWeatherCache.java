package com.weatherline.backend.alignment;

import com.weatherline.backend.model.WeatherObservation;

import java.util.Optional;

/**
 * Most recent observation per location.
 */
public interface LiveWeatherCache {

    Optional<WeatherObservation> latest(String locationId);

    /**
     * Stores the observation unless one at the same time or newer is already cached for its location.
     *
     * @return true if the observation is now the cached one
     */
    boolean update(WeatherObservation observation);
}
