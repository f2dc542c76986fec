package com.weatherline.backend.model;

import java.util.function.ToDoubleFunction;

/**
 * Numeric weather factors that take part in correlation analysis.
 */
public enum WeatherFactor {
    TEMPERATURE(WeatherObservation::getTemperature),
    HUMIDITY(WeatherObservation::getHumidity),
    PRESSURE(WeatherObservation::getPressure),
    WIND_SPEED(WeatherObservation::getWindSpeed),
    PRECIPITATION(WeatherObservation::getPrecipitation);

    private final ToDoubleFunction<WeatherObservation> extractor;

    WeatherFactor(ToDoubleFunction<WeatherObservation> extractor) {
        this.extractor = extractor;
    }

    public double valueFrom(WeatherObservation observation) {
        return extractor.applyAsDouble(observation);
    }
}
