package com.weatherline.backend.correlation;

import com.weatherline.backend.model.WeatherFactor;

/**
 * Band of a weather factor with the best composite production score.
 */
public record OptimalRange(WeatherFactor factor, String band, double lower, double upper, double compositeScore) {
}
