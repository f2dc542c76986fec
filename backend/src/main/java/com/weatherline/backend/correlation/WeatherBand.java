package com.weatherline.backend.correlation;

/**
 * Named range of a weather factor, lower bound inclusive and upper bound exclusive.
 */
public record WeatherBand(String name, double lower, double upper) {

    public boolean contains(double value) {
        return value >= lower && value < upper;
    }
}
