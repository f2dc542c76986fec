package com.weatherline.backend.model;

public enum WeatherAlertType {
    TEMPERATURE,
    HUMIDITY,
    PRESSURE
}
