package com.weatherline.backend.model;

public enum OptimizationPriority {
    IMMEDIATE,
    HIGH,
    MEDIUM,
    LOW
}
