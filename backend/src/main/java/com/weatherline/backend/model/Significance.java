package com.weatherline.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Significance {
    SIGNIFICANT("significant"),
    NOT_SIGNIFICANT("not_significant");

    public static final double ALPHA = 0.05;

    private final String label;

    Significance(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Significance fromPValue(double pValue) {
        return pValue < ALPHA ? SIGNIFICANT : NOT_SIGNIFICANT;
    }
}
