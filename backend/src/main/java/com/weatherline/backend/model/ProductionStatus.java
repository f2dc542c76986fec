package com.weatherline.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status reported by the production system for a cycle.
 * Unrecognised values map to {@link #OTHER}.
 */
public enum ProductionStatus {
    GAIN("Gain"),
    LOSS("Loss"),
    NEW_SESSION("New Session"),
    QUALITY_ISSUE("Quality Issue"),
    OTHER("Other");

    private final String label;

    ProductionStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isDegraded() {
        return this == LOSS || this == QUALITY_ISSUE;
    }

    @JsonCreator
    public static ProductionStatus fromValue(String value) {
        if (value == null) {
            return OTHER;
        }
        String normalized = value.trim().replace(' ', '_').replace('-', '_').toUpperCase(Locale.ROOT);
        if (normalized.equals("NEWSESSION")) {
            return NEW_SESSION;
        }
        if (normalized.equals("QUALITYISSUE")) {
            return QUALITY_ISSUE;
        }
        for (ProductionStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        return OTHER;
    }
}
