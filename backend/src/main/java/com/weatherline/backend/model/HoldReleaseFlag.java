package com.weatherline.backend.model;

/**
 * Production continuation decision.
 */
public enum HoldReleaseFlag {
    CONTINUE,
    HOLD
}
