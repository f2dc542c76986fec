package com.weatherline.backend.model;

/**
 * Alert level attached to a recommendation. Declaration order is severity order.
 */
public enum AlertLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(AlertLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * Returns the more severe of this level and {@code other}.
     */
    public AlertLevel atLeast(AlertLevel other) {
        return isAtLeast(other) ? this : other;
    }
}
