/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/** Smoothing kernel used by the moving-average analysis. */
public enum MovingAverageType {
    SIMPLE("simple"),
    EXPONENTIAL("exponential");

    private final String value;

    MovingAverageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
