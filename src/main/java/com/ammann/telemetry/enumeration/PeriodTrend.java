/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome of comparing the quality of two periods of the same stream. */
public enum PeriodTrend {
    IMPROVED("improved"),
    DEGRADED("degraded"),
    UNCHANGED("unchanged");

    private final String value;

    PeriodTrend(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
