/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/** Pattern families that can be requested from the pattern analysis. */
public enum PatternType {
    /** Peaks and valleys. */
    PEAKS("peaks"),
    SPIKES("spikes"),
    /** Autocorrelation-based cycles. */
    CYCLES("cycles"),
    REPEATING("repeating");

    private final String value;

    PatternType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
