/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/** Direction of a fitted linear trend. */
public enum TrendDirection {
    UP("up"),
    DOWN("down"),
    STABLE("stable");

    /** Slopes with an absolute value up to this bound count as flat. */
    public static final double FLAT_SLOPE = 0.001;

    private final String value;

    TrendDirection(String value) {
        this.value = value;
    }

    public static TrendDirection fromSlope(double slope) {
        if (Math.abs(slope) <= FLAT_SLOPE) return STABLE;
        return slope > 0 ? UP : DOWN;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
