/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/** Goodness-of-fit tier of a linear trend, derived from its coefficient of determination. */
public enum TrendStrength {
    WEAK("weak"),
    MODERATE("moderate"),
    STRONG("strong");

    private final String value;

    TrendStrength(String value) {
        this.value = value;
    }

    public static TrendStrength fromRSquared(double rSquared) {
        if (rSquared > 0.7) return STRONG;
        if (rSquared > 0.3) return MODERATE;
        return WEAK;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
