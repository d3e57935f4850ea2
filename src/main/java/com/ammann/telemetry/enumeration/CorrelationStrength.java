/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/** Magnitude band of a Pearson correlation coefficient. */
public enum CorrelationStrength {
    /** |r| below 0.1. */
    NONE("none"),
    /** |r| in [0.1, 0.3). */
    WEAK("weak"),
    /** |r| in [0.3, 0.7). */
    MODERATE("moderate"),
    /** |r| of 0.7 or more. */
    STRONG("strong");

    private final String value;

    CorrelationStrength(String value) {
        this.value = value;
    }

    public static CorrelationStrength fromCoefficient(double correlation) {
        double abs = Math.abs(correlation);
        if (abs >= 0.7) return STRONG;
        if (abs >= 0.3) return MODERATE;
        if (abs >= 0.1) return WEAK;
        return NONE;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
