/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/** Label of a strongly correlated pair in a correlation matrix. */
public enum PairSignificance {
    WEAK("weak"),
    MODERATE("moderate"),
    STRONG("strong"),
    VERY_STRONG("very_strong");

    private final String value;

    PairSignificance(String value) {
        this.value = value;
    }

    public static PairSignificance fromCoefficient(double correlation) {
        double abs = Math.abs(correlation);
        if (abs >= 0.8) return VERY_STRONG;
        if (abs >= 0.6) return STRONG;
        if (abs >= 0.4) return MODERATE;
        return WEAK;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
