/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/** Sign of a correlation coefficient, with a dead zone of 0.1 around zero. */
public enum CorrelationDirection {
    POSITIVE("positive"),
    NEGATIVE("negative"),
    NONE("none");

    private final String value;

    CorrelationDirection(String value) {
        this.value = value;
    }

    public static CorrelationDirection fromCoefficient(double correlation) {
        if (correlation > 0.1) return POSITIVE;
        if (correlation < -0.1) return NEGATIVE;
        return NONE;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
