/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/** Verdict of the lagged predictive-improvement causality heuristic. */
public enum CausalityDirection {
    X_CAUSES_Y("x_causes_y"),
    Y_CAUSES_X("y_causes_x"),
    BIDIRECTIONAL("bidirectional"),
    NO_CAUSALITY("no_causality");

    private final String value;

    CausalityDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
