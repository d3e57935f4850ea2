/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/** Direction of a stream's quality score over consecutive windows. */
public enum HealthTrend {
    IMPROVING("improving"),
    STABLE("stable"),
    DEGRADING("degrading");

    private final String value;

    HealthTrend(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
