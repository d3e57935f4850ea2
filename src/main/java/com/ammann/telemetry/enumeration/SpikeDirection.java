/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/** Direction of a spike relative to the series mean. */
public enum SpikeDirection {
    UP("up"),
    DOWN("down");

    private final String value;

    SpikeDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
