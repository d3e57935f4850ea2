/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/** Semantic class of a stream's values, inferred from its identifier. */
public enum ValueType {
    /** Two-state signal, 0 or 1 (occupancy, fan state). */
    BINARY("binary"),
    /** Position or output between 0 and 100 percent. */
    PERCENTAGE("percentage"),
    /** Unbounded or physically ranged measurement (temperature). */
    CONTINUOUS("continuous");

    private final String value;

    ValueType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
