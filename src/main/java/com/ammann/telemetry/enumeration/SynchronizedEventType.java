/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shape of a synchronized event across streams. Mixed upward and downward excursions
 * are reported as a change.
 */
public enum SynchronizedEventType {
    SPIKE("spike"),
    DIP("dip"),
    CHANGE("change");

    private final String value;

    SynchronizedEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
