/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Coarse grouping of streams used by discovery.
 *
 * <p>The category is inferred from substrings of the stream identifier, following the
 * naming convention of the building-automation telemetry.
 */
public enum StreamCategory {
    TEMPERATURE("temperature"),
    VALVE("valve"),
    FAN("fan"),
    OCCUPANCY("occupancy"),
    STATUS("status"),
    OTHER("other");

    private final String value;

    StreamCategory(String value) {
        this.value = value;
    }

    public static StreamCategory fromStreamId(String streamId) {
        String id = streamId == null ? "" : streamId.toLowerCase(Locale.ROOT);
        if (id.contains("temp") || id.contains("setpt")) return TEMPERATURE;
        if (id.contains("heat") || id.contains("cool")) return VALVE;
        if (id.contains("fan")) return FAN;
        if (id.contains("occup")) return OCCUPANCY;
        if (id.contains("status") || id.contains("parsed")) return STATUS;
        return OTHER;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
