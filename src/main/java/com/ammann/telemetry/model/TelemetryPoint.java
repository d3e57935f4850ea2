/* (C)2026 */
package com.ammann.telemetry.model;

import java.time.Instant;

/**
 * A single reading as returned by the storage collaborator.
 *
 * @param ts reading timestamp
 * @param value reading value; {@code NaN} marks a missing or invalid sample
 * @param sensorType sensor type label, {@code "unknown"} when the store has none
 * @param unit physical unit, empty when the store has none
 */
public record TelemetryPoint(Instant ts, double value, String sensorType, String unit) {
    public static final String UNKNOWN_SENSOR_TYPE = "unknown";

    public TelemetryPoint(Instant ts, double value) {
        this(ts, value, UNKNOWN_SENSOR_TYPE, "");
    }
}
