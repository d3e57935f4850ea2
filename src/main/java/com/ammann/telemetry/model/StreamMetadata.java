/* (C)2026 */
package com.ammann.telemetry.model;

import com.ammann.telemetry.enumeration.StreamCategory;
import com.ammann.telemetry.enumeration.ValueType;
import java.time.Instant;

/**
 * Descriptive information about a stream, sampled cheaply from its newest and oldest
 * readings.
 *
 * @param streamId exact stream identifier as stored
 * @param sensorType sensor type label
 * @param unit physical unit
 * @param firstSeen timestamp of the oldest reading
 * @param lastSeen timestamp of the newest reading
 * @param totalPoints number of sampled readings (an approximation, not a full count)
 * @param averageSamplingRate estimated sampling rate in Hz
 * @param valueType inferred value semantics
 * @param valueRange declared range, may be {@code null}
 * @param category discovery category
 */
public record StreamMetadata(
        String streamId,
        String sensorType,
        String unit,
        Instant firstSeen,
        Instant lastSeen,
        int totalPoints,
        double averageSamplingRate,
        ValueType valueType,
        ValueRange valueRange,
        StreamCategory category) {}
