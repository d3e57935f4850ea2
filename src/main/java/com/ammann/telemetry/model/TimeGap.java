/* (C)2026 */
package com.ammann.telemetry.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Interval between two consecutive samples that exceeded the tolerated sampling interval.
 *
 * @param start timestamp of the sample before the gap
 * @param end timestamp of the sample after the gap
 * @param durationMs absolute gap length in milliseconds
 */
public record TimeGap(Instant start, Instant end, long durationMs) {

    public static TimeGap between(Instant start, Instant end) {
        return new TimeGap(start, end, Math.abs(Duration.between(start, end).toMillis()));
    }
}
