/* (C)2026 */
package com.ammann.telemetry.model;

import com.ammann.telemetry.exception.InvalidParameterException;
import java.util.Objects;

/**
 * Selects the slice of a stream an analysis runs on: either the newest {@code count}
 * points or the points inside {@code timeRange} (capped at {@code count} when both are
 * given).
 *
 * @param streamId stream identifier
 * @param count number of points, {@code null} for the operation's default
 * @param timeRange time window, {@code null} for a most-recent fetch
 */
public record StreamQuery(String streamId, Integer count, TimeRange timeRange) {

    public StreamQuery {
        Objects.requireNonNull(streamId, "streamId");
        if (count != null && count <= 0) {
            throw InvalidParameterException.invalidParameter("count", count, "a positive integer");
        }
    }

    public static StreamQuery of(String streamId) {
        return new StreamQuery(streamId, null, null);
    }

    public static StreamQuery recent(String streamId, int count) {
        return new StreamQuery(streamId, count, null);
    }

    public static StreamQuery window(String streamId, TimeRange timeRange) {
        return new StreamQuery(streamId, null, timeRange);
    }

    public int countOr(int defaultCount) {
        return count != null ? count : defaultCount;
    }

    /** Returns the same selection for another stream. */
    public StreamQuery forStream(String otherStreamId) {
        return new StreamQuery(otherStreamId, count, timeRange);
    }

    /** Returns the same selection with the default count filled in. */
    public StreamQuery withDefaultCount(int defaultCount) {
        return count != null ? this : new StreamQuery(streamId, defaultCount, timeRange);
    }
}
