/* (C)2026 */
package com.ammann.telemetry.repository;

import com.ammann.telemetry.model.TelemetryPoint;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to stored sensor readings.
 *
 * <p>All list operations return points newest first. An empty list is a valid answer here;
 * the stream access layer decides whether it is an error.
 */
public interface TelemetryRepository {

    /**
     * Returns the newest readings of a stream.
     *
     * @param streamId stream identifier
     * @param count maximum number of points
     * @return at most {@code count} points, newest first
     */
    List<TelemetryPoint> findRecent(String streamId, int count);

    /**
     * Returns readings with {@code from <= ts <= to}.
     *
     * @param streamId stream identifier
     * @param from window start
     * @param to window end
     * @param limit maximum number of points
     * @return at most {@code limit} points, newest first
     */
    List<TelemetryPoint> findInWindow(String streamId, Instant from, Instant to, int limit);

    /** Returns the oldest reading of a stream, if it has any. */
    Optional<TelemetryPoint> findOldest(String streamId);

    /**
     * Returns the exact identifiers of all streams with a reading after {@code since},
     * sorted by name.
     */
    List<String> findActiveStreamIds(Instant since);

    /** Counts readings of all streams after {@code since}. */
    long countSince(Instant since);
}
