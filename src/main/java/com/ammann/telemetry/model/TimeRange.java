/* (C)2026 */
package com.ammann.telemetry.model;

import com.ammann.telemetry.exception.InvalidParameterException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed time window {@code [from, to]}.
 *
 * @param from window start
 * @param to window end, not before {@code from}
 */
public record TimeRange(Instant from, Instant to) {
    public TimeRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.isAfter(to)) {
            throw InvalidParameterException.invalidParameter(
                    "timeRange", from + ".." + to, "'from' not after 'to'");
        }
    }

    public static TimeRange lastPeriod(Instant now, Duration period) {
        return new TimeRange(now.minus(period), now);
    }

    public Duration duration() {
        return Duration.between(from, to);
    }
}
