/* (C)2026 */
package com.ammann.telemetry.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.telemetry.exception.InvalidParameterException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TimeRangeTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void lastPeriodEndsNow() {
        TimeRange range = TimeRange.lastPeriod(NOW, Duration.ofHours(6));

        assertThat(range.from()).isEqualTo(NOW.minus(Duration.ofHours(6)));
        assertThat(range.to()).isEqualTo(NOW);
        assertThat(range.duration()).isEqualTo(Duration.ofHours(6));
    }

    @Test
    void singleInstantIsAllowed() {
        assertThat(new TimeRange(NOW, NOW).duration()).isZero();
    }

    @Test
    void invertedRangeIsRejected() {
        assertThatThrownBy(() -> new TimeRange(NOW, NOW.minusSeconds(1)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("timeRange");
    }

    @Test
    void boundsAreRequired() {
        assertThatThrownBy(() -> new TimeRange(null, NOW))
                .isInstanceOf(NullPointerException.class);
    }
}
