/* (C)2026 */
package com.ammann.telemetry.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.telemetry.support.TestSeries;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AlignedStreamsTest {

    @Test
    void truncatesToTheShortestStream() {
        Map<String, StreamContext> streams = new LinkedHashMap<>();
        streams.put("b", TestSeries.stream("b", TestSeries.ramp(5)));
        streams.put("a", TestSeries.stream("a", TestSeries.ramp(3)));

        AlignedStreams aligned = AlignedStreams.align(streams);

        assertThat(aligned.length()).isEqualTo(3);
        assertThat(aligned.series().keySet()).containsExactly("b", "a");
        assertThat(aligned.get("b")).containsExactly(0, 1, 2);
        assertThat(aligned.originalSizes()).containsEntry("b", 5).containsEntry("a", 3);
        assertThat(aligned.streamCount()).isEqualTo(2);
    }

    @Test
    void unknownStreamHasNoSeries() {
        AlignedStreams aligned =
                AlignedStreams.align(Map.of("a", TestSeries.stream("a", TestSeries.ramp(3))));

        assertThat(aligned.get("missing")).isNull();
    }

    @Test
    void noStreamsAlignToZeroLength() {
        AlignedStreams aligned = AlignedStreams.align(Map.of());

        assertThat(aligned.length()).isZero();
        assertThat(aligned.series()).isEmpty();
    }
}
