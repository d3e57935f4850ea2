/* (C)2026 */
package com.ammann.telemetry.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.telemetry.enumeration.ValueType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class StreamSemanticsTest {

    @ParameterizedTest
    @CsvSource({
        "zone-3-occupancy,BINARY",
        "ahu-1-fan-status,BINARY",
        "ahu-1-heating-output,PERCENTAGE",
        "zone-2-cooling-valve,PERCENTAGE",
        "zone-1-spacetemp,CONTINUOUS",
        "meter-7-kwh,CONTINUOUS"
    })
    void infersValueType(String streamId, ValueType expected) {
        assertThat(StreamSemantics.infer(streamId).valueType()).isEqualTo(expected);
    }

    @Test
    void binaryStreamsAdmitOnlyZeroAndOne() {
        ValueRange range = StreamSemantics.infer("zone-3-occupancy").valueRange();

        assertThat(range.values()).containsExactly(0.0, 1.0);
        assertThat(range.contains(1)).isTrue();
        assertThat(range.contains(2)).isFalse();
    }

    @Test
    void temperatureStreamsHaveAPlausibleRange() {
        assertThat(StreamSemantics.infer("zone-1-spacetemp").valueRange())
                .isEqualTo(ValueRange.temperature());
        assertThat(StreamSemantics.infer("meter-7-kwh").valueRange()).isNull();
    }
}
