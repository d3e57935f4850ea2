/* (C)2026 */
package com.ammann.telemetry.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SeverityTest {

    @ParameterizedTest
    @CsvSource({"3.0,LOW", "3.01,MEDIUM", "3.5,MEDIUM", "3.6,HIGH", "4.0,HIGH", "4.2,CRITICAL"})
    void cutOffsAreExclusive(double score, Severity expected) {
        assertThat(Severity.tiered(score, 3, 3.5, 4)).isEqualTo(expected);
    }

    @Test
    void serialisesAsLowerCase() {
        assertThat(Severity.CRITICAL.getValue()).isEqualTo("critical");
    }
}
