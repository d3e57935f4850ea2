/* (C)2026 */
package com.ammann.telemetry.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ReliabilityTest {

    @ParameterizedTest
    @CsvSource({
        "0.9,0.95,HIGH",
        "0.9,0.5,MEDIUM",
        "0.3,1.0,LOW",
        "0.7,1.0,MEDIUM",
        "0.41,0.8,MEDIUM",
        "0.4,0.8,LOW"
    })
    void weakerInputLimitsTheTier(double confidence, double dataQuality, Reliability expected) {
        assertThat(Reliability.from(confidence, dataQuality)).isEqualTo(expected);
    }
}
