/* (C)2026 */
package com.ammann.telemetry.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CorrelationStrengthTest {

    @ParameterizedTest
    @CsvSource({
        "0.95,STRONG,POSITIVE,VERY_STRONG",
        "-0.7,STRONG,NEGATIVE,STRONG",
        "0.5,MODERATE,POSITIVE,MODERATE",
        "-0.2,WEAK,NEGATIVE,WEAK",
        "0.1,WEAK,NONE,WEAK",
        "0.05,NONE,NONE,WEAK"
    })
    void gradesCoefficients(
            double r,
            CorrelationStrength strength,
            CorrelationDirection direction,
            PairSignificance significance) {
        assertThat(CorrelationStrength.fromCoefficient(r)).isEqualTo(strength);
        assertThat(CorrelationDirection.fromCoefficient(r)).isEqualTo(direction);
        assertThat(PairSignificance.fromCoefficient(r)).isEqualTo(significance);
    }
}
