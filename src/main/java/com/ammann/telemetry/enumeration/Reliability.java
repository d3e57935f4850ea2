/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reliability tier attached to every analysis result.
 *
 * <p>The tier is limited by the weaker of the analysis confidence and the data quality
 * of the input slice.
 */
public enum Reliability {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    Reliability(String value) {
        this.value = value;
    }

    /**
     * Derives the tier from confidence and data quality, both in [0, 1].
     *
     * @param confidence confidence of the analysis
     * @param dataQuality quality score of the analysed data
     * @return HIGH above 0.7, MEDIUM above 0.4, LOW otherwise
     */
    public static Reliability from(double confidence, double dataQuality) {
        double limiting = Math.min(confidence, dataQuality);
        if (limiting > 0.7) return HIGH;
        if (limiting > 0.4) return MEDIUM;
        return LOW;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
