/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/** Category of a data quality issue raised by the quality assessment. */
public enum QualityIssueType {
    MISSING_DATA("missing_data"),
    OUTLIERS("outliers"),
    GAPS("gaps"),
    DRIFT("drift"),
    NOISE("noise"),
    RANGE_VIOLATION("range_violation");

    private final String value;

    QualityIssueType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
