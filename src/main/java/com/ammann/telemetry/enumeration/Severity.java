/* (C)2026 */
package com.ammann.telemetry.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of an anomaly or data quality issue.
 *
 * <p>Detectors grade their scores against three ascending cut-offs; {@link #tiered}
 * applies such a ladder in one place.
 */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    /**
     * Grades a score against strictly-greater-than cut-offs.
     *
     * @param score detector score
     * @param mediumAbove score above which the severity is at least medium
     * @param highAbove score above which the severity is at least high
     * @param criticalAbove score above which the severity is critical
     * @return the matching severity
     */
    public static Severity tiered(
            double score, double mediumAbove, double highAbove, double criticalAbove) {
        if (score > criticalAbove) return CRITICAL;
        if (score > highAbove) return HIGH;
        if (score > mediumAbove) return MEDIUM;
        return LOW;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
