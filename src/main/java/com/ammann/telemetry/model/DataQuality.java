/* (C)2026 */
package com.ammann.telemetry.model;

import java.util.List;

/**
 * Quality snapshot computed for every fetched stream.
 *
 * @param score quality score in [0, 1], 1 being perfect
 * @param issues human-readable issue descriptions
 * @param missingPoints number of missing or non-finite samples
 * @param suspiciousValues number of samples outside the 3 x IQR fence
 * @param gaps time gaps found against the expected sampling rate
 */
public record DataQuality(
        double score,
        List<String> issues,
        int missingPoints,
        int suspiciousValues,
        List<TimeGap> gaps) {

    public DataQuality {
        issues = List.copyOf(issues);
        gaps = List.copyOf(gaps);
    }

    public static DataQuality perfect() {
        return new DataQuality(1.0, List.of(), 0, 0, List.of());
    }
}
