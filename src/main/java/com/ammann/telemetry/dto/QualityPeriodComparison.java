/* (C)2026 */
package com.ammann.telemetry.dto;

import com.ammann.telemetry.enumeration.PeriodTrend;
import java.util.List;

/**
 * Quality of one stream in two periods, side by side.
 *
 * @param streamId compared stream
 * @param sensorType sensor type label
 * @param period1Quality report of the earlier period
 * @param period2Quality report of the later period
 * @param scoreChange overall score of period 2 minus that of period 1
 * @param trendDirection verdict with a 0.05 deadband
 * @param significantChanges new or resolved issue types and dimension changes above 0.1
 */
public record QualityPeriodComparison(
        String streamId,
        String sensorType,
        QualityReport period1Quality,
        QualityReport period2Quality,
        double scoreChange,
        PeriodTrend trendDirection,
        List<String> significantChanges) {

    public QualityPeriodComparison {
        significantChanges = List.copyOf(significantChanges);
    }
}
