/* (C)2026 */
package com.ammann.telemetry.dto;

import com.ammann.telemetry.enumeration.QualityGrade;
import com.ammann.telemetry.model.TimeRange;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Full quality assessment of one slice of a stream. Computed on demand, never cached.
 *
 * @param streamId assessed stream
 * @param sensorType sensor type label
 * @param unit physical unit
 * @param overallScore mean of the four dimension scores
 * @param grade letter grade of the overall score
 * @param issues breached dimensions
 * @param recommendations remediation recommendations
 * @param assessment per-dimension scores
 * @param context assessed slice
 */
@Schema(description = "Data quality report of a stream slice")
public record QualityReport(
        String streamId,
        String sensorType,
        String unit,
        @Schema(description = "Overall quality score (0-1)") double overallScore,
        @Schema(description = "Letter grade A-F") QualityGrade grade,
        List<QualityIssue> issues,
        List<String> recommendations,
        Assessment assessment,
        Context context) {

    public QualityReport {
        issues = List.copyOf(issues);
        recommendations = List.copyOf(recommendations);
    }

    /**
     * Per-dimension scores, each in [0, 1].
     *
     * @param completeness share of expected samples present
     * @param consistency one minus the larger of drift and noise
     * @param accuracy penalised by outliers and range violations
     * @param timeliness penalised by sampling gaps
     */
    public record Assessment(
            double completeness, double consistency, double accuracy, double timeliness) {

        public double mean() {
            return (completeness + consistency + accuracy + timeliness) / 4;
        }
    }

    /**
     * @param sampleSize number of samples assessed
     * @param timeRange requested window, or the span of the samples for most-recent fetches
     * @param evaluationTimestamp when the assessment ran
     */
    public record Context(int sampleSize, TimeRange timeRange, Instant evaluationTimestamp) {}
}
