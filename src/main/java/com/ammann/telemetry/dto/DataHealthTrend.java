/* (C)2026 */
package com.ammann.telemetry.dto;

import com.ammann.telemetry.enumeration.HealthTrend;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Quality trend of a stream over overlapping windows.
 *
 * @param streamId monitored stream
 * @param sensorType sensor type label
 * @param healthScore mean quality score of the last three windows
 * @param trend direction of the quality score
 * @param windowCount number of windows assessed
 * @param recentChanges the last step changes above 0.1 between consecutive windows
 */
@Schema(description = "Quality trend of a stream over sliding windows")
public record DataHealthTrend(
        String streamId,
        String sensorType,
        double healthScore,
        HealthTrend trend,
        int windowCount,
        List<QualityChange> recentChanges) {

    public DataHealthTrend {
        recentChanges = List.copyOf(recentChanges);
    }

    /**
     * @param timestamp timestamp at the centre of the window where the change appeared
     * @param changeType {@code improvement} or {@code degradation}
     * @param impact absolute score change
     * @param description human-readable description
     */
    public record QualityChange(
            Instant timestamp, String changeType, double impact, String description) {}
}
