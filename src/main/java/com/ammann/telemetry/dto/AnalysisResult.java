/* (C)2026 */
package com.ammann.telemetry.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Envelope returned by every single-stream analysis.
 *
 * @param streamId analysed stream
 * @param sensorType sensor type label of the stream
 * @param unit physical unit of the stream
 * @param method analysis method identifier, e.g. {@code linear-trend-analysis}
 * @param result method-specific payload
 * @param interpretation human-readable summary
 * @param quality confidence and reliability
 * @param context input slice and parameters
 * @param <T> payload type
 */
@Schema(description = "Result envelope of a single-stream analysis")
public record AnalysisResult<T>(
        @Schema(description = "Analysed stream identifier") String streamId,
        @Schema(description = "Sensor type label") String sensorType,
        @Schema(description = "Physical unit") String unit,
        @Schema(description = "Analysis method identifier") String method,
        @Schema(description = "Method-specific result payload") T result,
        @Schema(description = "Human-readable interpretation") String interpretation,
        @Schema(description = "Quality of the result") ResultQuality quality,
        @Schema(description = "Analysis context") AnalysisContext context) {}
