/* (C)2026 */
package com.ammann.telemetry.dto;

import com.ammann.telemetry.model.TimeRange;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Envelope returned by every multi-stream analysis.
 *
 * @param streams streams that survived fetching, in request order
 * @param method analysis method identifier, e.g. {@code granger-causality}
 * @param result method-specific payload
 * @param interpretation human-readable summary
 * @param quality confidence and reliability; data quality is the combined score of all streams
 * @param context sample sizes and parameters
 * @param <T> payload type
 */
@Schema(description = "Result envelope of a multi-stream analysis")
public record MultiStreamResult<T>(
        @Schema(description = "Participating streams") List<StreamDescriptor> streams,
        @Schema(description = "Analysis method identifier") String method,
        @Schema(description = "Method-specific result payload") T result,
        @Schema(description = "Human-readable interpretation") String interpretation,
        @Schema(description = "Quality of the result") ResultQuality quality,
        @Schema(description = "Analysis context") Context context) {

    public MultiStreamResult {
        streams = List.copyOf(streams);
    }

    /**
     * Input description of a multi-stream analysis.
     *
     * @param sampleSizes sample count of each stream before alignment
     * @param alignedLength common length after alignment
     * @param timeRange requested window, absent for most-recent fetches
     * @param parameters effective parameters, defaults included
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Context(
            Map<String, Integer> sampleSizes,
            int alignedLength,
            TimeRange timeRange,
            Map<String, Object> parameters) {

        public Context {
            sampleSizes = Collections.unmodifiableMap(new LinkedHashMap<>(sampleSizes));
            parameters =
                    parameters == null
                            ? Map.of()
                            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        }
    }
}
