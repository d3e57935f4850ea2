/* (C)2026 */
package com.ammann.telemetry.dto;

import com.ammann.telemetry.model.TimeRange;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Describes the input an analysis ran on.
 *
 * @param sampleSize number of samples analysed
 * @param timeRange requested window, absent for most-recent fetches
 * @param parameters effective parameters, defaults included
 */
@Schema(description = "Input slice and effective parameters of an analysis")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisContext(
        @Schema(description = "Number of samples analysed") int sampleSize,
        @Schema(description = "Requested time window") TimeRange timeRange,
        @Schema(description = "Effective analysis parameters") Map<String, Object> parameters) {

    public AnalysisContext {
        parameters =
                parameters == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
