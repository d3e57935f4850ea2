/* (C)2026 */
package com.ammann.telemetry.dto;

import com.ammann.telemetry.enumeration.QualityIssueType;
import com.ammann.telemetry.enumeration.Severity;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * A breached quality dimension.
 *
 * @param type issue category
 * @param severity issue severity
 * @param count number of affected samples (1 for whole-series issues such as drift)
 * @param percentage share affected, in percent
 * @param description human-readable description
 * @param locations sample indices involved, absent when not point-wise
 * @param suggestedAction remediation hint
 */
@Schema(description = "Data quality issue with remediation hint")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QualityIssue(
        @Schema(description = "Issue category") QualityIssueType type,
        @Schema(description = "Issue severity") Severity severity,
        @Schema(description = "Number of affected samples") int count,
        @Schema(description = "Share of the series affected, in percent") double percentage,
        @Schema(description = "Human-readable description") String description,
        @Schema(description = "Indices of affected samples") List<Integer> locations,
        @Schema(description = "Suggested remediation") String suggestedAction) {}
