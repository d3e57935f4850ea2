/* (C)2026 */
package com.ammann.telemetry.dto;

import com.ammann.telemetry.enumeration.Reliability;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Quality block of an analysis result.
 *
 * @param dataQuality quality score of the analysed data in [0, 1]
 * @param confidence confidence of the analysis in [0, 1]
 * @param reliability tier derived from both
 */
@Schema(description = "Confidence and reliability of an analysis result")
public record ResultQuality(
        @Schema(description = "Quality score of the input data (0-1)") double dataQuality,
        @Schema(description = "Confidence of the analysis (0-1)") double confidence,
        @Schema(description = "Reliability tier: low, medium or high") Reliability reliability) {

    /**
     * Builds the quality block, deriving the reliability tier deterministically.
     *
     * @param dataQuality quality score of the analysed data
     * @param confidence analysis confidence
     * @return quality block
     */
    public static ResultQuality of(double dataQuality, double confidence) {
        return new ResultQuality(
                dataQuality, confidence, Reliability.from(confidence, dataQuality));
    }
}
