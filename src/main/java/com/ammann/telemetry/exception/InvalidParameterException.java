/* (C)2026 */
package com.ammann.telemetry.exception;

import java.util.Locale;

/**
 * Exception indicating that a caller-supplied parameter violates the contract of the
 * requested operation (out-of-range quantile, non-positive window, inverted time range).
 *
 * <p>Provides factory methods for common validation failure patterns.
 */
public class InvalidParameterException extends TelemetryAnalysisException {

    public InvalidParameterException(String message) {
        super(message);
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static InvalidParameterException invalidParameter(
            String paramName, Object value, String expected) {
        return new InvalidParameterException(
                String.format(
                        Locale.ROOT,
                        "Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for a multi-stream request with too few stream ids.
     */
    public static InvalidParameterException insufficientStreams(int required, int actual) {
        return new InvalidParameterException(
                String.format(
                        Locale.ROOT,
                        "At least %d streams required for this analysis, but got %d",
                        required, actual));
    }
}
