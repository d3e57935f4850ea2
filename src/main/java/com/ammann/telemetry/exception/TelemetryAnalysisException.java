/* (C)2026 */
package com.ammann.telemetry.exception;

/**
 * Base unchecked exception for all errors surfaced by the stream analytics engine.
 *
 * <p>Only contract violations and missing data propagate to callers. Insufficient or
 * degenerate input never raises; analytic functions return empty results instead.
 */
public class TelemetryAnalysisException extends RuntimeException {

    public TelemetryAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    public TelemetryAnalysisException(String message) {
        super(message);
    }
}
