/* (C)2026 */
package com.ammann.telemetry.exception;

import java.time.Instant;
import java.util.Collection;
import java.util.Locale;

/**
 * Raised when storage returns no samples for a requested stream or window.
 *
 * <p>An empty result is never treated as a valid empty series.
 */
public class StreamNotFoundException extends TelemetryAnalysisException {

    private final String streamId;

    public StreamNotFoundException(String streamId, String message) {
        super(message);
        this.streamId = streamId;
    }

    public static StreamNotFoundException noData(String streamId) {
        return new StreamNotFoundException(streamId, "No data found for stream " + streamId);
    }

    public static StreamNotFoundException noDataInWindow(
            String streamId, Instant from, Instant to) {
        return new StreamNotFoundException(
                streamId,
                String.format(
                        Locale.ROOT,
                        "No data found for stream %s in time range %s to %s",
                        streamId, from, to));
    }

    /**
     * Creates the exception raised when a multi-stream request cannot be served because
     * some of its streams failed to load.
     */
    public static StreamNotFoundException failedToLoad(Collection<String> streamIds) {
        return new StreamNotFoundException(
                String.join(",", streamIds),
                "Failed to load one or more streams: " + String.join(", ", streamIds));
    }

    public String getStreamId() {
        return streamId;
    }
}
