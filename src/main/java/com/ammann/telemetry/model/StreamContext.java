/* (C)2026 */
package com.ammann.telemetry.model;

import com.ammann.telemetry.enumeration.ValueType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * A fetched series plus its provenance. Values and timestamps are parallel and follow the
 * storage order (newest first).
 *
 * @param streamId stream identifier
 * @param sensorType sensor type label
 * @param unit physical unit
 * @param values sample values; {@code NaN} marks a missing sample
 * @param timestamps sample timestamps, one per value
 * @param quality quality snapshot computed at fetch time
 * @param count number of samples
 * @param timeRange requested window, {@code null} for most-recent fetches
 * @param valueType inferred value semantics
 * @param valueRange declared range, may be {@code null}
 */
public record StreamContext(
        String streamId,
        String sensorType,
        String unit,
        double[] values,
        List<Instant> timestamps,
        DataQuality quality,
        int count,
        TimeRange timeRange,
        ValueType valueType,
        ValueRange valueRange) {

    public StreamContext {
        values = values.clone();
        timestamps = List.copyOf(timestamps);
        if (values.length != timestamps.size()) {
            throw new IllegalArgumentException(
                    "values and timestamps differ in length: "
                            + values.length
                            + " vs "
                            + timestamps.size());
        }
    }

    /** Returns a copy of the values, so callers cannot alter the context. */
    @Override
    public double[] values() {
        return values.clone();
    }

    /** Values with missing or non-finite samples removed, in the original order. */
    public double[] finiteValues() {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    /** Timestamps of the samples kept by {@link #finiteValues()}, index for index. */
    public List<Instant> finiteTimestamps() {
        List<Instant> kept = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (Double.isFinite(values[i])) {
                kept.add(timestamps.get(i));
            }
        }
        return kept;
    }

    public int size() {
        return values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StreamContext that)) return false;
        return streamId.equals(that.streamId)
                && Arrays.equals(values, that.values)
                && timestamps.equals(that.timestamps);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * streamId.hashCode() + Arrays.hashCode(values)) + timestamps.hashCode();
    }

    @Override
    public String toString() {
        return String.format(
                Locale.ROOT,
                "StreamContext{streamId=%s, count=%d, valueType=%s, quality=%.2f}",
                streamId, count, valueType, quality.score());
    }
}
