/* (C)2026 */
package com.ammann.telemetry.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Several streams truncated to a common length so that index {@code i} refers to the same
 * position in every series.
 *
 * <p>Every multi-stream analysis goes through {@link #align(Map)}; no other code path may
 * shorten or pad series for cross-stream work.
 *
 * @param series aligned values per stream id, in request order
 * @param originalSizes sample count of each stream before alignment
 * @param length common length of all aligned series
 */
public record AlignedStreams(
        Map<String, double[]> series, Map<String, Integer> originalSizes, int length) {

    /**
     * Truncates every stream to the shortest one. Iteration order of the input is kept.
     *
     * @param streams fetched streams keyed by id
     * @return aligned series
     */
    public static AlignedStreams align(Map<String, StreamContext> streams) {
        int length =
                streams.values().stream().mapToInt(StreamContext::size).min().orElse(0);

        Map<String, double[]> series = new LinkedHashMap<>();
        Map<String, Integer> sizes = new LinkedHashMap<>();
        streams.forEach(
                (id, context) -> {
                    series.put(id, Arrays.copyOf(context.values(), length));
                    sizes.put(id, context.size());
                });

        return new AlignedStreams(
                Collections.unmodifiableMap(series), Collections.unmodifiableMap(sizes), length);
    }

    public double[] get(String streamId) {
        double[] values = series.get(streamId);
        return values == null ? null : values.clone();
    }

    public int streamCount() {
        return series.size();
    }
}
