/* (C)2026 */
package com.ammann.telemetry.support;

import com.ammann.telemetry.model.DataQuality;
import com.ammann.telemetry.model.StreamContext;
import com.ammann.telemetry.model.StreamSemantics;
import com.ammann.telemetry.model.TelemetryPoint;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

public final class TestSeries {

    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    /** Index of the single outlier in {@link #withOutlier()}. */
    public static final int OUTLIER_INDEX = 20;

    private TestSeries() {}

    /** Values cycling through 21.8, 21.9, 22.0, 22.1 and 22.2. */
    public static double[] steady(int count) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = 22 + 0.1 * ((i % 5) - 2);
        }
        return values;
    }

    /** Twenty steady readings followed by a single reading of 55. */
    public static double[] withOutlier() {
        double[] values = new double[OUTLIER_INDEX + 1];
        System.arraycopy(steady(OUTLIER_INDEX), 0, values, 0, OUTLIER_INDEX);
        values[OUTLIER_INDEX] = 55;
        return values;
    }

    public static double[] constant(int count, double value) {
        double[] values = new double[count];
        Arrays.fill(values, value);
        return values;
    }

    public static double[] ramp(int count) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = i;
        }
        return values;
    }

    public static double[] sine(int count, int period) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = Math.sin(2 * Math.PI * i / period);
        }
        return values;
    }

    /** Seeded standard normal noise. */
    public static double[] noise(int count, long seed) {
        Random random = new Random(seed);
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = random.nextGaussian();
        }
        return values;
    }

    /** Seeded Gaussian random walk. */
    public static double[] randomWalk(int count, long seed) {
        double[] steps = noise(count, seed);
        double[] values = new double[count];
        double level = 0;
        for (int i = 0; i < count; i++) {
            level += steps[i];
            values[i] = level;
        }
        return values;
    }

    /** {@code values} delayed by {@code delay} samples, padded with the first value. */
    public static double[] delayed(double[] values, int delay) {
        double[] shifted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            shifted[i] = values[Math.max(0, i - delay)];
        }
        return shifted;
    }

    /** Timestamps one second apart, newest first, ending at {@link #NOW}. */
    public static List<Instant> newestFirst(int count) {
        List<Instant> timestamps = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            timestamps.add(NOW.minusSeconds(i));
        }
        return timestamps;
    }

    public static List<TelemetryPoint> points(double[] values) {
        List<Instant> timestamps = newestFirst(values.length);
        List<TelemetryPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new TelemetryPoint(timestamps.get(i), values[i], "temperature", "°C"));
        }
        return points;
    }

    public static StreamContext stream(String streamId, double[] values) {
        return stream(streamId, values, newestFirst(values.length));
    }

    public static StreamContext stream(String streamId, double[] values, List<Instant> timestamps) {
        StreamSemantics semantics = StreamSemantics.infer(streamId);
        return new StreamContext(
                streamId,
                "temperature",
                "°C",
                values,
                timestamps,
                DataQuality.perfect(),
                values.length,
                null,
                semantics.valueType(),
                semantics.valueRange());
    }
}
