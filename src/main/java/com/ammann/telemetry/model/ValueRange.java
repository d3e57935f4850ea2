/* (C)2026 */
package com.ammann.telemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Declared value range of a stream.
 *
 * @param min lowest plausible value
 * @param max highest plausible value
 * @param values admissible discrete values, {@code null} for continuous ranges
 * @param unit unit the bounds are expressed in, may be {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValueRange(double min, double max, List<Double> values, String unit) {

    public static ValueRange binary() {
        return new ValueRange(0, 1, List.of(0.0, 1.0), null);
    }

    public static ValueRange percentage() {
        return new ValueRange(0, 100, null, "%");
    }

    public static ValueRange temperature() {
        return new ValueRange(15, 30, null, "°C");
    }

    public static ValueRange of(double min, double max) {
        return new ValueRange(min, max, null, null);
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
