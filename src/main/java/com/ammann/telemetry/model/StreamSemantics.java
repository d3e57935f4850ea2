/* (C)2026 */
package com.ammann.telemetry.model;

import com.ammann.telemetry.enumeration.ValueType;
import java.util.Locale;

/**
 * Value semantics of a stream, inferred from its identifier.
 *
 * <p>A fan state of 1 means "on", not "1 unit".
 *
 * @param valueType semantic class of the values
 * @param valueRange declared range, {@code null} for unranged continuous streams
 */
public record StreamSemantics(ValueType valueType, ValueRange valueRange) {

    public static StreamSemantics infer(String streamId) {
        String id = streamId == null ? "" : streamId.toLowerCase(Locale.ROOT);

        if (id.contains("occup") || id.contains("fan")) {
            return new StreamSemantics(ValueType.BINARY, ValueRange.binary());
        }
        if (id.contains("output")
                || id.contains("valve")
                || id.contains("heat")
                || id.contains("cool")) {
            return new StreamSemantics(ValueType.PERCENTAGE, ValueRange.percentage());
        }
        if (id.contains("temp") || id.contains("setpt")) {
            return new StreamSemantics(ValueType.CONTINUOUS, ValueRange.temperature());
        }
        return new StreamSemantics(ValueType.CONTINUOUS, null);
    }
}
