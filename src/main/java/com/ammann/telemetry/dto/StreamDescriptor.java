/* (C)2026 */
package com.ammann.telemetry.dto;

import com.ammann.telemetry.model.StreamContext;

/**
 * Identity of a stream taking part in a multi-stream analysis.
 *
 * @param streamId stream identifier
 * @param sensorType sensor type label
 * @param unit physical unit
 */
public record StreamDescriptor(String streamId, String sensorType, String unit) {

    public static StreamDescriptor from(StreamContext context) {
        return new StreamDescriptor(context.streamId(), context.sensorType(), context.unit());
    }
}
