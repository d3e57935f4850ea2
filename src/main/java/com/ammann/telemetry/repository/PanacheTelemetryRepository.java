/* (C)2026 */
package com.ammann.telemetry.repository;

import com.ammann.telemetry.model.TelemetryPoint;
import com.ammann.telemetry.model.TelemetryTick;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * {@link TelemetryRepository} backed by the {@code telemetry_tick} hypertable.
 */
@ApplicationScoped
@Transactional(Transactional.TxType.SUPPORTS)
public class PanacheTelemetryRepository implements TelemetryRepository {

    private static final Logger LOG = Logger.getLogger(PanacheTelemetryRepository.class);

    @Override
    public List<TelemetryPoint> findRecent(String streamId, int count) {
        List<TelemetryPoint> points =
                TelemetryTick.findRecent(streamId, count).stream()
                        .map(TelemetryTick::toPoint)
                        .toList();
        LOG.debugf("Loaded %d recent ticks for stream %s", points.size(), streamId);
        return points;
    }

    @Override
    public List<TelemetryPoint> findInWindow(
            String streamId, Instant from, Instant to, int limit) {
        List<TelemetryPoint> points =
                TelemetryTick.findInWindow(streamId, from, to, limit).stream()
                        .map(TelemetryTick::toPoint)
                        .toList();
        LOG.debugf(
                "Loaded %d ticks for stream %s between %s and %s",
                points.size(), streamId, from, to);
        return points;
    }

    @Override
    public Optional<TelemetryPoint> findOldest(String streamId) {
        return Optional.ofNullable(TelemetryTick.findOldest(streamId)).map(TelemetryTick::toPoint);
    }

    @Override
    public List<String> findActiveStreamIds(Instant since) {
        return TelemetryTick.findActiveSensorIds(since);
    }

    @Override
    public long countSince(Instant since) {
        return TelemetryTick.countSince(since);
    }
}
