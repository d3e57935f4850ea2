/* (C)2026 */
package com.ammann.telemetry.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One sensor reading as written by the ingestion pipeline.
 *
 * <p>The table is a TimescaleDB hypertable partitioned on {@code ts}. All reads go through
 * the static finders below; the analysis layer never writes.
 */
@Entity
@Table(
        name = TelemetryTick.TABLE_NAME,
        indexes = {@Index(name = "idx_telemetry_sensor_ts", columnList = "sensor_id, ts")})
public class TelemetryTick extends PanacheEntity {
    public static final String TABLE_NAME = "telemetry_tick";

    /** Stream identifier, e.g. {@code fcu-01_04-spacetemp}. */
    @Column(name = "sensor_id", nullable = false, length = 128)
    @NotNull
    public String sensorId;

    /** Free-form sensor type label; may be absent for older rows. */
    @Column(name = "sensor_type", length = 64)
    public String sensorType;

    @Column(name = "unit", length = 32)
    public String unit;

    /** Persona that owns the stream, if any. */
    @Column(name = "persona_name", length = 64)
    public String personaName;

    @Column(name = "ts", nullable = false)
    @NotNull
    public Instant ts;

    @Column(name = "value", nullable = false)
    public double value;

    public TelemetryTick() {}

    public TelemetryTick(String sensorId, Instant ts, double value) {
        this.sensorId = sensorId;
        this.ts = ts;
        this.value = value;
    }

    /**
     * Returns the newest {@code count} ticks of a stream, newest first.
     */
    public static List<TelemetryTick> findRecent(String sensorId, int count) {
        return find("sensorId = ?1 ORDER BY ts DESC", sensorId).range(0, count - 1).list();
    }

    /**
     * Returns ticks of a stream with {@code from <= ts <= to}, newest first, capped at
     * {@code limit} rows.
     */
    public static List<TelemetryTick> findInWindow(
            String sensorId, Instant from, Instant to, int limit) {
        return find("sensorId = ?1 AND ts BETWEEN ?2 AND ?3 ORDER BY ts DESC", sensorId, from, to)
                .range(0, limit - 1)
                .list();
    }

    public static TelemetryTick findOldest(String sensorId) {
        return find("sensorId = ?1 ORDER BY ts ASC", sensorId).firstResult();
    }

    /**
     * Distinct stream identifiers with at least one tick after {@code since}, sorted by name.
     */
    public static List<String> findActiveSensorIds(Instant since) {
        return getEntityManager()
                .createQuery(
                        "SELECT DISTINCT t.sensorId FROM TelemetryTick t WHERE t.ts > :since"
                                + " ORDER BY t.sensorId",
                        String.class)
                .setParameter("since", since)
                .getResultList();
    }

    public static long countSince(Instant since) {
        return count("ts > ?1", since);
    }

    /** Converts the row into the immutable point handed to the analysis layer. */
    public TelemetryPoint toPoint() {
        return new TelemetryPoint(
                ts,
                value,
                sensorType == null || sensorType.isBlank()
                        ? TelemetryPoint.UNKNOWN_SENSOR_TYPE
                        : sensorType,
                unit == null ? "" : unit);
    }

    @Override
    public String toString() {
        return String.format(
                Locale.ROOT,
                "TelemetryTick{id=%d, sensorId=%s, ts=%s, value=%.4f}", id, sensorId, ts, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TelemetryTick that)) return false;
        return Objects.equals(sensorId, that.sensorId) && Objects.equals(ts, that.ts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sensorId, ts);
    }
}
