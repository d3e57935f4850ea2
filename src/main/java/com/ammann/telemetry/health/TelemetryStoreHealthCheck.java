/* (C)2026 */
package com.ammann.telemetry.health;

import com.ammann.telemetry.repository.TelemetryRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * Readiness health check that verifies the telemetry store answers queries in time.
 *
 * <p>Reports DOWN if counting the readings of the last hour fails or takes longer than
 * one second. The recent reading count and the query latency are exposed as data.
 */
@Readiness
@ApplicationScoped
public class TelemetryStoreHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(TelemetryStoreHealthCheck.class);

    static final String NAME = "telemetry-store";
    static final long MAX_QUERY_MILLIS = 1000;

    @Inject TelemetryRepository repository;

    public TelemetryStoreHealthCheck() {}

    TelemetryStoreHealthCheck(TelemetryRepository repository) {
        this.repository = repository;
    }

    @Override
    @ActivateRequestContext
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();
            long recentCount = repository.countSince(start.minus(Duration.ofHours(1)));
            Duration queryTime = Duration.between(start, Instant.now());
            boolean performanceOk = queryTime.toMillis() < MAX_QUERY_MILLIS;

            return HealthCheckResponse.named(NAME)
                    .status(performanceOk)
                    .withData("recent-readings-1h", recentCount)
                    .withData("query-time-ms", queryTime.toMillis())
                    .withData("performance-ok", performanceOk)
                    .build();

        } catch (RuntimeException e) {
            LOG.errorf(e, "Telemetry store health check failed: %s", e.getMessage());
            return HealthCheckResponse.named(NAME)
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("store-accessible", false)
                    .build();
        }
    }
}
