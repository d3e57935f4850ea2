/* (C)2026 */
package com.ammann.telemetry.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.concurrent.TimeUnit;
import org.jboss.logging.Logger;

/**
 * Prometheus metrics for stream fetches and completed analyses.
 *
 * <p>Safe to use without a registry: every call is then a no-op.
 */
@ApplicationScoped
public class AnalysisMetrics {

    private static final Logger LOG = Logger.getLogger(AnalysisMetrics.class);

    public static final String FETCH_COUNTER = "telemetry_stream_fetch_total";
    public static final String FETCH_TIMER = "telemetry_stream_fetch_duration";
    public static final String ANALYSIS_COUNTER = "telemetry_analysis_total";

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_NOT_FOUND = "not_found";
    public static final String OUTCOME_ERROR = "error";

    private final MeterRegistry registry;

    @Inject
    public AnalysisMetrics(Instance<MeterRegistry> registries) {
        this(registries.isResolvable() ? registries.get() : null);
    }

    AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;
        if (registry == null) {
            LOG.warn("MeterRegistry not available - analysis metrics disabled");
        }
    }

    /** Returns an instance that records nothing. */
    public static AnalysisMetrics noop() {
        return new AnalysisMetrics((MeterRegistry) null);
    }

    /**
     * Records one storage fetch.
     *
     * @param outcome {@link #OUTCOME_SUCCESS}, {@link #OUTCOME_NOT_FOUND} or {@link
     *     #OUTCOME_ERROR}
     * @param durationNanos elapsed time of the fetch
     */
    public void recordFetch(String outcome, long durationNanos) {
        if (registry == null) return;
        Counter.builder(FETCH_COUNTER)
                .description("Stream fetches from the telemetry store")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder(FETCH_TIMER)
                .description("Duration of stream fetches from the telemetry store")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /** Counts one completed analysis of the given method. */
    public void recordAnalysis(String method) {
        if (registry == null) return;
        Counter.builder(ANALYSIS_COUNTER)
                .description("Completed stream analyses")
                .tag("method", method)
                .register(registry)
                .increment();
    }
}
