/* (C)2026 */
package com.ammann.telemetry.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the named ManagedExecutor that runs concurrent stream fetches.
 *
 * <p>Provides the "stream-fetch-executor" bean used by StreamAccessService. Each stream of
 * a multi-stream request is fetched as an independent task on this executor.
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String STREAM_FETCH_EXECUTOR = "stream-fetch-executor";

    @ConfigProperty(name = "telemetry.stream.fetch.max-async", defaultValue = "4")
    int maxAsync = 4;

    @ConfigProperty(name = "telemetry.stream.fetch.max-queued", defaultValue = "64")
    int maxQueued = 64;

    /**
     * Produces the fetch executor.
     *
     * <p>Configuration properties:
     * <ul>
     *   <li>telemetry.stream.fetch.max-async</li>
     *   <li>telemetry.stream.fetch.max-queued</li>
     * </ul>
     *
     * @return configured ManagedExecutor instance
     */
    @Produces
    @Named(STREAM_FETCH_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createStreamFetchExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(maxQueued)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }

    void shutdown(@Disposes @Named(STREAM_FETCH_EXECUTOR) ManagedExecutor executor) {
        executor.shutdown();
    }
}
