/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.config.ExecutorProducer;
import com.ammann.telemetry.enumeration.StreamCategory;
import com.ammann.telemetry.exception.InvalidParameterException;
import com.ammann.telemetry.exception.StreamNotFoundException;
import com.ammann.telemetry.model.DataQuality;
import com.ammann.telemetry.model.StreamContext;
import com.ammann.telemetry.model.StreamMetadata;
import com.ammann.telemetry.model.StreamQuery;
import com.ammann.telemetry.model.StreamSemantics;
import com.ammann.telemetry.model.TelemetryPoint;
import com.ammann.telemetry.model.TimeRange;
import com.ammann.telemetry.repository.TelemetryRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Loads stream slices from the telemetry store and turns them into {@link StreamContext}s.
 *
 * <p>Every fetch attaches the sensor metadata of the newest point, a quality snapshot and
 * the value semantics inferred from the stream id. An empty result is a {@link
 * StreamNotFoundException}. Multi-stream fetches run concurrently on the {@value
 * ExecutorProducer#STREAM_FETCH_EXECUTOR}, falling back to the calling thread once its queue
 * is full; a stream that fails to load is logged and left out of the result.
 */
@ApplicationScoped
public class StreamAccessService {

    private static final Logger LOG = Logger.getLogger(StreamAccessService.class);

    static final int DEFAULT_MULTI_STREAM_COUNT = 200;
    static final int INFO_SAMPLE_SIZE = 10;

    /** Maximum points returned by a time-window fetch without an explicit count. */
    @ConfigProperty(name = "telemetry.stream.window-limit", defaultValue = "1000")
    int windowLimit = 1000;

    /** Streams with a reading inside this window count as available. */
    @ConfigProperty(name = "telemetry.stream.discovery-window", defaultValue = "PT24H")
    Duration discoveryWindow = Duration.ofHours(24);

    private final TelemetryRepository repository;
    private final DataQualityService qualityService;
    private final Executor executor;
    private final AnalysisMetrics metrics;

    @Inject
    public StreamAccessService(
            TelemetryRepository repository,
            DataQualityService qualityService,
            @Named(ExecutorProducer.STREAM_FETCH_EXECUTOR) Executor executor,
            AnalysisMetrics metrics) {
        this.repository = repository;
        this.qualityService = qualityService;
        this.executor = executor;
        this.metrics = metrics;
    }

    /**
     * Fetches the slice a query selects: the points of its time range when one is set,
     * otherwise the newest {@code count} points.
     *
     * @param query slice selection
     * @param defaultCount count used when the query has none
     * @return fetched stream
     * @throws StreamNotFoundException if the slice is empty
     */
    public StreamContext fetch(StreamQuery query, int defaultCount) {
        TimeRange range = query.timeRange();
        if (range != null) {
            return getStreamTimeWindow(
                    query.streamId(), range.from(), range.to(), query.countOr(windowLimit));
        }
        return getStreamRecentData(query.streamId(), query.countOr(defaultCount));
    }

    /**
     * Fetches the newest points of a stream.
     *
     * @param streamId stream identifier
     * @param count maximum number of points
     * @return stream with points newest first
     * @throws InvalidParameterException if {@code count <= 0}
     * @throws StreamNotFoundException if the stream has no data
     */
    public StreamContext getStreamRecentData(String streamId, int count) {
        if (count <= 0) {
            throw InvalidParameterException.invalidParameter("count", count, "a positive integer");
        }
        return timed(
                () -> {
                    List<TelemetryPoint> points = repository.findRecent(streamId, count);
                    if (points.isEmpty()) {
                        throw StreamNotFoundException.noData(streamId);
                    }
                    LOG.debugf("Fetched %d recent points of %s", points.size(), streamId);
                    return toContext(streamId, points, null);
                });
    }

    public StreamContext getStreamTimeWindow(String streamId, Instant from, Instant to) {
        return getStreamTimeWindow(streamId, from, to, windowLimit);
    }

    /**
     * Fetches the points of a stream inside a time window.
     *
     * @param streamId stream identifier
     * @param from window start, inclusive
     * @param to window end, inclusive
     * @param limit maximum number of points
     * @return stream with points newest first and the requested window attached
     * @throws InvalidParameterException if {@code from} is after {@code to} or {@code limit <=
     *     0}
     * @throws StreamNotFoundException if the window holds no data
     */
    public StreamContext getStreamTimeWindow(
            String streamId, Instant from, Instant to, int limit) {
        TimeRange range = new TimeRange(from, to);
        if (limit <= 0) {
            throw InvalidParameterException.invalidParameter("limit", limit, "a positive integer");
        }
        return timed(
                () -> {
                    List<TelemetryPoint> points =
                            repository.findInWindow(streamId, from, to, limit);
                    if (points.isEmpty()) {
                        throw StreamNotFoundException.noDataInWindow(streamId, from, to);
                    }
                    LOG.debugf(
                            "Fetched %d points of %s between %s and %s",
                            points.size(), streamId, from, to);
                    return toContext(streamId, points, range);
                });
    }

    /**
     * Fetches several streams concurrently with the same selection.
     *
     * <p>Waits for every fetch to finish. Streams that fail are logged at WARN and omitted, so
     * the result may hold fewer entries than requested. Duplicate ids are fetched once.
     *
     * @param streamIds stream identifiers
     * @param count points per stream, {@code null} for 200 (or the window limit when a time
     *     range is given)
     * @param timeRange time window, {@code null} for most-recent fetches
     * @return fetched streams in request order
     */
    public Map<String, StreamContext> getMultipleStreams(
            Collection<String> streamIds, Integer count, TimeRange timeRange) {
        Map<String, StreamContext> streams =
                fetchAll(
                        streamIds,
                        id ->
                                fetch(
                                        new StreamQuery(id, count, timeRange),
                                        DEFAULT_MULTI_STREAM_COUNT));
        LOG.debugf("Loaded %d of %d requested streams", streams.size(), streamIds.size());
        return streams;
    }

    /**
     * Describes a stream from its ten newest points and its oldest point.
     *
     * <p>{@code totalPoints} and {@code averageSamplingRate} are estimates based on that
     * sample.
     *
     * @throws StreamNotFoundException if the stream has no data
     */
    public StreamMetadata getStreamInfo(String streamId) {
        List<TelemetryPoint> recent = repository.findRecent(streamId, INFO_SAMPLE_SIZE);
        if (recent.isEmpty()) {
            throw StreamNotFoundException.noData(streamId);
        }
        TelemetryPoint newest = recent.get(0);
        TelemetryPoint oldest =
                repository.findOldest(streamId).orElse(recent.get(recent.size() - 1));

        double spanSeconds = Duration.between(oldest.ts(), newest.ts()).toMillis() / 1000.0;
        double samplingRate = spanSeconds > 0 ? recent.size() / spanSeconds : 0;
        StreamSemantics semantics = StreamSemantics.infer(streamId);

        return new StreamMetadata(
                streamId,
                newest.sensorType(),
                newest.unit(),
                oldest.ts(),
                newest.ts(),
                recent.size(),
                samplingRate,
                semantics.valueType(),
                semantics.valueRange(),
                StreamCategory.fromStreamId(streamId));
    }

    /**
     * Enumerates the exact identifiers of all streams with recent activity.
     *
     * <p>A stream whose metadata cannot be loaded is logged and skipped. If the discovery
     * query itself fails the error is logged and an empty list returned.
     *
     * @return metadata of every active stream, sorted by id
     */
    public List<StreamMetadata> listAvailableStreams() {
        List<String> streamIds;
        try {
            streamIds = repository.findActiveStreamIds(Instant.now().minus(discoveryWindow));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Stream discovery failed");
            return List.of();
        }
        LOG.infof("Discovered %d active streams", streamIds.size());
        return new ArrayList<>(fetchAll(streamIds, this::getStreamInfo).values());
    }

    /** Active streams of one category. */
    public List<StreamMetadata> listAvailableStreams(StreamCategory category) {
        return listAvailableStreams().stream()
                .filter(metadata -> metadata.category() == category)
                .toList();
    }

    private <T> Map<String, T> fetchAll(Collection<String> ids, Function<String, T> loader) {
        Map<String, CompletableFuture<T>> pending = new LinkedHashMap<>();
        for (String id : new LinkedHashSet<>(ids)) {
            pending.put(id, submit(() -> loader.apply(id), executor));
        }

        Map<String, T> loaded = new LinkedHashMap<>();
        pending.forEach(
                (id, future) -> {
                    try {
                        loaded.put(id, future.join());
                    } catch (CompletionException e) {
                        Throwable cause = e.getCause() != null ? e.getCause() : e;
                        LOG.warnf(cause, "Failed to load stream %s, leaving it out", id);
                    }
                });
        return loaded;
    }

    /**
     * Runs a task on the fetch executor. When the executor's queue is full the task runs on
     * the calling thread instead, so no task is ever dropped.
     */
    static <T> CompletableFuture<T> submit(Supplier<T> task, Executor executor) {
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            LOG.debugf("Fetch executor saturated, running task on %s", Thread.currentThread());
            try {
                return CompletableFuture.completedFuture(task.get());
            } catch (RuntimeException failure) {
                return CompletableFuture.failedFuture(failure);
            }
        }
    }

    private StreamContext toContext(
            String streamId, List<TelemetryPoint> points, TimeRange timeRange) {
        TelemetryPoint newest = points.get(0);
        double[] values = points.stream().mapToDouble(TelemetryPoint::value).toArray();
        List<Instant> timestamps = points.stream().map(TelemetryPoint::ts).toList();
        DataQuality quality = qualityService.assessSnapshot(values, timestamps, null);
        StreamSemantics semantics = StreamSemantics.infer(streamId);

        return new StreamContext(
                streamId,
                newest.sensorType(),
                newest.unit(),
                values,
                timestamps,
                quality,
                values.length,
                timeRange,
                semantics.valueType(),
                semantics.valueRange());
    }

    private StreamContext timed(Supplier<StreamContext> fetch) {
        long start = System.nanoTime();
        String outcome = AnalysisMetrics.OUTCOME_ERROR;
        try {
            StreamContext context = fetch.get();
            outcome = AnalysisMetrics.OUTCOME_SUCCESS;
            return context;
        } catch (StreamNotFoundException e) {
            outcome = AnalysisMetrics.OUTCOME_NOT_FOUND;
            throw e;
        } finally {
            metrics.recordFetch(outcome, System.nanoTime() - start);
        }
    }
}
