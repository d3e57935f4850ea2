/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.dto.MultiStreamResult;
import com.ammann.telemetry.dto.ResultQuality;
import com.ammann.telemetry.dto.StreamDescriptor;
import com.ammann.telemetry.enumeration.CausalityDirection;
import com.ammann.telemetry.enumeration.SynchronizedEventType;
import com.ammann.telemetry.exception.InvalidParameterException;
import com.ammann.telemetry.exception.StreamNotFoundException;
import com.ammann.telemetry.model.AlignedStreams;
import com.ammann.telemetry.model.StreamContext;
import com.ammann.telemetry.model.TimeRange;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * Cross-stream analyses wrapped in a {@link MultiStreamResult}.
 *
 * <p>All streams of a request are fetched concurrently, then truncated to a common length
 * with {@link AlignedStreams#align(Map)} before any computation runs. Two-stream operations
 * fail when either stream cannot be loaded. Set operations continue without streams that
 * failed to load, as long as two remain.
 */
@ApplicationScoped
public class MultiStreamAnalysisService {

    private static final Logger LOG = Logger.getLogger(MultiStreamAnalysisService.class);

    static final int CORRELATION_COUNT = 200;
    static final int CAUSALITY_COUNT = 300;
    static final int EVENT_COUNT = 500;
    static final int CASCADE_COUNT = 400;
    static final int MIN_STREAMS = 2;
    static final double FALLBACK_CONFIDENCE = 0.5;

    private final StreamAccessService access;
    private final CorrelationService correlation;
    private final AnalysisMetrics metrics;

    @Inject
    public MultiStreamAnalysisService(
            StreamAccessService access, CorrelationService correlation, AnalysisMetrics metrics) {
        this.access = access;
        this.correlation = correlation;
        this.metrics = metrics;
    }

    /**
     * Pearson correlation of two streams, plus lagged cross-correlation when {@code maxLag}
     * is given.
     *
     * @param count points per stream, {@code null} for 200
     * @param timeRange time window, {@code null} for most-recent fetches
     * @param maxLag highest lag for cross-correlation, {@code null} to skip it
     * @throws StreamNotFoundException if either stream cannot be loaded
     */
    public MultiStreamResult<PairCorrelation> correlateTwoStreams(
            String streamId1,
            String streamId2,
            Integer count,
            TimeRange timeRange,
            Integer maxLag) {
        Map<String, StreamContext> streams =
                loadPair(streamId1, streamId2, count, CORRELATION_COUNT, timeRange);
        StreamContext first = streams.get(streamId1);
        StreamContext second = streams.get(streamId2);
        AlignedStreams aligned = AlignedStreams.align(streams);
        double[] x = aligned.get(streamId1);
        double[] y = aligned.get(streamId2);

        CorrelationService.CorrelationResult pearson = correlation.correlation(x, y);
        CorrelationService.CrossCorrelationResult cross =
                maxLag != null ? correlation.crossCorrelation(x, y, maxLag) : null;

        StringBuilder interpretation =
                new StringBuilder(
                        String.format(
                                Locale.ROOT,
                                "Correlation between %s and %s: %.3f (%s %s)",
                                first.sensorType(),
                                second.sensorType(),
                                pearson.correlation(),
                                pearson.strength().getValue(),
                                pearson.direction().getValue()));
        if (cross != null && Math.abs(cross.maxCorrelation()) > Math.abs(pearson.correlation())) {
            String leadLag;
            if (cross.optimalLag() > 0) {
                leadLag = first.sensorType() + " leads by " + cross.optimalLag();
            } else if (cross.optimalLag() < 0) {
                leadLag = second.sensorType() + " leads by " + Math.abs(cross.optimalLag());
            } else {
                leadLag = "synchronous";
            }
            interpretation.append(
                    String.format(
                            Locale.ROOT,
                            ". Best lagged correlation: %.3f (%s)",
                            cross.maxCorrelation(),
                            leadLag));
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("maxLag", maxLag);
        return envelope(
                streams,
                aligned,
                "pairwise-correlation",
                new PairCorrelation(pearson, cross),
                interpretation.toString(),
                minQuality(streams),
                Math.min(1, pearson.significance() / 10),
                timeRange,
                parameters);
    }

    /**
     * Correlation matrix of a set of streams.
     *
     * @param significanceThreshold minimum absolute correlation of a reported pair, {@code
     *     null} for 0.5
     * @throws InvalidParameterException if fewer than two ids are given
     * @throws StreamNotFoundException if fewer than two streams can be loaded
     */
    public MultiStreamResult<CorrelationService.CorrelationMatrix> correlateMultipleStreams(
            List<String> streamIds,
            Integer count,
            TimeRange timeRange,
            Double significanceThreshold) {
        double threshold =
                significanceThreshold != null
                        ? significanceThreshold
                        : CorrelationService.DEFAULT_SIGNIFICANCE_THRESHOLD;
        Map<String, StreamContext> streams =
                loadSet(streamIds, count, CORRELATION_COUNT, timeRange);
        AlignedStreams aligned = AlignedStreams.align(streams);
        CorrelationService.CorrelationMatrix matrix =
                correlation.correlationMatrix(aligned.series(), threshold);

        StringBuilder interpretation =
                new StringBuilder("Correlation matrix for ")
                        .append(streams.size())
                        .append(" streams");
        if (matrix.strongPairs().isEmpty()) {
            interpretation.append(". No significant correlations found.");
        } else {
            interpretation
                    .append(". Found ")
                    .append(matrix.strongPairs().size())
                    .append(" significant relationships:");
            matrix.strongPairs().stream()
                    .limit(3)
                    .forEach(
                            pair ->
                                    interpretation.append(
                                            String.format(
                                                    Locale.ROOT,
                                                    " %s-%s: %.3f (%s)",
                                                    streams.get(pair.stream1()).sensorType(),
                                                    streams.get(pair.stream2()).sensorType(),
                                                    pair.correlation(),
                                                    pair.significance().getValue())));
        }

        return envelope(
                streams,
                aligned,
                "correlation-matrix",
                matrix,
                interpretation.toString(),
                meanQuality(streams),
                Math.min(0.9, aligned.length() / 100.0),
                timeRange,
                Map.of("significanceThreshold", threshold));
    }

    /**
     * Causality approximation between two streams.
     *
     * @param maxLag highest lag tested, {@code null} for 5
     * @throws StreamNotFoundException if either stream cannot be loaded
     */
    public MultiStreamResult<CorrelationService.CausalityResult> testStreamCausality(
            String streamId1,
            String streamId2,
            Integer count,
            TimeRange timeRange,
            Integer maxLag) {
        int lag = maxLag != null ? maxLag : CorrelationService.DEFAULT_CAUSALITY_MAX_LAG;
        Map<String, StreamContext> streams =
                loadPair(streamId1, streamId2, count, CAUSALITY_COUNT, timeRange);
        String type1 = streams.get(streamId1).sensorType();
        String type2 = streams.get(streamId2).sensorType();
        AlignedStreams aligned = AlignedStreams.align(streams);
        CorrelationService.CausalityResult causality =
                correlation.detectCausality(aligned.get(streamId1), aligned.get(streamId2), lag);

        String verdict;
        switch (causality.causality()) {
            case X_CAUSES_Y:
                verdict = type1 + " causes " + type2;
                break;
            case Y_CAUSES_X:
                verdict = type2 + " causes " + type1;
                break;
            case BIDIRECTIONAL:
                verdict = "Bidirectional causality detected";
                break;
            default:
                verdict = "No causal relationship detected";
        }
        StringBuilder interpretation =
                new StringBuilder("Granger causality test between ")
                        .append(type1)
                        .append(" and ")
                        .append(type2)
                        .append(": ")
                        .append(verdict);
        if (causality.causality() != CausalityDirection.NO_CAUSALITY) {
            interpretation.append(
                    String.format(
                            Locale.ROOT,
                            " (strength: %.3f, optimal lag: %d, confidence: %.1f%%)",
                            causality.strength(),
                            causality.optimalLag(),
                            causality.confidence() * 100));
        }

        return envelope(
                streams,
                aligned,
                "granger-causality",
                causality,
                interpretation.toString(),
                minQuality(streams),
                causality.confidence(),
                timeRange,
                Map.of("maxLag", lag));
    }

    /**
     * Events where at least two streams exceed the z-score threshold together.
     *
     * @param timeWindow merge distance in samples, {@code null} for 3
     * @param threshold z-score threshold, {@code null} for 2.0
     * @throws InvalidParameterException if fewer than two ids are given
     * @throws StreamNotFoundException if fewer than two streams can be loaded
     */
    public MultiStreamResult<SynchronizedEventReport> detectSynchronizedStreamEvents(
            List<String> streamIds,
            Integer count,
            TimeRange timeRange,
            Integer timeWindow,
            Double threshold) {
        int window = timeWindow != null ? timeWindow : CorrelationService.DEFAULT_EVENT_WINDOW;
        double zThreshold =
                threshold != null ? threshold : CorrelationService.DEFAULT_EVENT_THRESHOLD;
        Map<String, StreamContext> streams = loadSet(streamIds, count, EVENT_COUNT, timeRange);
        AlignedStreams aligned = AlignedStreams.align(streams);
        List<CorrelationService.SynchronizedEvent> events =
                correlation.detectSynchronizedEvents(aligned.series(), window, zThreshold);

        Map<SynchronizedEventType, Integer> byType = new EnumMap<>(SynchronizedEventType.class);
        events.forEach(e -> byType.merge(e.eventType(), 1, Integer::sum));

        StringBuilder interpretation =
                new StringBuilder("Synchronized event analysis across ")
                        .append(streams.size())
                        .append(" streams");
        if (events.isEmpty()) {
            interpretation.append(". No synchronized events detected.");
        } else {
            CorrelationService.SynchronizedEvent strongest = events.get(0);
            interpretation
                    .append(": Found ")
                    .append(events.size())
                    .append(" synchronized events. Event types: ")
                    .append(
                            byType.entrySet().stream()
                                    .map(e -> e.getValue() + " " + e.getKey().getValue())
                                    .collect(Collectors.joining(", ")))
                    .append(". Strongest event involved ")
                    .append(sensorTypes(streams, strongest.streams()))
                    .append(
                            String.format(
                                    Locale.ROOT,
                                    " with correlation %.3f.",
                                    strongest.correlationScore()));
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("timeWindow", window);
        parameters.put("threshold", zThreshold);
        return envelope(
                streams,
                aligned,
                "synchronized-events",
                new SynchronizedEventReport(events, events.size(), byType),
                interpretation.toString(),
                meanQuality(streams),
                Math.min(
                        0.9,
                        events.isEmpty()
                                ? FALLBACK_CONFIDENCE
                                : events.get(0).correlationScore()),
                timeRange,
                parameters);
    }

    /**
     * Lead/follow relationships that suggest failures propagating between streams.
     *
     * @param maxDelay highest delay tested in samples, {@code null} for 10
     * @throws InvalidParameterException if fewer than two ids are given
     * @throws StreamNotFoundException if fewer than two streams can be loaded
     */
    public MultiStreamResult<List<CorrelationService.Cascade>> analyzeCascadingStreamFailures(
            List<String> streamIds, Integer count, TimeRange timeRange, Integer maxDelay) {
        int delay = maxDelay != null ? maxDelay : CorrelationService.DEFAULT_MAX_DELAY;
        Map<String, StreamContext> streams = loadSet(streamIds, count, CASCADE_COUNT, timeRange);
        AlignedStreams aligned = AlignedStreams.align(streams);
        List<CorrelationService.Cascade> cascades =
                correlation.analyzeCascadingFailures(aligned.series(), delay);

        StringBuilder interpretation =
                new StringBuilder("Cascading failure analysis for ")
                        .append(streams.size())
                        .append(" streams");
        if (cascades.isEmpty()) {
            interpretation.append(". No cascading failure patterns detected.");
        } else {
            CorrelationService.Cascade top = cascades.get(0);
            interpretation
                    .append(": Found ")
                    .append(cascades.size())
                    .append(" potential cascade patterns. Primary initiator: ")
                    .append(streams.get(top.initiator()).sensorType())
                    .append(String.format(Locale.ROOT, " (strength: %.3f)", top.cascadeStrength()));
            if (!top.followers().isEmpty()) {
                List<String> followers =
                        top.followers().stream().map(CorrelationService.Follower::stream).toList();
                interpretation
                        .append(", affects: ")
                        .append(sensorTypes(streams, followers))
                        .append(", typical delays: ")
                        .append(
                                top.followers().stream()
                                        .map(f -> String.valueOf(f.delay()))
                                        .collect(Collectors.joining(", ")))
                        .append(" time units");
            }
        }

        return envelope(
                streams,
                aligned,
                "cascading-failures",
                cascades,
                interpretation.toString(),
                meanQuality(streams),
                cascades.isEmpty()
                        ? FALLBACK_CONFIDENCE
                        : Math.min(1, cascades.get(0).cascadeStrength()),
                timeRange,
                Map.of("maxDelay", delay));
    }

    private Map<String, StreamContext> loadPair(
            String streamId1,
            String streamId2,
            Integer count,
            int defaultCount,
            TimeRange timeRange) {
        Map<String, StreamContext> streams =
                access.getMultipleStreams(
                        List.of(streamId1, streamId2), countOr(count, defaultCount), timeRange);
        List<String> missing = new ArrayList<>();
        for (String id : new LinkedHashSet<>(List.of(streamId1, streamId2))) {
            if (!streams.containsKey(id)) {
                missing.add(id);
            }
        }
        if (!missing.isEmpty()) {
            throw StreamNotFoundException.failedToLoad(missing);
        }
        return streams;
    }

    private Map<String, StreamContext> loadSet(
            List<String> streamIds, Integer count, int defaultCount, TimeRange timeRange) {
        Set<String> distinct = new LinkedHashSet<>(streamIds);
        if (distinct.size() < MIN_STREAMS) {
            throw InvalidParameterException.insufficientStreams(MIN_STREAMS, distinct.size());
        }
        Map<String, StreamContext> streams =
                access.getMultipleStreams(distinct, countOr(count, defaultCount), timeRange);
        if (streams.size() < MIN_STREAMS) {
            List<String> missing =
                    distinct.stream().filter(id -> !streams.containsKey(id)).toList();
            throw StreamNotFoundException.failedToLoad(missing);
        }
        if (streams.size() < distinct.size()) {
            LOG.warnf(
                    "Continuing with %d of %d streams; %d could not be loaded",
                    streams.size(), distinct.size(), distinct.size() - streams.size());
        }
        return streams;
    }

    private <T> MultiStreamResult<T> envelope(
            Map<String, StreamContext> streams,
            AlignedStreams aligned,
            String method,
            T result,
            String interpretation,
            double dataQuality,
            double confidence,
            TimeRange timeRange,
            Map<String, Object> parameters) {
        metrics.recordAnalysis(method);
        LOG.infof(
                "Completed %s over %d streams aligned to %d samples",
                method, streams.size(), aligned.length());
        List<StreamDescriptor> descriptors =
                streams.values().stream().map(StreamDescriptor::from).toList();
        return new MultiStreamResult<>(
                descriptors,
                method,
                result,
                interpretation,
                ResultQuality.of(dataQuality, confidence),
                new MultiStreamResult.Context(
                        aligned.originalSizes(), aligned.length(), timeRange, parameters));
    }

    private static Integer countOr(Integer count, int defaultCount) {
        return count != null ? count : defaultCount;
    }

    private static double minQuality(Map<String, StreamContext> streams) {
        return streams.values().stream()
                .mapToDouble(s -> s.quality().score())
                .min()
                .orElse(0);
    }

    private static double meanQuality(Map<String, StreamContext> streams) {
        return streams.values().stream()
                .mapToDouble(s -> s.quality().score())
                .average()
                .orElse(0);
    }

    private static String sensorTypes(Map<String, StreamContext> streams, List<String> ids) {
        return ids.stream()
                .map(id -> streams.containsKey(id) ? streams.get(id).sensorType() : id)
                .collect(Collectors.joining(", "));
    }

    /**
     * @param correlation zero-lag Pearson correlation
     * @param crossCorrelation lagged correlation, absent unless a maximum lag was requested
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PairCorrelation(
            CorrelationService.CorrelationResult correlation,
            CorrelationService.CrossCorrelationResult crossCorrelation) {}

    /**
     * @param events merged events, strongest first
     * @param totalEvents number of events
     * @param eventsByType event count per type
     */
    public record SynchronizedEventReport(
            List<CorrelationService.SynchronizedEvent> events,
            int totalEvents,
            Map<SynchronizedEventType, Integer> eventsByType) {}
}
