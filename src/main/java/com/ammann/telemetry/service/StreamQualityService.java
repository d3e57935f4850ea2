/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.config.ExecutorProducer;
import com.ammann.telemetry.dto.DataHealthTrend;
import com.ammann.telemetry.dto.QualityPeriodComparison;
import com.ammann.telemetry.dto.QualityReport;
import com.ammann.telemetry.model.StreamContext;
import com.ammann.telemetry.model.StreamQuery;
import com.ammann.telemetry.model.TimeRange;
import com.ammann.telemetry.model.ValueRange;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.jboss.logging.Logger;

/** Quality reports, health trends and period comparisons for stored streams. */
@ApplicationScoped
public class StreamQualityService {

    private static final Logger LOG = Logger.getLogger(StreamQualityService.class);

    static final int REPORT_COUNT = 500;

    private final StreamAccessService access;
    private final DataQualityService quality;
    private final Executor executor;
    private final AnalysisMetrics metrics;

    @Inject
    public StreamQualityService(
            StreamAccessService access,
            DataQualityService quality,
            @Named(ExecutorProducer.STREAM_FETCH_EXECUTOR) Executor executor,
            AnalysisMetrics metrics) {
        this.access = access;
        this.quality = quality;
        this.executor = executor;
        this.metrics = metrics;
    }

    public QualityReport assessStreamDataQuality(StreamQuery query) {
        return assessStreamDataQuality(query, null, null);
    }

    /**
     * Full quality report of a slice (default 500 points).
     *
     * @param expectedRange declared value range, {@code null} to skip range checks
     * @param expectedSamplingRate expected rate in Hz, {@code null} for the configured default
     */
    public QualityReport assessStreamDataQuality(
            StreamQuery query, ValueRange expectedRange, Double expectedSamplingRate) {
        StreamContext stream = access.fetch(query, REPORT_COUNT);
        QualityReport report = quality.assessReport(stream, expectedRange, expectedSamplingRate);
        metrics.recordAnalysis("quality-assessment");
        LOG.infof(
                "Quality of %s: %.3f (grade %s, %d issues)",
                stream.streamId(), report.overallScore(), report.grade(), report.issues().size());
        return report;
    }

    public DataHealthTrend monitorStreamHealth(String streamId, TimeRange timeRange) {
        return monitorStreamHealth(streamId, timeRange, DataQualityService.DEFAULT_HEALTH_WINDOW);
    }

    /**
     * Quality trend of a stream inside a time window.
     *
     * @param windowSize samples per scoring window
     */
    public DataHealthTrend monitorStreamHealth(
            String streamId, TimeRange timeRange, int windowSize) {
        StreamContext stream = access.fetch(StreamQuery.window(streamId, timeRange), REPORT_COUNT);
        DataHealthTrend trend = quality.monitorHealth(stream, windowSize);
        metrics.recordAnalysis("health-monitoring");
        LOG.infof(
                "Health of %s: %.3f, %s over %d windows",
                streamId, trend.healthScore(), trend.trend().getValue(), trend.windowCount());
        return trend;
    }

    /**
     * Compares the quality of two periods of the same stream. Both periods are fetched
     * concurrently; a failure of either fails the comparison.
     */
    public QualityPeriodComparison compareStreamQualityPeriods(
            String streamId, TimeRange period1, TimeRange period2) {
        CompletableFuture<QualityReport> first =
                StreamAccessService.submit(
                        () -> assessStreamDataQuality(StreamQuery.window(streamId, period1)),
                        executor);
        CompletableFuture<QualityReport> second =
                StreamAccessService.submit(
                        () -> assessStreamDataQuality(StreamQuery.window(streamId, period2)),
                        executor);

        QualityPeriodComparison comparison =
                quality.comparePeriods(join(first), join(second));
        metrics.recordAnalysis("quality-comparison");
        LOG.infof(
                "Quality of %s changed by %.3f between periods (%s)",
                streamId, comparison.scoreChange(), comparison.trendDirection().getValue());
        return comparison;
    }

    private static QualityReport join(CompletableFuture<QualityReport> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
