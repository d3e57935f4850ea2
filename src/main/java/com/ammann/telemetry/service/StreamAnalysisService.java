/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.dto.AnalysisContext;
import com.ammann.telemetry.dto.AnalysisResult;
import com.ammann.telemetry.dto.ResultQuality;
import com.ammann.telemetry.enumeration.AnomalyMethod;
import com.ammann.telemetry.enumeration.MovingAverageType;
import com.ammann.telemetry.enumeration.PatternType;
import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.enumeration.TrendDirection;
import com.ammann.telemetry.model.StreamContext;
import com.ammann.telemetry.model.StreamQuery;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * Single-stream analyses wrapped in an {@link AnalysisResult}.
 *
 * <p>Each entry point fetches the selected slice, runs one analysis over its finite values,
 * and adds an interpretation text plus a confidence and reliability grade. Slices default to
 * the newest points; the default count differs per analysis.
 */
@ApplicationScoped
public class StreamAnalysisService {

    private static final Logger LOG = Logger.getLogger(StreamAnalysisService.class);

    static final int STATISTICS_COUNT = 200;
    static final int TREND_COUNT = 200;
    static final int ANOMALY_COUNT = 500;
    static final int PATTERN_COUNT = 300;
    static final int AUTOCORRELATION_COUNT = 400;
    static final int MOVING_AVERAGE_COUNT = 200;
    static final int CHANGE_POINT_COUNT = 300;

    static final Set<AnomalyMethod> DEFAULT_ANOMALY_METHODS =
            EnumSet.of(AnomalyMethod.Z_SCORE, AnomalyMethod.MODIFIED_Z_SCORE, AnomalyMethod.IQR);
    static final Set<PatternType> DEFAULT_PATTERN_TYPES =
            EnumSet.of(PatternType.PEAKS, PatternType.SPIKES, PatternType.CYCLES);

    /** Readings are assumed one second apart when converting slopes to hourly rates. */
    static final int SECONDS_PER_HOUR = 3600;

    private final StreamAccessService access;
    private final CoreStatisticsService stats;
    private final TimeSeriesAnalysisService timeSeries;
    private final PatternDetectionService patterns;
    private final AnomalyDetectionService anomalies;
    private final AnalysisMetrics metrics;

    @Inject
    public StreamAnalysisService(
            StreamAccessService access,
            CoreStatisticsService stats,
            TimeSeriesAnalysisService timeSeries,
            PatternDetectionService patterns,
            AnomalyDetectionService anomalies,
            AnalysisMetrics metrics) {
        this.access = access;
        this.stats = stats;
        this.timeSeries = timeSeries;
        this.patterns = patterns;
        this.anomalies = anomalies;
        this.metrics = metrics;
    }

    /** Descriptive statistics of the slice (default 200 points). */
    public AnalysisResult<CoreStatisticsService.BasicStatistics> analyzeStreamStatistics(
            StreamQuery query) {
        StreamContext stream = access.fetch(query, STATISTICS_COUNT);
        double[] values = stream.finiteValues();
        CoreStatisticsService.BasicStatistics result = stats.basicStatistics(values);

        String shape =
                result.skewness() > 1
                        ? "(right-skewed)"
                        : result.skewness() < -1 ? "(left-skewed)" : "(symmetric)";
        String unit = stream.unit();
        String interpretation =
                String.format(
                        Locale.ROOT,
                        "%s statistics: mean=%.3f%s, std=%.3f%s, range=[%.2f-%.2f]%s."
                                + " Distribution skewness=%.3f %s.",
                        stream.sensorType(),
                        result.mean(),
                        unit,
                        result.std(),
                        unit,
                        result.min(),
                        result.max(),
                        unit,
                        result.skewness(),
                        shape);

        return envelope(
                stream,
                "basic-statistics",
                result,
                interpretation,
                Math.min(0.95, values.length / 100.0),
                values.length,
                Map.of("method", "comprehensive"));
    }

    /** Least-squares trend of the slice (default 200 points). */
    public AnalysisResult<TimeSeriesAnalysisService.TrendResult> analyzeStreamTrend(
            StreamQuery query) {
        StreamContext stream = access.fetch(query, TREND_COUNT);
        double[] values = stream.finiteValues();
        TimeSeriesAnalysisService.TrendResult trend = timeSeries.linearTrend(values);

        StringBuilder interpretation =
                new StringBuilder(stream.sensorType())
                        .append(" shows ")
                        .append(trend.direction().getValue())
                        .append(" trend");
        if (trend.direction() != TrendDirection.STABLE) {
            interpretation.append(
                    String.format(
                            Locale.ROOT,
                            " at %.4f%s/hour",
                            Math.abs(trend.slope() * SECONDS_PER_HOUR),
                            stream.unit()));
        }
        interpretation.append(
                String.format(
                        Locale.ROOT,
                        ". Trend strength: %s (R²=%.3f)",
                        trend.strength().getValue(),
                        trend.rSquared()));

        return envelope(
                stream,
                "linear-trend-analysis",
                trend,
                interpretation.toString(),
                trend.rSquared(),
                values.length,
                Map.of("method", "least-squares"));
    }

    public AnalysisResult<AnomalyReport> analyzeStreamAnomalies(StreamQuery query) {
        return analyzeStreamAnomalies(query, null, null);
    }

    /**
     * Ensemble anomaly detection over the slice (default 500 points).
     *
     * @param query slice selection
     * @param methods detectors to combine, {@code null} for z-score, modified z-score and IQR
     * @param consensusThreshold required share of agreeing detectors, {@code null} for 0.6
     * @return anomalies ordered by consensus score, strongest first
     */
    public AnalysisResult<AnomalyReport> analyzeStreamAnomalies(
            StreamQuery query, Set<AnomalyMethod> methods, Double consensusThreshold) {
        Set<AnomalyMethod> effectiveMethods = methods != null ? methods : DEFAULT_ANOMALY_METHODS;
        double consensus =
                consensusThreshold != null
                        ? consensusThreshold
                        : AnomalyDetectionService.DEFAULT_CONSENSUS_THRESHOLD;

        StreamContext stream = access.fetch(query, ANOMALY_COUNT);
        double[] values = stream.finiteValues();
        List<AnomalyDetectionService.EnsembleAnomaly> found =
                anomalies.ensembleAnomalyDetection(values, effectiveMethods, consensus);

        Map<Severity, Integer> breakdown = new EnumMap<>(Severity.class);
        found.forEach(a -> breakdown.merge(a.severity(), 1, Integer::sum));
        List<AnomalyMethod> methodList = List.copyOf(EnumSet.copyOf(effectiveMethods));

        StringBuilder interpretation =
                new StringBuilder("Found ")
                        .append(found.size())
                        .append(" anomalies in ")
                        .append(stream.sensorType())
                        .append(" data");
        if (!found.isEmpty()) {
            String severities =
                    breakdown.entrySet().stream()
                            .map(e -> e.getValue() + " " + e.getKey().getValue())
                            .collect(Collectors.joining(", "));
            AnomalyDetectionService.EnsembleAnomaly top = found.get(0);
            Instant at = stream.finiteTimestamps().get(top.index());
            interpretation
                    .append(" (")
                    .append(severities)
                    .append(")")
                    .append(
                            String.format(
                                    Locale.ROOT,
                                    ". Most significant: %.2f score at %s",
                                    top.consensusScore(),
                                    at));
        }

        double confidence =
                found.stream()
                        .mapToDouble(AnomalyDetectionService.EnsembleAnomaly::confidence)
                        .min()
                        .orElse(1.0);
        AnomalyReport report =
                new AnomalyReport(
                        found,
                        found.size(),
                        values.length > 0 ? (double) found.size() / values.length : 0,
                        breakdown,
                        methodList);

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put(
                "methods", methodList.stream().map(AnomalyMethod::getValue).toList());
        parameters.put("consensusThreshold", consensus);
        return envelope(
                stream,
                "ensemble-anomaly-detection",
                report,
                interpretation.toString(),
                confidence,
                values.length,
                parameters);
    }

    public AnalysisResult<PatternReport> analyzeStreamPatterns(StreamQuery query) {
        return analyzeStreamPatterns(query, null);
    }

    /**
     * Pattern search over the slice (default 300 points).
     *
     * @param query slice selection
     * @param patternTypes pattern families to search, {@code null} for peaks, spikes and
     *     cycles
     * @return report with one entry per requested family; others are {@code null}
     */
    public AnalysisResult<PatternReport> analyzeStreamPatterns(
            StreamQuery query, Set<PatternType> patternTypes) {
        Set<PatternType> types =
                patternTypes != null && !patternTypes.isEmpty()
                        ? EnumSet.copyOf(patternTypes)
                        : DEFAULT_PATTERN_TYPES;

        StreamContext stream = access.fetch(query, PATTERN_COUNT);
        double[] values = stream.finiteValues();

        List<PatternDetectionService.Peak> peaks = null;
        List<PatternDetectionService.Valley> valleys = null;
        List<PatternDetectionService.Spike> spikes = null;
        TimeSeriesAnalysisService.CyclicPatterns cycles = null;
        List<PatternDetectionService.PatternMatch> repeating = null;

        StringBuilder interpretation =
                new StringBuilder("Pattern analysis for ")
                        .append(stream.sensorType())
                        .append(":");
        if (types.contains(PatternType.PEAKS)) {
            peaks = patterns.findPeaks(values);
            valleys = patterns.findValleys(values);
            interpretation.append(
                    String.format(
                            Locale.ROOT,
                            " %d peaks, %d valleys detected.",
                            peaks.size(),
                            valleys.size()));
        }
        if (types.contains(PatternType.SPIKES)) {
            spikes = patterns.detectSpikes(values);
            interpretation.append(
                    String.format(Locale.ROOT, " %d spikes found.", spikes.size()));
        }
        if (types.contains(PatternType.CYCLES)) {
            cycles = timeSeries.detectCyclicPatterns(values);
            if (!cycles.periods().isEmpty()) {
                String periods =
                        cycles.periods().stream()
                                .limit(3)
                                .map(String::valueOf)
                                .collect(Collectors.joining(", "));
                interpretation
                        .append(" Cyclical patterns detected at periods: ")
                        .append(periods)
                        .append(".");
            }
        }
        if (types.contains(PatternType.REPEATING)) {
            repeating = patterns.detectRepeatingSequences(values);
            interpretation.append(
                    String.format(
                            Locale.ROOT, " %d repeating sequences found.", repeating.size()));
        }

        return envelope(
                stream,
                "pattern-detection",
                new PatternReport(peaks, valleys, spikes, cycles, repeating),
                interpretation.toString(),
                Math.min(0.9, values.length / 200.0),
                values.length,
                Map.of(
                        "patternTypes",
                        types.stream().map(PatternType::getValue).toList()));
    }

    /**
     * Autocorrelation of the slice (default 400 points).
     *
     * @param maxLag highest lag, {@code null} for {@code min(n / 4, 50)}
     */
    public AnalysisResult<TimeSeriesAnalysisService.AutocorrelationResult>
            analyzeStreamAutocorrelation(StreamQuery query, Integer maxLag) {
        StreamContext stream = access.fetch(query, AUTOCORRELATION_COUNT);
        double[] values = stream.finiteValues();
        TimeSeriesAnalysisService.AutocorrelationResult result =
                timeSeries.autocorrelation(values, maxLag);

        StringBuilder interpretation =
                new StringBuilder("Autocorrelation analysis for ")
                        .append(stream.sensorType())
                        .append(": ")
                        .append(result.persistent() ? "Persistent" : "Non-persistent")
                        .append(" time series.");
        if (result.optimalLag() > 0) {
            interpretation.append(
                    String.format(
                            Locale.ROOT,
                            " Strongest autocorrelation at lag %d (%.3f).",
                            result.optimalLag(),
                            result.correlations()[result.optimalLag()]));
        }
        if (!result.significantLags().isEmpty()) {
            interpretation.append(
                    String.format(
                            Locale.ROOT,
                            " %d significant lags detected.",
                            result.significantLags().size()));
        }

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("maxLag", maxLag);
        return envelope(
                stream,
                "autocorrelation-analysis",
                result,
                interpretation.toString(),
                Math.min(0.9, values.length / 300.0),
                values.length,
                parameters);
    }

    /**
     * Moving average of the slice (default 200 points) and the mean absolute deviation of the
     * readings from it.
     *
     * @param window window size, {@code null} for {@code min(20, n / 10)} but at least 1;
     *     ignored by the exponential average
     * @param type average type, {@code null} for simple
     */
    public AnalysisResult<MovingAverageReport> analyzeStreamMovingAverage(
            StreamQuery query, Integer window, MovingAverageType type) {
        MovingAverageType effectiveType = type != null ? type : MovingAverageType.SIMPLE;
        StreamContext stream = access.fetch(query, MOVING_AVERAGE_COUNT);
        double[] values = stream.finiteValues();
        int effectiveWindow =
                window != null ? window : Math.max(1, Math.min(20, values.length / 10));

        double[] average =
                effectiveType == MovingAverageType.SIMPLE
                        ? timeSeries.simpleMovingAverage(values, effectiveWindow)
                        : timeSeries.exponentialMovingAverage(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - average[i]);
        }
        double averageDeviation = stats.mean(deviations);

        String interpretation =
                String.format(
                        Locale.ROOT,
                        "%s moving average for %s (window=%d): Average deviation from trend is"
                                + " %.3f%s",
                        effectiveType == MovingAverageType.SIMPLE ? "Simple" : "Exponential",
                        stream.sensorType(),
                        effectiveWindow,
                        averageDeviation,
                        stream.unit());

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("window", effectiveWindow);
        parameters.put("type", effectiveType.getValue());
        return envelope(
                stream,
                effectiveType.getValue() + "-moving-average",
                new MovingAverageReport(average, averageDeviation, effectiveWindow, effectiveType),
                interpretation,
                Math.min(0.95, values.length / 100.0),
                values.length,
                parameters);
    }

    /**
     * CUSUM change points of the slice (default 300 points).
     *
     * @param threshold CUSUM threshold in standard deviations, {@code null} for 2.0
     */
    public AnalysisResult<List<TimeSeriesAnalysisService.ChangePoint>> analyzeStreamChangePoints(
            StreamQuery query, Double threshold) {
        double effectiveThreshold =
                threshold != null
                        ? threshold
                        : TimeSeriesAnalysisService.DEFAULT_CHANGE_POINT_THRESHOLD;
        StreamContext stream = access.fetch(query, CHANGE_POINT_COUNT);
        double[] values = stream.finiteValues();
        List<TimeSeriesAnalysisService.ChangePoint> changes =
                timeSeries.detectChangePoints(values, effectiveThreshold);

        StringBuilder interpretation =
                new StringBuilder("Found ")
                        .append(changes.size())
                        .append(" change points in ")
                        .append(stream.sensorType())
                        .append(" data");
        if (!changes.isEmpty()) {
            TimeSeriesAnalysisService.ChangePoint largest = changes.get(0);
            for (TimeSeriesAnalysisService.ChangePoint change : changes) {
                if (Math.abs(change.afterMean() - change.beforeMean())
                        > Math.abs(largest.afterMean() - largest.beforeMean())) {
                    largest = change;
                }
            }
            interpretation.append(
                    String.format(
                            Locale.ROOT,
                            ". Largest shift: %.3f%s to %.3f%s at %s",
                            largest.beforeMean(),
                            stream.unit(),
                            largest.afterMean(),
                            stream.unit(),
                            stream.finiteTimestamps().get(largest.index())));
        }

        return envelope(
                stream,
                "cusum-change-points",
                changes,
                interpretation.toString(),
                Math.min(0.9, values.length / 100.0),
                values.length,
                Map.of("threshold", effectiveThreshold));
    }

    private <T> AnalysisResult<T> envelope(
            StreamContext stream,
            String method,
            T result,
            String interpretation,
            double confidence,
            int sampleSize,
            Map<String, Object> parameters) {
        metrics.recordAnalysis(method);
        LOG.infof(
                "Completed %s for %s over %d samples (confidence %.2f)",
                method, stream.streamId(), sampleSize, confidence);
        return new AnalysisResult<>(
                stream.streamId(),
                stream.sensorType(),
                stream.unit(),
                method,
                result,
                interpretation,
                ResultQuality.of(stream.quality().score(), confidence),
                new AnalysisContext(sampleSize, stream.timeRange(), parameters));
    }

    /**
     * @param anomalies ensemble anomalies, strongest first
     * @param totalAnomalies number of anomalies
     * @param anomalyRate anomalies per analysed sample
     * @param severityBreakdown anomaly count per severity
     * @param methods detectors that voted
     */
    public record AnomalyReport(
            List<AnomalyDetectionService.EnsembleAnomaly> anomalies,
            int totalAnomalies,
            double anomalyRate,
            Map<Severity, Integer> severityBreakdown,
            List<AnomalyMethod> methods) {}

    /** Results per requested pattern family; families not requested are {@code null}. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PatternReport(
            List<PatternDetectionService.Peak> peaks,
            List<PatternDetectionService.Valley> valleys,
            List<PatternDetectionService.Spike> spikes,
            TimeSeriesAnalysisService.CyclicPatterns cycles,
            List<PatternDetectionService.PatternMatch> repeatingSequences) {}

    /**
     * @param movingAverage smoothed series, same length as the input
     * @param averageDeviation mean absolute deviation of the readings from the average
     * @param window window size used
     * @param type average type
     */
    public record MovingAverageReport(
            double[] movingAverage,
            double averageDeviation,
            int window,
            MovingAverageType type) {}
}
