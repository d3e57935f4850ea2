/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.dto.DataHealthTrend;
import com.ammann.telemetry.dto.QualityIssue;
import com.ammann.telemetry.dto.QualityPeriodComparison;
import com.ammann.telemetry.dto.QualityReport;
import com.ammann.telemetry.enumeration.HealthTrend;
import com.ammann.telemetry.enumeration.PeriodTrend;
import com.ammann.telemetry.enumeration.QualityGrade;
import com.ammann.telemetry.enumeration.QualityIssueType;
import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.exception.InvalidParameterException;
import com.ammann.telemetry.model.DataQuality;
import com.ammann.telemetry.model.StreamContext;
import com.ammann.telemetry.model.TimeGap;
import com.ammann.telemetry.model.TimeRange;
import com.ammann.telemetry.model.ValueRange;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Scores the quality of stream slices.
 *
 * <p>Two levels are provided. {@link #assessSnapshot} is the cheap check attached to every
 * fetched stream. {@link #assessReport} rates completeness, accuracy, consistency and
 * timeliness, averages them into an overall score and maps that to a letter grade.
 *
 * <p>Gap and rate based completeness checks need an expected sampling rate. Callers may pass
 * one; otherwise {@code telemetry.quality.default-sampling-rate-hz} is used when configured,
 * and the time-based checks are skipped when neither is present.
 */
@ApplicationScoped
public class DataQualityService {

    private static final Logger LOG = Logger.getLogger(DataQualityService.class);

    static final double SNAPSHOT_MISSING_WEIGHT = 0.3;
    static final double SNAPSHOT_GAP_TOLERANCE = 2.0;
    static final double SNAPSHOT_MAX_GAP_PENALTY = 0.2;
    static final double SNAPSHOT_OUTLIER_FENCE = 3.0;
    static final double SNAPSHOT_MAX_OUTLIER_PENALTY = 0.1;

    static final double REPORT_GAP_TOLERANCE = 2.5;
    static final double REPORT_OUTLIER_FENCE = 1.5;
    static final double COMPLETENESS_ISSUE_BELOW = 0.9;
    static final double COMPLETENESS_HIGH_BELOW = 0.7;
    static final double DRIFT_ISSUE_ABOVE = 0.3;
    static final double DRIFT_HIGH_ABOVE = 0.6;
    static final double NOISE_ISSUE_ABOVE = 0.4;
    static final int GAPS_HIGH_ABOVE = 5;

    static final int DEFAULT_HEALTH_WINDOW = 100;
    static final double TREND_DEADBAND = 0.05;
    static final double SIGNIFICANT_CHANGE = 0.1;
    static final int TREND_WINDOWS = 3;
    static final int MAX_REPORTED_CHANGES = 5;

    /** Sampling rate assumed when a caller supplies none. Unset disables gap checks. */
    @ConfigProperty(name = "telemetry.quality.default-sampling-rate-hz")
    Optional<Double> defaultSamplingRateHz = Optional.empty();

    private final CoreStatisticsService stats;

    @Inject
    public DataQualityService(CoreStatisticsService stats) {
        this.stats = stats;
    }

    /**
     * Quality snapshot attached to a freshly fetched stream.
     *
     * <p>Starts from 1.0 and subtracts 0.3 times the missing share, up to 0.2 for gaps longer
     * than twice the expected interval, and up to 0.1 for values outside a 3 x IQR fence.
     *
     * @param values sample values, {@code NaN} marking a missing sample
     * @param timestamps parallel timestamps
     * @param expectedSamplingRate expected rate in Hz, or {@code null}
     * @return snapshot with a score clamped to [0, 1]
     */
    public DataQuality assessSnapshot(
            double[] values, List<Instant> timestamps, Double expectedSamplingRate) {
        List<String> issues = new ArrayList<>();
        double score = 1.0;

        int missing = countMissing(values);
        if (missing > 0) {
            issues.add(missing + " missing/invalid values");
            score -= (double) missing / values.length * SNAPSHOT_MISSING_WEIGHT;
        }

        Double rate = resolveSamplingRate(expectedSamplingRate);
        List<TimeGap> gaps = List.of();
        if (rate != null && timestamps.size() > 1) {
            gaps = findGaps(timestamps, rate, SNAPSHOT_GAP_TOLERANCE);
            if (!gaps.isEmpty()) {
                issues.add(gaps.size() + " time gaps detected");
                score -=
                        Math.min(
                                SNAPSHOT_MAX_GAP_PENALTY, (double) gaps.size() / timestamps.size());
            }
        }

        double[] valid = finite(values);
        int suspicious = 0;
        if (valid.length > 2) {
            suspicious = outlierIndices(values, valid, SNAPSHOT_OUTLIER_FENCE).size();
            if (suspicious > 0) {
                issues.add(suspicious + " potential outliers detected");
                score -= Math.min(SNAPSHOT_MAX_OUTLIER_PENALTY, (double) suspicious / valid.length);
            }
        }

        return new DataQuality(Math.max(0, score), issues, missing, suspicious, gaps);
    }

    /**
     * Full quality report of one stream slice.
     *
     * @param stream fetched stream
     * @param expectedRange declared value range, or {@code null} to skip range checks
     * @param expectedSamplingRate expected rate in Hz, or {@code null}
     * @return report with issues ordered missing, outliers, range, drift, noise, gaps
     */
    public QualityReport assessReport(
            StreamContext stream, ValueRange expectedRange, Double expectedSamplingRate) {
        double[] values = stream.values();
        int n = values.length;
        Double rate = resolveSamplingRate(expectedSamplingRate);
        List<QualityIssue> issues = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        Completeness completeness = assessCompleteness(values, stream.timestamps(), rate);
        if (completeness.score() < COMPLETENESS_ISSUE_BELOW) {
            double incomplete = (1 - completeness.score()) * 100;
            issues.add(
                    new QualityIssue(
                            QualityIssueType.MISSING_DATA,
                            completeness.score() < COMPLETENESS_HIGH_BELOW
                                    ? Severity.HIGH
                                    : Severity.MEDIUM,
                            completeness.missingCount(),
                            incomplete,
                            String.format(
                                    Locale.ROOT,
                                    "%d data points missing (%.1f%% incomplete)",
                                    completeness.missingCount(),
                                    incomplete),
                            null,
                            "Check sensor connectivity and data pipeline"));
            recommendations.add("Investigate data collection reliability");
        }

        double[] valid = finite(values);
        List<Integer> outliers =
                valid.length > 0 ? outlierIndices(values, valid, REPORT_OUTLIER_FENCE) : List.of();
        if (!outliers.isEmpty()) {
            issues.add(
                    new QualityIssue(
                            QualityIssueType.OUTLIERS,
                            outliers.size() > n * 0.1 ? Severity.HIGH : Severity.MEDIUM,
                            outliers.size(),
                            percentOf(outliers.size(), n),
                            outliers.size() + " statistical outliers detected",
                            outliers,
                            "Review sensor calibration and environmental factors"));
        }

        List<Integer> violations = rangeViolations(values, expectedRange);
        if (!violations.isEmpty()) {
            issues.add(
                    new QualityIssue(
                            QualityIssueType.RANGE_VIOLATION,
                            Severity.HIGH,
                            violations.size(),
                            percentOf(violations.size(), n),
                            violations.size() + " values outside expected range",
                            violations,
                            "Validate sensor specifications and check for malfunctions"));
            recommendations.add("Verify sensor operating parameters");
        }

        double drift = driftScore(valid);
        if (drift > DRIFT_ISSUE_ABOVE) {
            issues.add(
                    new QualityIssue(
                            QualityIssueType.DRIFT,
                            drift > DRIFT_HIGH_ABOVE ? Severity.HIGH : Severity.MEDIUM,
                            1,
                            drift * 100,
                            String.format(
                                    Locale.ROOT, "Sensor drift detected (score: %.3f)", drift),
                            null,
                            "Schedule sensor recalibration"));
            recommendations.add("Monitor for continued drift and plan calibration");
        }

        double noise = noiseLevel(valid);
        if (noise > NOISE_ISSUE_ABOVE) {
            issues.add(
                    new QualityIssue(
                            QualityIssueType.NOISE,
                            Severity.MEDIUM,
                            1,
                            noise * 100,
                            String.format(
                                    Locale.ROOT,
                                    "High noise level detected (%.1f%%)",
                                    noise * 100),
                            null,
                            "Check for electrical interference or mechanical vibrations"));
        }

        List<TimeGap> gaps =
                rate != null && stream.timestamps().size() > 1
                        ? findGaps(stream.timestamps(), rate, REPORT_GAP_TOLERANCE)
                        : List.of();
        if (!gaps.isEmpty()) {
            long gapMs = gaps.stream().mapToLong(TimeGap::durationMs).sum();
            long spanMs = span(stream.timestamps()).toMillis();
            issues.add(
                    new QualityIssue(
                            QualityIssueType.GAPS,
                            gaps.size() > GAPS_HIGH_ABOVE ? Severity.HIGH : Severity.MEDIUM,
                            gaps.size(),
                            spanMs > 0 ? (double) gapMs / spanMs * 100 : 0,
                            String.format(
                                    Locale.ROOT,
                                    "%d time gaps found, total gap duration: %.1fs",
                                    gaps.size(),
                                    gapMs / 1000.0),
                            null,
                            "Investigate data transmission reliability"));
            recommendations.add("Improve data collection frequency and reliability");
        }

        int inaccurate = outliers.size() + violations.size();
        QualityReport.Assessment assessment =
                new QualityReport.Assessment(
                        completeness.score(),
                        1 - Math.max(drift, noise),
                        n > 0 ? 1 - Math.min(1, (double) inaccurate / n * 10) : 0,
                        Math.max(0, 1 - gaps.size() / 10.0));
        double overall = assessment.mean();

        if (overall < QualityGrade.B.getThreshold()) {
            recommendations.add("Consider implementing data validation checks");
        }
        if (issues.size() > 3) {
            recommendations.add("Prioritize addressing high-severity issues first");
        }

        LOG.debugf(
                "Quality of %s over %d samples: score=%.3f, %d issues",
                stream.streamId(), n, overall, issues.size());

        return new QualityReport(
                stream.streamId(),
                stream.sensorType(),
                stream.unit(),
                overall,
                QualityGrade.fromScore(overall),
                issues,
                recommendations,
                assessment,
                new QualityReport.Context(n, effectiveRange(stream), Instant.now()));
    }

    public DataHealthTrend monitorHealth(StreamContext stream) {
        return monitorHealth(stream, DEFAULT_HEALTH_WINDOW);
    }

    /**
     * Re-scores quality over half-overlapping windows in chronological order and classifies
     * the trend by comparing the mean of the three most recent window scores with the three
     * oldest.
     *
     * <p>A series no longer than one window is scored as a single window.
     *
     * @param stream fetched stream
     * @param windowSize samples per window
     * @return health trend with at most five of the latest significant step changes
     * @throws InvalidParameterException if {@code windowSize <= 0}
     */
    public DataHealthTrend monitorHealth(StreamContext stream, int windowSize) {
        if (windowSize <= 0) {
            throw InvalidParameterException.invalidParameter(
                    "windowSize", windowSize, "a positive integer");
        }
        StreamContext series = chronological(stream);
        int n = series.size();
        int step = Math.max(1, windowSize / 2);
        List<Double> scores = new ArrayList<>();
        List<Instant> centres = new ArrayList<>();

        for (int i = 0; i < n - windowSize; i += step) {
            StreamContext window = slice(series, i, i + windowSize);
            scores.add(assessReport(window, null, null).overallScore());
            centres.add(series.timestamps().get(i + windowSize / 2));
        }
        if (scores.isEmpty()) {
            scores.add(assessReport(series, null, null).overallScore());
            centres.add(n > 0 ? series.timestamps().get(n / 2) : null);
        }

        double recent =
                meanOf(scores.subList(Math.max(0, scores.size() - TREND_WINDOWS), scores.size()));
        double earlier = meanOf(scores.subList(0, Math.min(TREND_WINDOWS, scores.size())));
        HealthTrend trend;
        if (recent > earlier + TREND_DEADBAND) {
            trend = HealthTrend.IMPROVING;
        } else if (recent < earlier - TREND_DEADBAND) {
            trend = HealthTrend.DEGRADING;
        } else {
            trend = HealthTrend.STABLE;
        }

        List<DataHealthTrend.QualityChange> changes = new ArrayList<>();
        for (int i = 1; i < scores.size(); i++) {
            double change = scores.get(i) - scores.get(i - 1);
            if (Math.abs(change) > SIGNIFICANT_CHANGE) {
                boolean improved = change > 0;
                changes.add(
                        new DataHealthTrend.QualityChange(
                                centres.get(i),
                                improved ? "improvement" : "degradation",
                                Math.abs(change),
                                String.format(
                                        Locale.ROOT,
                                        "Quality score %s by %.1f%%",
                                        improved ? "improved" : "degraded",
                                        Math.abs(change) * 100)));
            }
        }
        List<DataHealthTrend.QualityChange> latest =
                changes.subList(Math.max(0, changes.size() - MAX_REPORTED_CHANGES), changes.size());

        LOG.debugf(
                "Health of %s over %d windows: %s (%.3f -> %.3f)",
                stream.streamId(), scores.size(), trend.getValue(), earlier, recent);

        return new DataHealthTrend(
                stream.streamId(), stream.sensorType(), recent, trend, scores.size(), latest);
    }

    /**
     * Diffs two reports of the same stream: overall trend with a 0.05 deadband, issue types
     * that appeared or were resolved, and dimensions that moved by more than 0.1.
     */
    public QualityPeriodComparison comparePeriods(QualityReport period1, QualityReport period2) {
        double scoreChange = period2.overallScore() - period1.overallScore();
        PeriodTrend direction;
        if (scoreChange > TREND_DEADBAND) {
            direction = PeriodTrend.IMPROVED;
        } else if (scoreChange < -TREND_DEADBAND) {
            direction = PeriodTrend.DEGRADED;
        } else {
            direction = PeriodTrend.UNCHANGED;
        }

        Set<QualityIssueType> types1 = issueTypes(period1);
        Set<QualityIssueType> types2 = issueTypes(period2);
        List<String> changes = new ArrayList<>();
        for (QualityIssueType type : types2) {
            if (!types1.contains(type)) {
                changes.add("New issue type appeared: " + type.getValue());
            }
        }
        for (QualityIssueType type : types1) {
            if (!types2.contains(type)) {
                changes.add("Issue type resolved: " + type.getValue());
            }
        }

        Map<String, Double> before = dimensions(period1.assessment());
        Map<String, Double> after = dimensions(period2.assessment());
        after.forEach(
                (dimension, score) -> {
                    double change = score - before.get(dimension);
                    if (Math.abs(change) > SIGNIFICANT_CHANGE) {
                        changes.add(
                                String.format(
                                        Locale.ROOT,
                                        "%s %s by %.1f%%",
                                        dimension,
                                        change > 0 ? "improved" : "degraded",
                                        Math.abs(change) * 100));
                    }
                });

        return new QualityPeriodComparison(
                period1.streamId(),
                period1.sensorType(),
                period1,
                period2,
                scoreChange,
                direction,
                changes);
    }

    Double resolveSamplingRate(Double requested) {
        if (requested != null) {
            if (!(requested > 0)) {
                throw InvalidParameterException.invalidParameter(
                        "expectedSamplingRate", requested, "a positive rate in Hz");
            }
            return requested;
        }
        return defaultSamplingRateHz.filter(rate -> rate > 0).orElse(null);
    }

    private Completeness assessCompleteness(
            double[] values, List<Instant> timestamps, Double rate) {
        int n = values.length;
        if (rate == null) {
            int missing = countMissing(values);
            return new Completeness(n > 0 ? (double) (n - missing) / n : 0, missing);
        }
        long expected = (long) Math.floor(span(timestamps).toMillis() / 1000.0 * rate);
        if (expected <= 0) {
            return new Completeness(1.0, 0);
        }
        return new Completeness(
                Math.min(1, (double) n / expected), (int) Math.max(0, expected - n));
    }

    private double driftScore(double[] valid) {
        double std = stats.std(valid);
        if (std <= 0) return 0;
        int midpoint = valid.length / 2;
        double first = stats.mean(Arrays.copyOfRange(valid, 0, midpoint));
        double second = stats.mean(Arrays.copyOfRange(valid, midpoint, valid.length));
        return Math.min(1, Math.abs(second - first) / std / 3);
    }

    /** Coefficient of variation clamped to [0, 1]; any spread around a zero mean is 1. */
    private double noiseLevel(double[] valid) {
        double std = stats.std(valid);
        if (std == 0) return 0;
        double mean = stats.mean(valid);
        if (mean == 0) return 1;
        return Math.min(1, std / Math.abs(mean));
    }

    private static List<TimeGap> findGaps(List<Instant> timestamps, double rate, double tolerance) {
        double allowedMs = 1000.0 / rate * tolerance;
        List<TimeGap> gaps = new ArrayList<>();
        for (int i = 1; i < timestamps.size(); i++) {
            TimeGap candidate = TimeGap.between(timestamps.get(i - 1), timestamps.get(i));
            if (candidate.durationMs() > allowedMs) {
                gaps.add(candidate);
            }
        }
        return gaps;
    }

    /** Indices of finite values outside a {@code fence x IQR} band around floor-index quartiles. */
    private static List<Integer> outlierIndices(double[] values, double[] valid, double fence) {
        double[] sorted = valid.clone();
        Arrays.sort(sorted);
        double q1 = sorted[(int) Math.floor(sorted.length * 0.25)];
        double q3 = sorted[(int) Math.floor(sorted.length * 0.75)];
        double iqr = q3 - q1;
        double lower = q1 - fence * iqr;
        double upper = q3 + fence * iqr;

        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            if (Double.isFinite(v) && (v < lower || v > upper)) {
                indices.add(i);
            }
        }
        return indices;
    }

    private static List<Integer> rangeViolations(double[] values, ValueRange range) {
        if (range == null) return List.of();
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (Double.isFinite(values[i]) && !range.contains(values[i])) {
                indices.add(i);
            }
        }
        return indices;
    }

    /** Returns the stream oldest first; storage delivers it newest first. */
    private static StreamContext chronological(StreamContext stream) {
        List<Instant> timestamps = stream.timestamps();
        if (timestamps.size() < 2
                || !timestamps.get(0).isAfter(timestamps.get(timestamps.size() - 1))) {
            return stream;
        }
        double[] values = stream.values();
        double[] reversedValues = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            reversedValues[i] = values[values.length - 1 - i];
        }
        List<Instant> reversedTimestamps = new ArrayList<>(timestamps);
        Collections.reverse(reversedTimestamps);
        return new StreamContext(
                stream.streamId(),
                stream.sensorType(),
                stream.unit(),
                reversedValues,
                reversedTimestamps,
                stream.quality(),
                stream.count(),
                stream.timeRange(),
                stream.valueType(),
                stream.valueRange());
    }

    private StreamContext slice(StreamContext stream, int from, int to) {
        double[] values = Arrays.copyOfRange(stream.values(), from, to);
        List<Instant> timestamps = stream.timestamps().subList(from, to);
        return new StreamContext(
                stream.streamId(),
                stream.sensorType(),
                stream.unit(),
                values,
                timestamps,
                assessSnapshot(values, timestamps, null),
                values.length,
                null,
                stream.valueType(),
                stream.valueRange());
    }

    private static TimeRange effectiveRange(StreamContext stream) {
        if (stream.timeRange() != null) return stream.timeRange();
        List<Instant> timestamps = stream.timestamps();
        if (timestamps.isEmpty()) return null;
        return new TimeRange(Collections.min(timestamps), Collections.max(timestamps));
    }

    private static Duration span(List<Instant> timestamps) {
        if (timestamps.size() < 2) return Duration.ZERO;
        return Duration.between(Collections.min(timestamps), Collections.max(timestamps));
    }

    private static Set<QualityIssueType> issueTypes(QualityReport report) {
        Set<QualityIssueType> types = EnumSet.noneOf(QualityIssueType.class);
        report.issues().forEach(issue -> types.add(issue.type()));
        return types;
    }

    private static Map<String, Double> dimensions(QualityReport.Assessment assessment) {
        Map<String, Double> dimensions = new LinkedHashMap<>();
        dimensions.put("completeness", assessment.completeness());
        dimensions.put("consistency", assessment.consistency());
        dimensions.put("accuracy", assessment.accuracy());
        dimensions.put("timeliness", assessment.timeliness());
        return dimensions;
    }

    private static int countMissing(double[] values) {
        return (int) Arrays.stream(values).filter(v -> !Double.isFinite(v)).count();
    }

    private static double[] finite(double[] values) {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    private static double percentOf(int count, int total) {
        return total > 0 ? (double) count / total * 100 : 0;
    }

    private static double meanOf(List<Double> scores) {
        return scores.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    private record Completeness(double score, int missingCount) {}
}
