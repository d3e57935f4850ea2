/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.enumeration.AnomalyMethod;
import com.ammann.telemetry.enumeration.Severity;
import com.ammann.telemetry.exception.InvalidParameterException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Outlier detectors and the consensus ensemble built on them.
 *
 * <p>Every detector is independent and degrades to an empty result for series below its
 * minimum size or without spread. Results are ordered by score, strongest first, and
 * reference samples by index.
 */
@ApplicationScoped
public class AnomalyDetectionService {

    private static final Logger LOG = Logger.getLogger(AnomalyDetectionService.class);

    public static final Set<AnomalyMethod> DEFAULT_ENSEMBLE_METHODS =
            Collections.unmodifiableSet(
                    EnumSet.of(
                            AnomalyMethod.Z_SCORE,
                            AnomalyMethod.MODIFIED_Z_SCORE,
                            AnomalyMethod.IQR,
                            AnomalyMethod.LOF));

    static final int MIN_POINTWISE_SAMPLES = 4;
    static final int MIN_ENSEMBLE_SAMPLES = 5;
    static final double DEFAULT_Z_THRESHOLD = 3.0;
    static final double DEFAULT_MODIFIED_Z_THRESHOLD = 3.5;
    static final double MAD_SCALE = 1.4826;
    static final double MODIFIED_Z_FACTOR = 0.6745;
    static final double DEFAULT_IQR_MULTIPLIER = 1.5;
    static final int DEFAULT_LOF_NEIGHBOURS = 5;
    static final double DEFAULT_LOF_THRESHOLD = 1.5;
    static final double MIN_REACH_DISTANCE = 1e-6;
    static final double DEFAULT_SEASONAL_THRESHOLD = 2.5;
    static final int DEFAULT_TREND_WINDOW = 20;
    static final double DEFAULT_TREND_THRESHOLD = 3.0;
    static final double DEFAULT_CONSENSUS_THRESHOLD = 0.6;
    static final int DEFAULT_ADAPTIVE_WINDOW = 50;
    static final double DEFAULT_SENSITIVITY = 3.0;

    private final CoreStatisticsService stats;
    private final TimeSeriesAnalysisService timeSeries;

    @Inject
    public AnomalyDetectionService(
            CoreStatisticsService stats, TimeSeriesAnalysisService timeSeries) {
        this.stats = stats;
        this.timeSeries = timeSeries;
    }

    public OutlierDetectionResult zScoreAnomalies(double[] values) {
        return zScoreAnomalies(values, DEFAULT_Z_THRESHOLD);
    }

    /** Points with {@code |z| > threshold}; severity tiers at 3, 3.5 and 4. */
    public OutlierDetectionResult zScoreAnomalies(double[] values, double threshold) {
        List<Anomaly> outliers = new ArrayList<>();
        double std = stats.std(values);
        if (values.length >= MIN_POINTWISE_SAMPLES && std > 0) {
            double mean = stats.mean(values);
            for (int i = 0; i < values.length; i++) {
                double z = Math.abs(values[i] - mean) / std;
                if (z > threshold) {
                    outliers.add(
                            new Anomaly(
                                    i,
                                    values[i],
                                    z,
                                    AnomalyMethod.Z_SCORE,
                                    Severity.tiered(z, 3, 3.5, 4),
                                    Math.min(0.99, z / 5)));
                }
            }
        }
        return OutlierDetectionResult.of(outliers, threshold, AnomalyMethod.Z_SCORE);
    }

    public OutlierDetectionResult modifiedZScore(double[] values) {
        return modifiedZScore(values, DEFAULT_MODIFIED_Z_THRESHOLD);
    }

    /**
     * Median/MAD based score {@code 0.6745 * (x - median) / (1.4826 * MAD)}; severity tiers
     * at 4, 4.5 and 5. A zero MAD yields no anomalies.
     */
    public OutlierDetectionResult modifiedZScore(double[] values, double threshold) {
        List<Anomaly> outliers = new ArrayList<>();
        if (values.length >= MIN_POINTWISE_SAMPLES) {
            double median = stats.median(values);
            double[] deviations = Arrays.stream(values).map(v -> Math.abs(v - median)).toArray();
            double mad = stats.median(deviations);
            if (mad > 0) {
                for (int i = 0; i < values.length; i++) {
                    double score =
                            Math.abs(MODIFIED_Z_FACTOR * (values[i] - median) / (mad * MAD_SCALE));
                    if (score > threshold) {
                        outliers.add(
                                new Anomaly(
                                        i,
                                        values[i],
                                        score,
                                        AnomalyMethod.MODIFIED_Z_SCORE,
                                        Severity.tiered(score, 4, 4.5, 5),
                                        Math.min(0.99, score / 6)));
                    }
                }
            }
        }
        return OutlierDetectionResult.of(outliers, threshold, AnomalyMethod.MODIFIED_Z_SCORE);
    }

    public OutlierDetectionResult iqrOutliers(double[] values) {
        return iqrOutliers(values, DEFAULT_IQR_MULTIPLIER);
    }

    /**
     * Points outside {@code [Q1 - k * IQR, Q3 + k * IQR]}. The score is the distance past the
     * nearer fence in IQR units; severity tiers at 1, 2 and 3. A zero IQR yields no anomalies.
     */
    public OutlierDetectionResult iqrOutliers(double[] values, double multiplier) {
        List<Anomaly> outliers = new ArrayList<>();
        if (values.length >= MIN_POINTWISE_SAMPLES) {
            double q1 = stats.quantile(values, 0.25);
            double q3 = stats.quantile(values, 0.75);
            double iqr = q3 - q1;
            if (iqr > 0) {
                double lower = q1 - multiplier * iqr;
                double upper = q3 + multiplier * iqr;
                for (int i = 0; i < values.length; i++) {
                    double v = values[i];
                    if (v < lower || v > upper) {
                        double score = Math.min(Math.abs(v - lower), Math.abs(v - upper)) / iqr;
                        outliers.add(
                                new Anomaly(
                                        i,
                                        v,
                                        score,
                                        AnomalyMethod.IQR,
                                        Severity.tiered(score, 1, 2, 3),
                                        Math.min(0.95, score / 4)));
                    }
                }
            }
        }
        return OutlierDetectionResult.of(outliers, multiplier, AnomalyMethod.IQR);
    }

    public OutlierDetectionResult localOutlierFactor(double[] values) {
        return localOutlierFactor(values, DEFAULT_LOF_NEIGHBOURS, DEFAULT_LOF_THRESHOLD);
    }

    /**
     * Naive one-dimensional local outlier factor: the ratio of the mean k-distance density of
     * a point's neighbours to its own. O(n² log n), sized for batches of a few hundred points.
     * Severity tiers at 2, 2.5 and 3.
     *
     * @throws InvalidParameterException if {@code k <= 0}
     */
    public OutlierDetectionResult localOutlierFactor(double[] values, int k, double threshold) {
        if (k <= 0) {
            throw InvalidParameterException.invalidParameter("k", k, "a positive integer");
        }
        List<Anomaly> outliers = new ArrayList<>();
        if (values.length >= k + 2) {
            int[][] neighbours = new int[values.length][];
            double[] kDistance = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                neighbours[i] = nearestNeighbours(values, i, k);
                kDistance[i] = Math.abs(values[i] - values[neighbours[i][k - 1]]);
            }

            for (int i = 0; i < values.length; i++) {
                double localDensity = 1 / Math.max(kDistance[i], MIN_REACH_DISTANCE);
                double neighbourDensity = 0;
                for (int neighbour : neighbours[i]) {
                    double d = Math.max(kDistance[neighbour], MIN_REACH_DISTANCE);
                    neighbourDensity += 1 / d;
                }
                double lof = (neighbourDensity / k) / localDensity;

                if (lof > threshold) {
                    outliers.add(
                            new Anomaly(
                                    i,
                                    values[i],
                                    lof,
                                    AnomalyMethod.LOF,
                                    Severity.tiered(lof, 2, 2.5, 3),
                                    Math.min(0.9, lof / 4)));
                }
            }
        }
        return OutlierDetectionResult.of(outliers, threshold, AnomalyMethod.LOF);
    }

    public List<SeasonalAnomaly> seasonalAnomalies(double[] values, int seasonLength) {
        return seasonalAnomalies(values, seasonLength, DEFAULT_SEASONAL_THRESHOLD);
    }

    /**
     * Deviation from the per-phase mean in units of the per-phase standard deviation.
     * Severity tiers at 3, 3.5 and 4.
     *
     * @param seasonLength period in samples
     * @return anomalies, strongest first; empty for fewer than two full periods
     * @throws InvalidParameterException if {@code seasonLength <= 0}
     */
    public List<SeasonalAnomaly> seasonalAnomalies(
            double[] values, int seasonLength, double threshold) {
        if (seasonLength <= 0) {
            throw InvalidParameterException.invalidParameter(
                    "seasonLength", seasonLength, "a positive integer");
        }
        List<SeasonalAnomaly> anomalies = new ArrayList<>();
        if (values.length < seasonLength * 2) return anomalies;

        double[] pattern = new double[seasonLength];
        int[] counts = new int[seasonLength];
        for (int i = 0; i < values.length; i++) {
            pattern[i % seasonLength] += values[i];
            counts[i % seasonLength]++;
        }
        for (int s = 0; s < seasonLength; s++) {
            pattern[s] /= counts[s];
        }

        double[] squares = new double[seasonLength];
        for (int i = 0; i < values.length; i++) {
            double deviation = values[i] - pattern[i % seasonLength];
            squares[i % seasonLength] += deviation * deviation;
        }
        double[] phaseStd = new double[seasonLength];
        for (int s = 0; s < seasonLength; s++) {
            phaseStd[s] = counts[s] > 1 ? Math.sqrt(squares[s] / (counts[s] - 1)) : 0;
        }

        List<Double> seasonalPattern = Arrays.stream(pattern).boxed().toList();
        for (int i = 0; i < values.length; i++) {
            int season = i % seasonLength;
            double std = phaseStd[season];
            if (std <= 0) continue;
            double deviation = Math.abs(values[i] - pattern[season]) / std;
            if (deviation > threshold) {
                anomalies.add(
                        new SeasonalAnomaly(
                                i,
                                values[i],
                                deviation,
                                Severity.tiered(deviation, 3, 3.5, 4),
                                Math.min(0.95, deviation / 5),
                                pattern[season],
                                std,
                                season,
                                seasonalPattern));
            }
        }

        anomalies.sort(Comparator.comparingDouble(SeasonalAnomaly::score).reversed());
        return anomalies;
    }

    public List<TrendDeviationAnomaly> trendDeviationAnomalies(double[] values) {
        return trendDeviationAnomalies(values, DEFAULT_TREND_WINDOW, DEFAULT_TREND_THRESHOLD);
    }

    /**
     * A linear trend fitted on the preceding {@code windowSize} samples predicts the next
     * one; the deviation is measured in residual standard deviations. Severity tiers at
     * 3.5, 4 and 5.
     *
     * @throws InvalidParameterException if {@code windowSize < 2}
     */
    public List<TrendDeviationAnomaly> trendDeviationAnomalies(
            double[] values, int windowSize, double threshold) {
        if (windowSize < 2) {
            throw InvalidParameterException.invalidParameter(
                    "windowSize", windowSize, "an integer of at least 2");
        }
        List<TrendDeviationAnomaly> anomalies = new ArrayList<>();
        if (values.length < windowSize) return anomalies;

        for (int i = windowSize; i < values.length; i++) {
            double[] window = Arrays.copyOfRange(values, i - windowSize, i);
            TimeSeriesAnalysisService.TrendResult trend = timeSeries.linearTrend(window);
            double predicted = trend.intercept() + trend.slope() * windowSize;

            double[] residuals = new double[windowSize];
            for (int j = 0; j < windowSize; j++) {
                residuals[j] = window[j] - (trend.intercept() + trend.slope() * j);
            }
            double residualStd = stats.std(residuals);
            if (residualStd <= 0) continue;

            double deviation = Math.abs(values[i] - predicted) / residualStd;
            if (deviation > threshold) {
                anomalies.add(
                        new TrendDeviationAnomaly(
                                i,
                                values[i],
                                deviation,
                                Severity.tiered(deviation, 3.5, 4, 5),
                                Math.min(0.9, deviation / 6),
                                predicted,
                                trend.slope(),
                                trend.rSquared()));
            }
        }

        anomalies.sort(Comparator.comparingDouble(TrendDeviationAnomaly::score).reversed());
        return anomalies;
    }

    public List<EnsembleAnomaly> ensembleAnomalyDetection(double[] values) {
        return ensembleAnomalyDetection(
                values, DEFAULT_ENSEMBLE_METHODS, DEFAULT_CONSENSUS_THRESHOLD);
    }

    /**
     * Runs the selected detectors and keeps the indices flagged by at least
     * {@code consensusThreshold} of them.
     *
     * <p>The consensus score is the mean score of exactly the methods that flagged the
     * index. Severity is critical above score 4 with more than 80% agreement, high above 3
     * with more than 70%, medium above 2.5 with more than 60%, low otherwise.
     *
     * @param methods non-empty subset of z-score, modified-z-score, iqr and lof
     * @param consensusThreshold required share of agreeing methods, in (0, 1]
     * @return anomalies by consensus score, strongest first; empty below five samples
     * @throws InvalidParameterException for an empty or non-ensemble method set or a
     *     threshold outside (0, 1]
     */
    public List<EnsembleAnomaly> ensembleAnomalyDetection(
            double[] values, Set<AnomalyMethod> methods, double consensusThreshold) {
        if (methods == null || methods.isEmpty()) {
            throw InvalidParameterException.invalidParameter(
                    "methods", methods, "at least one ensemble method");
        }
        for (AnomalyMethod method : methods) {
            if (!method.isEnsembleMember()) {
                throw InvalidParameterException.invalidParameter(
                        "methods", method.getValue(), "one of z-score, modified-z-score, iqr, lof");
            }
        }
        if (!(consensusThreshold > 0 && consensusThreshold <= 1)) {
            throw InvalidParameterException.invalidParameter(
                    "consensusThreshold", consensusThreshold, "a value in (0, 1]");
        }
        List<EnsembleAnomaly> results = new ArrayList<>();
        if (values.length < MIN_ENSEMBLE_SAMPLES) return results;

        Map<Integer, Map<AnomalyMethod, Double>> scoresByIndex = new TreeMap<>();
        for (AnomalyMethod method : EnumSet.copyOf(methods)) {
            for (Anomaly outlier : runDetector(method, values).outliers()) {
                scoresByIndex
                        .computeIfAbsent(outlier.index(), i -> new EnumMap<>(AnomalyMethod.class))
                        .put(method, outlier.score());
            }
        }

        for (Map.Entry<Integer, Map<AnomalyMethod, Double>> entry : scoresByIndex.entrySet()) {
            Map<AnomalyMethod, Double> methodScores = entry.getValue();
            double consensus = (double) methodScores.size() / methods.size();
            if (consensus < consensusThreshold) continue;

            double consensusScore =
                    methodScores.values().stream()
                            .mapToDouble(Double::doubleValue)
                            .average()
                            .orElse(0);
            int index = entry.getKey();
            results.add(
                    new EnsembleAnomaly(
                            index,
                            values[index],
                            consensusScore,
                            Collections.unmodifiableMap(methodScores),
                            consensus,
                            ensembleSeverity(consensusScore, consensus)));
        }

        results.sort(Comparator.comparingDouble(EnsembleAnomaly::consensusScore).reversed());
        LOG.debugf(
                "Ensemble of %d methods flagged %d of %d candidate indices",
                methods.size(), results.size(), scoresByIndex.size());
        return results;
    }

    public List<AdaptiveAnomaly> adaptiveThresholding(double[] values) {
        return adaptiveThresholding(values, DEFAULT_ADAPTIVE_WINDOW, DEFAULT_SENSITIVITY);
    }

    /**
     * Z-score of each point against the preceding window, compared with a threshold that
     * grows with the window's volatility: {@code sensitivity * (1 + std / |mean|)}. The
     * volatility is 0 for a zero-mean window. Severity grows at 1.1, 1.3 and 1.5 times the
     * threshold.
     *
     * @throws InvalidParameterException if {@code windowSize < 2}
     */
    public List<AdaptiveAnomaly> adaptiveThresholding(
            double[] values, int windowSize, double sensitivity) {
        if (windowSize < 2) {
            throw InvalidParameterException.invalidParameter(
                    "windowSize", windowSize, "an integer of at least 2");
        }
        List<AdaptiveAnomaly> anomalies = new ArrayList<>();
        if (values.length < windowSize) return anomalies;

        for (int i = windowSize; i < values.length; i++) {
            double[] window = Arrays.copyOfRange(values, i - windowSize, i);
            double mean = stats.mean(window);
            double std = stats.std(window);
            if (std <= 0) continue;

            double z = Math.abs(values[i] - mean) / std;
            double volatility = mean == 0 ? 0 : std / Math.abs(mean);
            double adaptive = sensitivity * (1 + volatility);
            if (z > adaptive) {
                anomalies.add(
                        new AdaptiveAnomaly(
                                i,
                                values[i],
                                z,
                                Severity.tiered(z, adaptive * 1.1, adaptive * 1.3, adaptive * 1.5),
                                Math.min(0.95, z / (adaptive * 1.5)),
                                adaptive,
                                volatility,
                                mean,
                                std));
            }
        }

        anomalies.sort(Comparator.comparingDouble(AdaptiveAnomaly::score).reversed());
        return anomalies;
    }

    private OutlierDetectionResult runDetector(AnomalyMethod method, double[] values) {
        return switch (method) {
            case Z_SCORE -> zScoreAnomalies(values);
            case MODIFIED_Z_SCORE -> modifiedZScore(values);
            case IQR -> iqrOutliers(values);
            case LOF -> localOutlierFactor(values);
            default -> throw InvalidParameterException.invalidParameter(
                    "methods", method.getValue(), "one of z-score, modified-z-score, iqr, lof");
        };
    }

    private static Severity ensembleSeverity(double score, double consensus) {
        if (score > 4 && consensus > 0.8) return Severity.CRITICAL;
        if (score > 3 && consensus > 0.7) return Severity.HIGH;
        if (score > 2.5 && consensus > 0.6) return Severity.MEDIUM;
        return Severity.LOW;
    }

    /** Indices of the {@code k} values closest to {@code values[index]}, excluding itself. */
    private static int[] nearestNeighbours(double[] values, int index, int k) {
        Integer[] others = new Integer[values.length - 1];
        for (int i = 0, j = 0; i < values.length; i++) {
            if (i != index) others[j++] = i;
        }
        double pivot = values[index];
        Arrays.sort(others, Comparator.comparingDouble(i -> Math.abs(values[i] - pivot)));
        int[] nearest = new int[k];
        for (int i = 0; i < k; i++) {
            nearest[i] = others[i];
        }
        return nearest;
    }

    /**
     * @param index sample index
     * @param value sample value
     * @param score detector score
     * @param method detector
     * @param severity graded score
     * @param confidence detector confidence
     */
    public record Anomaly(
            int index,
            double value,
            double score,
            AnomalyMethod method,
            Severity severity,
            double confidence) {}

    /**
     * @param outliers anomalies, strongest first
     * @param threshold threshold or fence multiplier used
     * @param method detector
     * @param totalAnomalies number of anomalies
     */
    public record OutlierDetectionResult(
            List<Anomaly> outliers, double threshold, AnomalyMethod method, int totalAnomalies) {

        static OutlierDetectionResult of(
                List<Anomaly> outliers, double threshold, AnomalyMethod method) {
            outliers.sort(Comparator.comparingDouble(Anomaly::score).reversed());
            return new OutlierDetectionResult(
                    List.copyOf(outliers), threshold, method, outliers.size());
        }
    }

    /**
     * @param index sample index
     * @param value sample value
     * @param score deviation in per-phase standard deviations
     * @param severity graded score
     * @param confidence detector confidence
     * @param expectedValue per-phase mean
     * @param seasonalDeviation per-phase standard deviation
     * @param season phase of the sample
     * @param seasonalPattern mean of every phase
     */
    public record SeasonalAnomaly(
            int index,
            double value,
            double score,
            Severity severity,
            double confidence,
            double expectedValue,
            double seasonalDeviation,
            int season,
            List<Double> seasonalPattern) {}

    /**
     * @param index sample index
     * @param value sample value
     * @param score deviation in residual standard deviations
     * @param severity graded score
     * @param confidence detector confidence
     * @param predicted value predicted by the window trend
     * @param trendSlope slope of the window trend
     * @param trendConfidence R² of the window trend
     */
    public record TrendDeviationAnomaly(
            int index,
            double value,
            double score,
            Severity severity,
            double confidence,
            double predicted,
            double trendSlope,
            double trendConfidence) {}

    /**
     * @param index sample index
     * @param value sample value
     * @param consensusScore mean score of the flagging methods
     * @param methodScores score of every flagging method
     * @param confidence share of the requested methods that flagged the index
     * @param severity combined grade of score and agreement
     */
    public record EnsembleAnomaly(
            int index,
            double value,
            double consensusScore,
            Map<AnomalyMethod, Double> methodScores,
            double confidence,
            Severity severity) {}

    /**
     * @param index sample index
     * @param value sample value
     * @param score z-score against the preceding window
     * @param severity graded relative to the adaptive threshold
     * @param confidence detector confidence
     * @param adaptiveThreshold threshold in effect
     * @param recentVolatility window coefficient of variation
     * @param windowMean window mean
     * @param windowStd window standard deviation
     */
    public record AdaptiveAnomaly(
            int index,
            double value,
            double score,
            Severity severity,
            double confidence,
            double adaptiveThreshold,
            double recentVolatility,
            double windowMean,
            double windowStd) {}
}
