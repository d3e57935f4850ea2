/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.enumeration.TrendDirection;
import com.ammann.telemetry.enumeration.TrendStrength;
import com.ammann.telemetry.exception.InvalidParameterException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Temporal analyses over an ordered series: trend fitting, smoothing, change points,
 * autocorrelation, cycles and seasonal decomposition.
 *
 * <p>Positions are sample indices. The series is assumed to be evenly spaced; callers that
 * need rates per unit of time convert the index-based slope themselves.
 */
@ApplicationScoped
public class TimeSeriesAnalysisService {

    private static final Logger LOG = Logger.getLogger(TimeSeriesAnalysisService.class);

    static final double DEFAULT_EMA_ALPHA = 0.3;
    static final double DEFAULT_CHANGE_POINT_THRESHOLD = 2.0;
    static final int MIN_CHANGE_POINT_SAMPLES = 10;
    static final int CHANGE_POINT_CONTEXT = 10;
    static final int MAX_DEFAULT_AUTOCORRELATION_LAG = 50;
    static final double PERSISTENCE_RATIO = 0.7;
    static final double CYCLE_MIN_STRENGTH = 0.3;
    static final int MIN_CYCLE_SAMPLES = 8;

    private final CoreStatisticsService stats;

    @Inject
    public TimeSeriesAnalysisService(CoreStatisticsService stats) {
        this.stats = stats;
    }

    /**
     * Ordinary least squares fit of value against index.
     *
     * <p>A constant series has R² = 1 (the flat line explains it fully). Fewer than two
     * values give a flat, weak trend.
     */
    public TrendResult linearTrend(double[] values) {
        int n = values.length;
        if (n < 2) {
            return new TrendResult(0, 0, 0, TrendDirection.STABLE, TrendStrength.WEAK);
        }

        double xMean = (n - 1) / 2.0;
        double yMean = stats.mean(values);
        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            double xDiff = i - xMean;
            numerator += xDiff * (values[i] - yMean);
            denominator += xDiff * xDiff;
        }

        double slope = denominator == 0 ? 0 : numerator / denominator;
        double intercept = yMean - slope * xMean;

        double ssRes = 0;
        double ssTot = 0;
        for (int i = 0; i < n; i++) {
            double predicted = slope * i + intercept;
            ssRes += (values[i] - predicted) * (values[i] - predicted);
            ssTot += (values[i] - yMean) * (values[i] - yMean);
        }
        double rSquared = ssTot == 0 ? 1 : 1 - ssRes / ssTot;

        return new TrendResult(
                slope,
                intercept,
                rSquared,
                TrendDirection.fromSlope(slope),
                TrendStrength.fromRSquared(rSquared));
    }

    /**
     * Trailing simple moving average. The first {@code window - 1} outputs average the
     * samples available so far.
     *
     * @param values series
     * @param window window length, positive
     * @return smoothed series of the same length; a copy of the input when the window is
     *     longer than the series
     * @throws InvalidParameterException if {@code window <= 0}
     */
    public double[] simpleMovingAverage(double[] values, int window) {
        requirePositiveWindow(window);
        if (window > values.length) return values.clone();

        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - window + 1);
            result[i] = stats.mean(Arrays.copyOfRange(values, from, i + 1));
        }
        return result;
    }

    public double[] exponentialMovingAverage(double[] values) {
        return exponentialMovingAverage(values, DEFAULT_EMA_ALPHA);
    }

    /**
     * Exponential moving average seeded with the first value. An alpha outside (0, 1] falls
     * back to 0.3.
     */
    public double[] exponentialMovingAverage(double[] values, double alpha) {
        if (values.length == 0) return new double[0];
        double a = alpha > 0 && alpha <= 1 ? alpha : DEFAULT_EMA_ALPHA;

        double[] result = new double[values.length];
        result[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            result[i] = a * values[i] + (1 - a) * result[i - 1];
        }
        return result;
    }

    /**
     * Trailing moving sample standard deviation with a shrinking start window.
     *
     * @return all zeros when the window is longer than the series
     * @throws InvalidParameterException if {@code window <= 0}
     */
    public double[] movingStandardDeviation(double[] values, int window) {
        requirePositiveWindow(window);
        double[] result = new double[values.length];
        if (window > values.length) return result;

        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - window + 1);
            result[i] = stats.std(Arrays.copyOfRange(values, from, i + 1));
        }
        return result;
    }

    public List<ChangePoint> detectChangePoints(double[] values) {
        return detectChangePoints(values, DEFAULT_CHANGE_POINT_THRESHOLD);
    }

    /**
     * CUSUM change-point detection over z-normalized values.
     *
     * <p>The accumulator tracks its running maximum and minimum. A drop of more than
     * {@code threshold} below the maximum, or a rise above the minimum, emits a change point
     * whose before/after means come from the ten samples on either side; the accumulator and
     * the crossed extreme are then reset.
     *
     * @return change points in index order; empty for fewer than ten samples or no spread
     */
    public List<ChangePoint> detectChangePoints(double[] values, double threshold) {
        List<ChangePoint> changePoints = new ArrayList<>();
        if (values.length < MIN_CHANGE_POINT_SAMPLES) return changePoints;

        double mean = stats.mean(values);
        double std = stats.std(values);
        if (std == 0) return changePoints;

        double cumulativeSum = 0;
        double maxCumSum = 0;
        double minCumSum = 0;

        for (int i = 1; i < values.length; i++) {
            cumulativeSum += (values[i] - mean) / std;
            maxCumSum = Math.max(maxCumSum, cumulativeSum);
            minCumSum = Math.min(minCumSum, cumulativeSum);

            if (maxCumSum - cumulativeSum > threshold) {
                changePoints.add(changePointAt(values, i, maxCumSum - cumulativeSum));
                maxCumSum = 0;
                cumulativeSum = 0;
            }
            if (cumulativeSum - minCumSum > threshold) {
                changePoints.add(changePointAt(values, i, cumulativeSum - minCumSum));
                minCumSum = 0;
                cumulativeSum = 0;
            }
        }

        LOG.debugf(
                "CUSUM found %d change points in %d samples (threshold=%.2f)",
                (Object) changePoints.size(), (Object) values.length, threshold);
        return changePoints;
    }

    public AutocorrelationResult autocorrelation(double[] values) {
        return autocorrelation(values, null);
    }

    /**
     * Autocorrelation function for lags {@code 0..maxLag}.
     *
     * <p>Significant lags exceed the 95% band {@code 1.96 / sqrt(n)}. The optimal lag is the
     * first significant lag, or the lag with the largest absolute correlation if none is
     * significant. A series is persistent when the lag-5 to lag-1 ratio exceeds 0.7. A
     * constant series is fully persistent with all correlations equal to 1.
     *
     * @param values series
     * @param maxLag highest lag, {@code null} for {@code min(n / 4, 50)}; capped at
     *     {@code n - 1}
     * @throws InvalidParameterException if {@code maxLag} is not positive
     */
    public AutocorrelationResult autocorrelation(double[] values, Integer maxLag) {
        if (maxLag != null && maxLag <= 0) {
            throw InvalidParameterException.invalidParameter(
                    "maxLag", maxLag, "a positive integer");
        }
        int n = values.length;
        if (n < 3) {
            return new AutocorrelationResult(new double[0], List.of(), 0, false);
        }

        int effectiveMaxLag =
                maxLag != null
                        ? Math.min(maxLag, n - 1)
                        : Math.min(n / 4, MAX_DEFAULT_AUTOCORRELATION_LAG);
        double mean = stats.mean(values);
        double variance = stats.variance(values);

        if (variance == 0) {
            double[] ones = new double[effectiveMaxLag + 1];
            Arrays.fill(ones, 1.0);
            return new AutocorrelationResult(ones, List.of(), 0, true);
        }

        double[] correlations = new double[effectiveMaxLag + 1];
        for (int lag = 0; lag <= effectiveMaxLag; lag++) {
            int count = n - lag;
            double covariance = 0;
            for (int i = 0; i < count; i++) {
                covariance += (values[i] - mean) * (values[i + lag] - mean);
            }
            correlations[lag] = (covariance / count) / variance;
        }

        double band = 1.96 / Math.sqrt(n);
        List<Integer> significantLags = new ArrayList<>();
        for (int lag = 1; lag < correlations.length; lag++) {
            if (Math.abs(correlations[lag]) > band) {
                significantLags.add(lag);
            }
        }

        int optimalLag = 0;
        if (!significantLags.isEmpty()) {
            optimalLag = significantLags.get(0);
        } else {
            double maxCorr = 0;
            for (int lag = 1; lag < correlations.length; lag++) {
                if (Math.abs(correlations[lag]) > maxCorr) {
                    maxCorr = Math.abs(correlations[lag]);
                    optimalLag = lag;
                }
            }
        }

        double decay =
                correlations.length > 5 && correlations[1] != 0
                        ? correlations[5] / correlations[1]
                        : 0;

        return new AutocorrelationResult(
                correlations, List.copyOf(significantLags), optimalLag, decay > PERSISTENCE_RATIO);
    }

    /**
     * Candidate cycles: local maxima of the autocorrelation function above 0.3 that exceed
     * both neighbours on each side.
     */
    public CyclicPatterns detectCyclicPatterns(double[] values) {
        if (values.length < MIN_CYCLE_SAMPLES) return CyclicPatterns.none();

        double[] c = autocorrelation(values).correlations();
        List<Integer> periods = new ArrayList<>();
        List<Double> strengths = new ArrayList<>();
        for (int i = 2; i < c.length - 2; i++) {
            if (c[i] > CYCLE_MIN_STRENGTH
                    && c[i] > c[i - 1]
                    && c[i] > c[i - 2]
                    && c[i] > c[i + 1]
                    && c[i] > c[i + 2]) {
                periods.add(i);
                strengths.add(c[i]);
            }
        }
        return new CyclicPatterns(List.copyOf(periods), List.copyOf(strengths));
    }

    /**
     * Additive decomposition into trend (moving average of one period), seasonal (mean
     * detrended value per phase) and residual.
     *
     * <p>Series shorter than two periods degrade to trend = values with zero seasonal and
     * residual components.
     *
     * @throws InvalidParameterException if {@code period <= 0}
     */
    public SeasonalDecomposition decompose(double[] values, int period) {
        if (period <= 0) {
            throw InvalidParameterException.invalidParameter(
                    "period", period, "a positive integer");
        }
        int n = values.length;
        if (n < period * 2) {
            return new SeasonalDecomposition(values.clone(), new double[n], new double[n], period);
        }

        double[] trend = simpleMovingAverage(values, period);
        double[] phaseSums = new double[period];
        int[] phaseCounts = new int[period];
        for (int i = 0; i < n; i++) {
            phaseSums[i % period] += values[i] - trend[i];
            phaseCounts[i % period]++;
        }

        double[] seasonal = new double[n];
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            int phase = i % period;
            seasonal[i] = phaseCounts[phase] > 0 ? phaseSums[phase] / phaseCounts[phase] : 0;
            residual[i] = values[i] - trend[i] - seasonal[i];
        }
        return new SeasonalDecomposition(trend, seasonal, residual, period);
    }

    private ChangePoint changePointAt(double[] values, int index, double significance) {
        double[] before =
                Arrays.copyOfRange(values, Math.max(0, index - CHANGE_POINT_CONTEXT), index);
        double[] after =
                Arrays.copyOfRange(
                        values, index, Math.min(values.length, index + CHANGE_POINT_CONTEXT));
        return new ChangePoint(index, significance, stats.mean(before), stats.mean(after));
    }

    private static void requirePositiveWindow(int window) {
        if (window <= 0) {
            throw InvalidParameterException.invalidParameter(
                    "window", window, "a positive integer");
        }
    }

    /**
     * @param slope change per sample
     * @param intercept fitted value at index 0
     * @param rSquared coefficient of determination
     * @param direction up, down or stable
     * @param strength weak, moderate or strong
     */
    public record TrendResult(
            double slope,
            double intercept,
            double rSquared,
            TrendDirection direction,
            TrendStrength strength) {}

    /**
     * A shift in the series mean.
     *
     * @param index sample index at which the accumulator crossed the threshold
     * @param significance distance of the accumulator from its extreme
     * @param beforeMean mean of up to ten samples before the index
     * @param afterMean mean of up to ten samples from the index on
     */
    public record ChangePoint(
            int index, double significance, double beforeMean, double afterMean) {}

    /**
     * @param correlations autocorrelation per lag, starting at lag 0
     * @param significantLags lags outside the 95% band
     * @param optimalLag first significant lag, or strongest lag
     * @param persistent whether the autocorrelation decays slowly
     */
    public record AutocorrelationResult(
            double[] correlations,
            List<Integer> significantLags,
            int optimalLag,
            boolean persistent) {}

    /**
     * @param periods candidate periods in samples
     * @param strengths autocorrelation at each period
     */
    public record CyclicPatterns(List<Integer> periods, List<Double> strengths) {
        public static CyclicPatterns none() {
            return new CyclicPatterns(List.of(), List.of());
        }
    }

    /**
     * @param trend trend component
     * @param seasonal seasonal component
     * @param residual remainder
     * @param period seasonal period in samples
     */
    public record SeasonalDecomposition(
            double[] trend, double[] seasonal, double[] residual, int period) {}
}
