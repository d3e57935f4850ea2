/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.exception.InvalidParameterException;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Arrays;

/**
 * Descriptive statistics over a numeric series.
 *
 * <p>Every function is defined for degenerate input: an empty series yields zeros and a
 * zero standard deviation is reported as 0 rather than used as a divisor. Downstream
 * analyses rely on that contract and never guard against it themselves.
 */
@ApplicationScoped
public class CoreStatisticsService {

    static final int DEFAULT_ENTROPY_BINS = 10;
    static final double NORMALITY_SKEWNESS_LIMIT = 2.0;
    static final double NORMALITY_KURTOSIS_LIMIT = 7.0;
    static final int NORMALITY_MAX_SAMPLES = 5000;

    private static final double LOG_2 = Math.log(2.0);

    public double mean(double[] values) {
        if (values.length == 0) return 0;
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation with denominator {@code n - 1}.
     *
     * @return 0 for fewer than two values
     */
    public double std(double[] values) {
        return Math.sqrt(variance(values));
    }

    /** Sample variance with denominator {@code n - 1}; 0 for fewer than two values. */
    public double variance(double[] values) {
        if (values.length <= 1) return 0;
        double mean = mean(values);
        double sumSq = 0;
        for (double v : values) {
            sumSq += (v - mean) * (v - mean);
        }
        return sumSq / (values.length - 1);
    }

    /** Median; the average of the two middle elements for even lengths. */
    public double median(double[] values) {
        if (values.length == 0) return 0;
        double[] sorted = sorted(values);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[mid - 1] + sorted[mid]) / 2;
        }
        return sorted[mid];
    }

    /**
     * Linearly interpolated quantile.
     *
     * @param values series
     * @param percentile quantile in [0, 1]
     * @return the quantile, 0 for an empty series
     * @throws InvalidParameterException if {@code percentile} is outside [0, 1]
     */
    public double quantile(double[] values, double percentile) {
        if (percentile < 0 || percentile > 1 || Double.isNaN(percentile)) {
            throw InvalidParameterException.invalidParameter(
                    "percentile", percentile, "a value between 0 and 1");
        }
        if (values.length == 0) return 0;

        double[] sorted = sorted(values);
        double index = percentile * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        double weight = index - lower;

        if (lower == upper) return sorted[lower];
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    public double iqr(double[] values) {
        return quantile(values, 0.75) - quantile(values, 0.25);
    }

    /** Third standardized moment; 0 for fewer than three values or zero spread. */
    public double skewness(double[] values) {
        if (values.length < 3) return 0;
        return standardizedMoment(values, 3);
    }

    /** Fourth standardized moment minus 3; 0 for fewer than four values or zero spread. */
    public double kurtosis(double[] values) {
        if (values.length < 4) return 0;
        double moment = standardizedMoment(values, 4);
        return moment == 0 ? 0 : moment - 3;
    }

    /** Z-scores of all values; all zeros when the series has no spread. */
    public double[] zScores(double[] values) {
        if (values.length == 0) return new double[0];
        double mean = mean(values);
        double std = std(values);
        double[] z = new double[values.length];
        if (std == 0) return z;
        for (int i = 0; i < values.length; i++) {
            z[i] = (values[i] - mean) / std;
        }
        return z;
    }

    public BasicStatistics basicStatistics(double[] values) {
        if (values.length == 0) {
            return BasicStatistics.empty();
        }
        double min = Arrays.stream(values).min().orElse(0);
        double max = Arrays.stream(values).max().orElse(0);
        double q25 = quantile(values, 0.25);
        double q75 = quantile(values, 0.75);

        return new BasicStatistics(
                values.length,
                mean(values),
                std(values),
                variance(values),
                min,
                max,
                median(values),
                q25,
                q75,
                q75 - q25,
                skewness(values),
                kurtosis(values));
    }

    /**
     * Moment-based normality heuristic.
     *
     * <p>A series counts as normal when {@code |skewness| < 2} and
     * {@code |excess kurtosis| < 7}. The reported p-value is {@code 1 - max(deviation ratio)}
     * and is meant for ranking, not inference. Series shorter than 3 or longer than 5000
     * samples are reported as not normal with p-value 0.
     */
    public NormalityResult testNormality(double[] values) {
        if (values.length < 3 || values.length > NORMALITY_MAX_SAMPLES) {
            return new NormalityResult(false, 0, 0);
        }
        double skewness = skewness(values);
        double kurtosis = kurtosis(values);

        boolean normal =
                Math.abs(skewness) < NORMALITY_SKEWNESS_LIMIT
                        && Math.abs(kurtosis) < NORMALITY_KURTOSIS_LIMIT;
        double maxDeviation =
                Math.max(
                        Math.abs(skewness) / NORMALITY_SKEWNESS_LIMIT,
                        Math.abs(kurtosis) / NORMALITY_KURTOSIS_LIMIT);

        return new NormalityResult(normal, Math.max(0, 1 - maxDeviation), maxDeviation);
    }

    /** Gaussian density at {@code x}; 0 for a non-positive standard deviation. */
    public double normalPdf(double x, double mean, double std) {
        if (std <= 0) return 0;
        double coefficient = 1 / (std * Math.sqrt(2 * Math.PI));
        double z = (x - mean) / std;
        return coefficient * Math.exp(-0.5 * z * z);
    }

    public double entropy(double[] values) {
        return entropy(values, DEFAULT_ENTROPY_BINS);
    }

    /**
     * Shannon entropy in bits of an equal-width histogram.
     *
     * @param values series
     * @param bins number of bins, at least 1
     * @return entropy, 0 when all values are equal
     */
    public double entropy(double[] values, int bins) {
        if (bins <= 0) {
            throw InvalidParameterException.invalidParameter("bins", bins, "a positive integer");
        }
        if (values.length == 0) return 0;

        double min = Arrays.stream(values).min().orElse(0);
        double max = Arrays.stream(values).max().orElse(0);
        double binWidth = (max - min) / bins;
        if (binWidth == 0) return 0;

        int[] histogram = new int[bins];
        for (double value : values) {
            int bin = (int) Math.floor((value - min) / binWidth);
            histogram[Math.min(bin, bins - 1)]++;
        }

        double entropy = 0;
        for (int count : histogram) {
            if (count > 0) {
                double p = (double) count / values.length;
                entropy -= p * (Math.log(p) / LOG_2);
            }
        }
        return entropy;
    }

    private double standardizedMoment(double[] values, int order) {
        double mean = mean(values);
        double std = std(values);
        if (std == 0) return 0;
        double sum = 0;
        for (double v : values) {
            sum += Math.pow((v - mean) / std, order);
        }
        return sum / values.length;
    }

    private static double[] sorted(double[] values) {
        double[] copy = values.clone();
        Arrays.sort(copy);
        return copy;
    }

    /**
     * Descriptive statistics of a series.
     *
     * @param count number of values
     * @param mean arithmetic mean
     * @param std sample standard deviation
     * @param variance sample variance
     * @param min smallest value
     * @param max largest value
     * @param median median
     * @param q25 first quartile
     * @param q75 third quartile
     * @param iqr interquartile range
     * @param skewness third standardized moment
     * @param kurtosis excess kurtosis
     */
    public record BasicStatistics(
            int count,
            double mean,
            double std,
            double variance,
            double min,
            double max,
            double median,
            double q25,
            double q75,
            double iqr,
            double skewness,
            double kurtosis) {

        public static BasicStatistics empty() {
            return new BasicStatistics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
        }
    }

    /**
     * @param normal whether the series passes the heuristic
     * @param pValue approximate p-value in [0, 1]
     * @param statistic largest deviation ratio
     */
    public record NormalityResult(boolean normal, double pValue, double statistic) {}
}
