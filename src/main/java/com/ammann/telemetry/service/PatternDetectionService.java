/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.enumeration.SpikeDirection;
import com.ammann.telemetry.exception.InvalidParameterException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.jboss.logging.Logger;

/**
 * Shape detection over a single series: peaks and valleys, spikes, template matches,
 * repeating sequences and dominant periods.
 */
@ApplicationScoped
public class PatternDetectionService {

    private static final Logger LOG = Logger.getLogger(PatternDetectionService.class);

    static final double DEFAULT_SPIKE_THRESHOLD = 3.0;
    static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8;
    static final int DEFAULT_MIN_SEQUENCE_LENGTH = 3;
    static final int DEFAULT_MAX_SEQUENCE_LENGTH = 20;
    static final int DEFAULT_MIN_OCCURRENCES = 2;
    static final int DEFAULT_MAX_FREQUENCY_COMPONENTS = 5;
    static final int MAX_SPECTRAL_LAG = 50;
    static final double REGULARITY_LIMIT = 0.3;

    private final CoreStatisticsService stats;

    @Inject
    public PatternDetectionService(CoreStatisticsService stats) {
        this.stats = stats;
    }

    public List<Peak> findPeaks(double[] values) {
        return findPeaks(values, 1, null);
    }

    /**
     * Local maxima at or above {@code minHeight}.
     *
     * <p>Prominence is the height above the higher of the two minima reached before the
     * series climbs above the peak on either side. Width is measured at half prominence.
     *
     * @param values series
     * @param minDistance minimum index distance between accepted peaks
     * @param minHeight height threshold, {@code null} for mean + one standard deviation
     * @return peaks ordered by prominence, most prominent first
     */
    public List<Peak> findPeaks(double[] values, int minDistance, Double minHeight) {
        List<Peak> peaks = new ArrayList<>();
        if (values.length < 3) return peaks;
        double threshold = minHeight != null ? minHeight : stats.mean(values) + stats.std(values);

        for (int i = 1; i < values.length - 1; i++) {
            double current = values[i];
            if (!(current > values[i - 1] && current > values[i + 1] && current >= threshold)) {
                continue;
            }
            if (tooClose(peaks.stream().mapToInt(Peak::index), i, minDistance)) continue;

            double leftMin = current;
            for (int j = i - 1; j >= 0; j--) {
                leftMin = Math.min(leftMin, values[j]);
                if (values[j] > current) break;
            }
            double rightMin = current;
            for (int j = i + 1; j < values.length; j++) {
                rightMin = Math.min(rightMin, values[j]);
                if (values[j] > current) break;
            }
            double prominence = current - Math.max(leftMin, rightMin);

            double halfHeight = current - prominence / 2;
            int left = i;
            for (int j = i; j >= 0 && values[j] >= halfHeight; j--) {
                left = j;
            }
            int right = i;
            for (int j = i; j < values.length && values[j] >= halfHeight; j++) {
                right = j;
            }
            peaks.add(new Peak(i, current, prominence, right - left));
        }

        peaks.sort(Comparator.comparingDouble(Peak::prominence).reversed());
        return peaks;
    }

    public List<Valley> findValleys(double[] values) {
        return findValleys(values, 1, null);
    }

    /**
     * Local minima at or below {@code maxHeight}; the mirror image of {@link #findPeaks}.
     *
     * @param maxHeight depth threshold, {@code null} for mean - one standard deviation
     * @return valleys ordered by depth, deepest first
     */
    public List<Valley> findValleys(double[] values, int minDistance, Double maxHeight) {
        List<Valley> valleys = new ArrayList<>();
        if (values.length < 3) return valleys;
        double threshold = maxHeight != null ? maxHeight : stats.mean(values) - stats.std(values);

        for (int i = 1; i < values.length - 1; i++) {
            double current = values[i];
            if (!(current < values[i - 1] && current < values[i + 1] && current <= threshold)) {
                continue;
            }
            if (tooClose(valleys.stream().mapToInt(Valley::index), i, minDistance)) continue;

            double leftMax = current;
            for (int j = i - 1; j >= 0; j--) {
                leftMax = Math.max(leftMax, values[j]);
                if (values[j] < current) break;
            }
            double rightMax = current;
            for (int j = i + 1; j < values.length; j++) {
                rightMax = Math.max(rightMax, values[j]);
                if (values[j] < current) break;
            }
            double depth = Math.min(leftMax, rightMax) - current;

            double halfDepth = current + depth / 2;
            int left = i;
            for (int j = i; j >= 0 && values[j] <= halfDepth; j--) {
                left = j;
            }
            int right = i;
            for (int j = i; j < values.length && values[j] <= halfDepth; j++) {
                right = j;
            }
            valleys.add(new Valley(i, current, depth, right - left));
        }

        valleys.sort(Comparator.comparingDouble(Valley::depth).reversed());
        return valleys;
    }

    public List<Spike> detectSpikes(double[] values) {
        return detectSpikes(values, DEFAULT_SPIKE_THRESHOLD, 1);
    }

    /**
     * Contiguous runs with {@code |z| > threshold}. A run is split when its direction flips
     * and closed at the end of the series.
     *
     * @param threshold z-score threshold
     * @param minDuration minimum run length in samples
     * @return spikes ordered by normalized magnitude, largest first
     */
    public List<Spike> detectSpikes(double[] values, double threshold, int minDuration) {
        List<Spike> spikes = new ArrayList<>();
        if (values.length < 3) return spikes;
        double mean = stats.mean(values);
        double std = stats.std(values);
        if (std == 0) return spikes;

        int start = -1;
        SpikeDirection direction = null;
        for (int i = 0; i < values.length; i++) {
            double z = Math.abs(values[i] - mean) / std;
            if (z > threshold) {
                SpikeDirection current =
                        values[i] > mean ? SpikeDirection.UP : SpikeDirection.DOWN;
                if (start == -1) {
                    start = i;
                    direction = current;
                } else if (direction != current) {
                    addSpike(spikes, values, start, i, direction, mean, std, minDuration);
                    start = i;
                    direction = current;
                }
            } else if (start != -1) {
                addSpike(spikes, values, start, i, direction, mean, std, minDuration);
                start = -1;
                direction = null;
            }
        }
        if (start != -1) {
            addSpike(spikes, values, start, values.length, direction, mean, std, minDuration);
        }

        spikes.sort(Comparator.comparingDouble(Spike::magnitude).reversed());
        return spikes;
    }

    public List<PatternMatch> findSimilarPatterns(double[] data, double[] template) {
        return findSimilarPatterns(data, template, DEFAULT_SIMILARITY_THRESHOLD);
    }

    /**
     * Sliding-window Pearson correlation of a z-normalized template against every window of
     * the same length. Windows may overlap. Flat windows are skipped.
     *
     * @return matches at or above {@code threshold}, most similar first
     */
    public List<PatternMatch> findSimilarPatterns(
            double[] data, double[] template, double threshold) {
        List<PatternMatch> matches = new ArrayList<>();
        int m = template.length;
        if (m == 0 || data.length < m) return matches;

        double[] normalizedTemplate = stats.zScores(template);
        if (stats.std(template) == 0) return matches;

        for (int i = 0; i <= data.length - m; i++) {
            double[] window = Arrays.copyOfRange(data, i, i + m);
            if (stats.std(window) == 0) continue;
            double[] normalizedWindow = stats.zScores(window);

            double correlation = 0;
            for (int j = 0; j < m; j++) {
                correlation += normalizedTemplate[j] * normalizedWindow[j];
            }
            correlation /= m;

            if (correlation >= threshold) {
                matches.add(new PatternMatch(i, i + m - 1, correlation, window));
            }
        }

        matches.sort(Comparator.comparingDouble(PatternMatch::similarity).reversed());
        return matches;
    }

    public List<PatternMatch> detectRepeatingSequences(double[] values) {
        return detectRepeatingSequences(
                values,
                DEFAULT_MIN_SEQUENCE_LENGTH,
                DEFAULT_MAX_SEQUENCE_LENGTH,
                DEFAULT_MIN_OCCURRENCES);
    }

    /**
     * Windows whose values, rounded to one decimal, repeat at least {@code minOccurrences}
     * times without overlapping.
     *
     * @return all non-overlapping placements of every repeating signature, by start index
     * @throws InvalidParameterException if a length bound or the occurrence count is not
     *     positive
     */
    public List<PatternMatch> detectRepeatingSequences(
            double[] values, int minLength, int maxLength, int minOccurrences) {
        if (minLength <= 0) {
            throw InvalidParameterException.invalidParameter(
                    "minLength", minLength, "a positive integer");
        }
        if (maxLength < minLength) {
            throw InvalidParameterException.invalidParameter(
                    "maxLength", maxLength, "at least minLength (" + minLength + ")");
        }
        if (minOccurrences <= 0) {
            throw InvalidParameterException.invalidParameter(
                    "minOccurrences", minOccurrences, "a positive integer");
        }
        List<PatternMatch> repeating = new ArrayList<>();
        if (values.length < minLength * minOccurrences) return repeating;

        Map<List<Long>, List<PatternMatch>> bySignature = new LinkedHashMap<>();
        int longest = Math.min(maxLength, values.length / minOccurrences);
        for (int length = minLength; length <= longest; length++) {
            for (int start = 0; start <= values.length - length; start++) {
                double[] pattern = Arrays.copyOfRange(values, start, start + length);
                List<Long> signature =
                        Arrays.stream(pattern).mapToObj(v -> Math.round(v * 10)).toList();
                bySignature
                        .computeIfAbsent(signature, k -> new ArrayList<>())
                        .add(new PatternMatch(start, start + length - 1, 1.0, pattern));
            }
        }

        for (List<PatternMatch> matches : bySignature.values()) {
            if (matches.size() < minOccurrences) continue;
            matches.sort(Comparator.comparingInt(PatternMatch::startIndex));
            List<PatternMatch> spaced = new ArrayList<>();
            int lastEnd = -1;
            for (PatternMatch match : matches) {
                if (match.startIndex() > lastEnd) {
                    spaced.add(match);
                    lastEnd = match.endIndex();
                }
            }
            if (spaced.size() >= minOccurrences) {
                repeating.addAll(spaced);
            }
        }

        repeating.sort(Comparator.comparingInt(PatternMatch::startIndex));
        LOG.debugf(
                "Found %d repeating sequence placements in %d samples",
                repeating.size(), values.length);
        return repeating;
    }

    public List<FrequencyComponent> findDominantFrequencies(double[] values) {
        return findDominantFrequencies(values, 1.0, DEFAULT_MAX_FREQUENCY_COMPONENTS);
    }

    /**
     * Approximate spectral peaks from the autocovariance function: each peak lag is a period,
     * its autocovariance the power and the square root of that the amplitude.
     *
     * @param samplingRate samples per time unit
     * @param maxComponents maximum number of components
     * @return components ordered by power, strongest first
     */
    public List<FrequencyComponent> findDominantFrequencies(
            double[] values, double samplingRate, int maxComponents) {
        List<FrequencyComponent> components = new ArrayList<>();
        int n = values.length;
        if (n < 8) return components;

        double mean = stats.mean(values);
        int maxLag = Math.min(n / 4, MAX_SPECTRAL_LAG);
        double[] autocovariance = new double[maxLag];
        for (int lag = 1; lag <= maxLag; lag++) {
            double sum = 0;
            for (int i = 0; i < n - lag; i++) {
                sum += (values[i] - mean) * (values[i + lag] - mean);
            }
            autocovariance[lag - 1] = sum / (n - lag);
        }

        List<Peak> peaks = findPeaks(autocovariance, 2, null);
        for (int i = 0; i < Math.min(peaks.size(), maxComponents); i++) {
            Peak peak = peaks.get(i);
            int period = peak.index() + 1;
            components.add(
                    new FrequencyComponent(
                            samplingRate / period,
                            Math.sqrt(Math.max(0, peak.value())),
                            0,
                            peak.value()));
        }

        components.sort(Comparator.comparingDouble(FrequencyComponent::power).reversed());
        return components;
    }

    /**
     * Regularity of peak spacing: the coefficient of variation of the intervals between
     * consecutive peaks (in index order). Spacing is regular below 0.3.
     */
    public PeakFrequency analyzePeakFrequency(double[] values) {
        int[] indices = findPeaks(values).stream().mapToInt(Peak::index).sorted().toArray();
        if (indices.length < 2) {
            return new PeakFrequency(0, 0, false, indices.length);
        }

        double[] intervals = new double[indices.length - 1];
        for (int i = 1; i < indices.length; i++) {
            intervals[i - 1] = indices[i] - indices[i - 1];
        }
        double average = stats.mean(intervals);
        double variability = average == 0 ? 0 : stats.std(intervals) / average;

        return new PeakFrequency(
                average, variability, variability < REGULARITY_LIMIT, indices.length);
    }

    private void addSpike(
            List<Spike> spikes,
            double[] values,
            int start,
            int end,
            SpikeDirection direction,
            double mean,
            double std,
            int minDuration) {
        if (end - start < minDuration) return;
        double[] run = Arrays.copyOfRange(values, start, end);
        double extreme =
                direction == SpikeDirection.UP
                        ? Arrays.stream(run).max().orElse(mean)
                        : Arrays.stream(run).min().orElse(mean);
        spikes.add(
                new Spike(start, extreme, Math.abs(extreme - mean) / std, direction, end - start));
    }

    private static boolean tooClose(IntStream accepted, int index, int minDistance) {
        return accepted.anyMatch(existing -> Math.abs(existing - index) < minDistance);
    }

    /**
     * @param index sample index
     * @param value sample value
     * @param prominence height above the surrounding minima
     * @param width width in samples at half prominence
     */
    public record Peak(int index, double value, double prominence, int width) {}

    /**
     * @param index sample index
     * @param value sample value
     * @param depth depth below the surrounding maxima
     * @param width width in samples at half depth
     */
    public record Valley(int index, double value, double depth, int width) {}

    /**
     * @param index first sample of the run
     * @param value extreme value of the run
     * @param magnitude distance of the extreme from the mean, in standard deviations
     * @param direction up or down
     * @param duration run length in samples
     */
    public record Spike(
            int index, double value, double magnitude, SpikeDirection direction, int duration) {}

    /**
     * @param startIndex first sample of the match
     * @param endIndex last sample of the match, inclusive
     * @param similarity correlation with the template, 1 for exact repeats
     * @param pattern matched values
     */
    public record PatternMatch(int startIndex, int endIndex, double similarity, double[] pattern) {}

    /**
     * @param frequency cycles per time unit
     * @param amplitude square root of the power
     * @param phase always 0, phase is not estimated
     * @param power autocovariance at the period lag
     */
    public record FrequencyComponent(
            double frequency, double amplitude, double phase, double power) {}

    /**
     * @param averageInterval mean distance between consecutive peaks
     * @param intervalVariability coefficient of variation of the distances
     * @param regular whether the variability is below 0.3
     * @param peakCount number of peaks
     */
    public record PeakFrequency(
            double averageInterval, double intervalVariability, boolean regular, int peakCount) {}
}
