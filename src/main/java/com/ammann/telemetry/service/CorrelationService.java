/* (C)2026 */
package com.ammann.telemetry.service;

import com.ammann.telemetry.enumeration.CausalityDirection;
import com.ammann.telemetry.enumeration.CorrelationDirection;
import com.ammann.telemetry.enumeration.CorrelationStrength;
import com.ammann.telemetry.enumeration.PairSignificance;
import com.ammann.telemetry.enumeration.SynchronizedEventType;
import com.ammann.telemetry.exception.InvalidParameterException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Relationships between series: Pearson and lagged correlation, correlation matrices, a
 * predictive-improvement causality heuristic, synchronized events and cascades.
 *
 * <p>Series passed together are expected to be aligned already; index {@code i} must mean
 * the same moment in each of them.
 */
@ApplicationScoped
public class CorrelationService {

    private static final Logger LOG = Logger.getLogger(CorrelationService.class);

    static final int DEFAULT_MAX_LAG = 20;
    static final double DEFAULT_SIGNIFICANCE_THRESHOLD = 0.5;
    static final int DEFAULT_CAUSALITY_MAX_LAG = 5;
    static final double AUTOREGRESSIVE_WEIGHT = 0.7;
    static final double PREDICTOR_WEIGHT = 0.3;
    static final double BIDIRECTIONAL_IMPROVEMENT = 0.1;
    static final int DEFAULT_EVENT_WINDOW = 3;
    static final double DEFAULT_EVENT_THRESHOLD = 2.0;
    static final int DEFAULT_MAX_DELAY = 10;
    static final double FOLLOWER_MIN_CORRELATION = 0.4;

    private final CoreStatisticsService stats;

    @Inject
    public CorrelationService(CoreStatisticsService stats) {
        this.stats = stats;
    }

    /**
     * Pearson correlation with a t-statistic based significance and a rough p-value.
     *
     * <p>Series of different length, shorter than two, or without spread yield correlation
     * 0 with strength {@code none}.
     */
    public CorrelationResult correlation(double[] x, double[] y) {
        int n = x.length;
        if (n != y.length || n < 2) {
            return CorrelationResult.none();
        }
        double stdX = stats.std(x);
        double stdY = stats.std(y);
        if (stdX == 0 || stdY == 0) {
            return CorrelationResult.none();
        }

        double meanX = stats.mean(x);
        double meanY = stats.mean(y);
        double sum = 0;
        for (int i = 0; i < n; i++) {
            sum += ((x[i] - meanX) / stdX) * ((y[i] - meanY) / stdY);
        }
        double r = Math.max(-1, Math.min(1, sum / (n - 1)));

        double tStat = r * Math.sqrt((n - 2) / Math.max(1e-12, 1 - r * r));
        double pValue = n > 2 ? Math.max(0, 1 - Math.abs(r) * Math.sqrt(n / 2.0)) : 1;

        return new CorrelationResult(
                r,
                Math.abs(tStat),
                pValue,
                CorrelationStrength.fromCoefficient(r),
                CorrelationDirection.fromCoefficient(r));
    }

    public CrossCorrelationResult crossCorrelation(double[] x, double[] y) {
        return crossCorrelation(x, y, DEFAULT_MAX_LAG);
    }

    /**
     * Correlation at every lag in {@code [-maxLag, maxLag]}, with {@code maxLag} capped at
     * {@code n / 4}. A positive lag means {@code x} leads {@code y}.
     *
     * @return correlations per lag; empty for mismatched lengths or fewer than 3 samples
     */
    public CrossCorrelationResult crossCorrelation(double[] x, double[] y, int maxLag) {
        int n = x.length;
        if (n != y.length || n < 3) {
            return new CrossCorrelationResult(new double[0], new int[0], 0, 0, 0);
        }
        int effectiveMaxLag = Math.max(0, Math.min(maxLag, n / 4));

        double[] correlations = new double[2 * effectiveMaxLag + 1];
        int[] lags = new int[2 * effectiveMaxLag + 1];
        double maxCorrelation = 0;
        int optimalLag = 0;
        for (int lag = -effectiveMaxLag; lag <= effectiveMaxLag; lag++) {
            int k = lag + effectiveMaxLag;
            lags[k] = lag;
            correlations[k] = laggedCorrelation(x, y, lag);
            if (Math.abs(correlations[k]) > Math.abs(maxCorrelation)) {
                maxCorrelation = correlations[k];
                optimalLag = lag;
            }
        }

        double confidence = Math.min(0.99, Math.abs(maxCorrelation) * Math.sqrt(n / 100.0));
        return new CrossCorrelationResult(
                correlations, lags, maxCorrelation, optimalLag, confidence);
    }

    public CorrelationMatrix correlationMatrix(Map<String, double[]> streams) {
        return correlationMatrix(streams, DEFAULT_SIGNIFICANCE_THRESHOLD);
    }

    /**
     * Pairwise correlations of all named series. Pairs at or above the threshold are listed,
     * strongest first.
     *
     * @param streams series keyed by name; iteration order defines the matrix order
     * @param significanceThreshold minimum absolute correlation of a listed pair
     */
    public CorrelationMatrix correlationMatrix(
            Map<String, double[]> streams, double significanceThreshold) {
        List<String> labels = List.copyOf(streams.keySet());
        int n = labels.size();
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double r =
                        correlation(streams.get(labels.get(i)), streams.get(labels.get(j)))
                                .correlation();
                matrix[i][j] = r;
                matrix[j][i] = r;
            }
        }

        List<CorrelatedPair> strongPairs = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double r = matrix[i][j];
                if (Math.abs(r) >= significanceThreshold) {
                    strongPairs.add(
                            new CorrelatedPair(
                                    labels.get(i),
                                    labels.get(j),
                                    r,
                                    PairSignificance.fromCoefficient(r)));
                }
            }
        }
        strongPairs.sort(
                Comparator.comparingDouble((CorrelatedPair p) -> Math.abs(p.correlation()))
                        .reversed());

        return new CorrelationMatrix(matrix, labels, List.copyOf(strongPairs));
    }

    public CausalityResult detectCausality(double[] x, double[] y) {
        return detectCausality(x, y, DEFAULT_CAUSALITY_MAX_LAG);
    }

    /**
     * Lagged predictive-improvement heuristic in the spirit of a Granger test.
     *
     * <p>For every lag the one-step persistence forecast of each series is compared with a
     * forecast blending in the other series with fixed weights 0.7 and 0.3. The lag with
     * the largest combined relative error reduction wins. The weights are not fitted.
     *
     * @param x first series
     * @param y second series, aligned with {@code x}
     * @param maxLag highest lag to try
     * @return verdict; {@code no_causality} for mismatched lengths or fewer than
     *     {@code 3 * maxLag} samples
     * @throws InvalidParameterException if {@code maxLag <= 0}
     */
    public CausalityResult detectCausality(double[] x, double[] y, int maxLag) {
        if (maxLag <= 0) {
            throw InvalidParameterException.invalidParameter(
                    "maxLag", maxLag, "a positive integer");
        }
        if (x.length != y.length || x.length < maxLag * 3) {
            return new CausalityResult(CausalityDirection.NO_CAUSALITY, 0, 0, 0);
        }

        int bestLag = 1;
        double maxImprovement = 0;
        CausalityDirection best = CausalityDirection.NO_CAUSALITY;
        for (int lag = 1; lag <= maxLag; lag++) {
            double xy = predictiveImprovement(y, x, lag);
            double yx = predictiveImprovement(x, y, lag);
            double total = xy + yx;
            if (total > maxImprovement) {
                maxImprovement = total;
                bestLag = lag;
                if (xy > BIDIRECTIONAL_IMPROVEMENT && yx > BIDIRECTIONAL_IMPROVEMENT) {
                    best = CausalityDirection.BIDIRECTIONAL;
                } else if (xy > yx) {
                    best = CausalityDirection.X_CAUSES_Y;
                } else if (yx > xy) {
                    best = CausalityDirection.Y_CAUSES_X;
                } else {
                    best = CausalityDirection.NO_CAUSALITY;
                }
            }
        }

        return new CausalityResult(
                best, maxImprovement, Math.min(0.95, maxImprovement * 2), bestLag);
    }

    public List<SynchronizedEvent> detectSynchronizedEvents(Map<String, double[]> streams) {
        return detectSynchronizedEvents(streams, DEFAULT_EVENT_WINDOW, DEFAULT_EVENT_THRESHOLD);
    }

    /**
     * Indices at which at least two series exceed {@code |z| > threshold} simultaneously.
     * Events no more than {@code timeWindow} samples after the previous merged event are
     * folded into it (union of streams, maximum magnitude and correlation score).
     *
     * @return merged events, largest magnitude first; empty for fewer than two series
     */
    public List<SynchronizedEvent> detectSynchronizedEvents(
            Map<String, double[]> streams, int timeWindow, double threshold) {
        List<SynchronizedEvent> merged = new ArrayList<>();
        if (streams.size() < 2) return merged;

        int length = streams.values().stream().mapToInt(v -> v.length).min().orElse(0);
        List<String> names = List.copyOf(streams.keySet());
        double[][] z = new double[names.size()][];
        for (int s = 0; s < names.size(); s++) {
            z[s] = stats.zScores(Arrays.copyOf(streams.get(names.get(s)), length));
        }

        List<SynchronizedEvent> events = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            List<String> involved = new ArrayList<>();
            List<Double> eventZ = new ArrayList<>();
            double totalMagnitude = 0;
            SynchronizedEventType type = SynchronizedEventType.CHANGE;
            for (int s = 0; s < names.size(); s++) {
                double score = z[s][i];
                if (Math.abs(score) <= threshold) continue;
                involved.add(names.get(s));
                eventZ.add(score);
                totalMagnitude += Math.abs(score);
                if (score > threshold) {
                    type = SynchronizedEventType.SPIKE;
                } else {
                    type =
                            type == SynchronizedEventType.SPIKE
                                    ? SynchronizedEventType.CHANGE
                                    : SynchronizedEventType.DIP;
                }
            }

            if (involved.size() >= 2) {
                double[] scores = eventZ.stream().mapToDouble(Double::doubleValue).toArray();
                double correlationScore = Math.abs(correlation(scores, scores).correlation());
                events.add(
                        new SynchronizedEvent(
                                i,
                                List.copyOf(involved),
                                correlationScore,
                                type,
                                totalMagnitude / involved.size()));
            }
        }

        SynchronizedEvent current = null;
        for (SynchronizedEvent event : events) {
            if (current == null || event.index() - current.index() > timeWindow) {
                if (current != null) merged.add(current);
                current = event;
            } else {
                Set<String> union = new LinkedHashSet<>(current.streams());
                union.addAll(event.streams());
                current =
                        new SynchronizedEvent(
                                current.index(),
                                List.copyOf(union),
                                Math.max(current.correlationScore(), event.correlationScore()),
                                current.eventType(),
                                Math.max(current.magnitude(), event.magnitude()));
            }
        }
        if (current != null) merged.add(current);

        merged.sort(Comparator.comparingDouble(SynchronizedEvent::magnitude).reversed());
        LOG.debugf(
                "Found %d synchronized events (%d before merging) across %d streams",
                merged.size(), events.size(), streams.size());
        return merged;
    }

    public List<Cascade> analyzeCascadingFailures(Map<String, double[]> streams) {
        return analyzeCascadingFailures(streams, DEFAULT_MAX_DELAY);
    }

    /**
     * For every ordered pair of series, the delay in {@code 1..maxDelay} with the strongest
     * lagged correlation is kept. Delays beyond a quarter of the series length count as
     * uncorrelated. Pairs above 0.4 make the second series a follower of the first.
     *
     * @return initiators with at least one follower, ranked by mean absolute follower
     *     correlation; followers are ordered by delay
     * @throws InvalidParameterException if {@code maxDelay <= 0}
     */
    public List<Cascade> analyzeCascadingFailures(Map<String, double[]> streams, int maxDelay) {
        if (maxDelay <= 0) {
            throw InvalidParameterException.invalidParameter(
                    "maxDelay", maxDelay, "a positive integer");
        }
        List<Cascade> cascades = new ArrayList<>();
        for (Map.Entry<String, double[]> initiator : streams.entrySet()) {
            List<Follower> followers = new ArrayList<>();
            for (Map.Entry<String, double[]> follower : streams.entrySet()) {
                if (initiator.getKey().equals(follower.getKey())) continue;

                double[] x = initiator.getValue();
                double[] y = follower.getValue();
                double bestCorrelation = 0;
                int bestDelay = 0;
                for (int delay = 1; delay <= maxDelay; delay++) {
                    double r =
                            x.length == y.length && x.length >= 3 && delay <= x.length / 4
                                    ? laggedCorrelation(x, y, delay)
                                    : 0;
                    if (Math.abs(r) > Math.abs(bestCorrelation)) {
                        bestCorrelation = r;
                        bestDelay = delay;
                    }
                }
                if (Math.abs(bestCorrelation) > FOLLOWER_MIN_CORRELATION) {
                    followers.add(new Follower(follower.getKey(), bestDelay, bestCorrelation));
                }
            }

            if (!followers.isEmpty()) {
                followers.sort(Comparator.comparingInt(Follower::delay));
                double strength =
                        followers.stream()
                                .mapToDouble(f -> Math.abs(f.correlation()))
                                .average()
                                .orElse(0);
                cascades.add(new Cascade(initiator.getKey(), List.copyOf(followers), strength));
            }
        }

        cascades.sort(Comparator.comparingDouble(Cascade::cascadeStrength).reversed());
        return cascades;
    }

    /** Correlation of {@code x[t]} with {@code y[t + lag]} over the overlapping part. */
    private double laggedCorrelation(double[] x, double[] y, int lag) {
        int n = x.length;
        double[] xs;
        double[] ys;
        if (lag >= 0) {
            xs = Arrays.copyOfRange(x, 0, n - lag);
            ys = Arrays.copyOfRange(y, lag, n);
        } else {
            xs = Arrays.copyOfRange(x, -lag, n);
            ys = Arrays.copyOfRange(y, 0, n + lag);
        }
        return correlation(xs, ys).correlation();
    }

    /**
     * Relative reduction of the squared one-step forecast error of {@code target} when the
     * persistence forecast is blended with {@code predictor} at the given lag.
     */
    private double predictiveImprovement(double[] target, double[] predictor, int lag) {
        if (target.length <= lag + 2) return 0;

        double ssePersistence = 0;
        double sseBlended = 0;
        for (int i = lag; i < target.length - 1; i++) {
            double actual = target[i + 1];
            double previous = target[i];
            double blended =
                    AUTOREGRESSIVE_WEIGHT * previous + PREDICTOR_WEIGHT * predictor[i - lag + 1];
            ssePersistence += (actual - previous) * (actual - previous);
            sseBlended += (actual - blended) * (actual - blended);
        }
        double improvement =
                ssePersistence > 0 ? (ssePersistence - sseBlended) / ssePersistence : 0;
        return Math.max(0, improvement);
    }

    /**
     * @param correlation Pearson coefficient in [-1, 1]
     * @param significance absolute t-statistic
     * @param pValue rough p-value for ranking
     * @param strength magnitude band
     * @param direction sign band
     */
    public record CorrelationResult(
            double correlation,
            double significance,
            double pValue,
            CorrelationStrength strength,
            CorrelationDirection direction) {

        public static CorrelationResult none() {
            return new CorrelationResult(
                    0, 0, 1, CorrelationStrength.NONE, CorrelationDirection.NONE);
        }
    }

    /**
     * @param correlations correlation per lag
     * @param lags lag of each correlation
     * @param maxCorrelation correlation with the largest magnitude
     * @param optimalLag lag of {@code maxCorrelation}
     * @param confidence heuristic confidence in [0, 0.99]
     */
    public record CrossCorrelationResult(
            double[] correlations,
            int[] lags,
            double maxCorrelation,
            int optimalLag,
            double confidence) {}

    /**
     * @param matrix symmetric correlation matrix with ones on the diagonal
     * @param labels series names in matrix order
     * @param strongPairs pairs at or above the threshold, strongest first
     */
    public record CorrelationMatrix(
            double[][] matrix, List<String> labels, List<CorrelatedPair> strongPairs) {}

    /**
     * @param stream1 first series
     * @param stream2 second series
     * @param correlation Pearson coefficient
     * @param significance magnitude label
     */
    public record CorrelatedPair(
            String stream1, String stream2, double correlation, PairSignificance significance) {}

    /**
     * @param causality direction verdict
     * @param strength combined error reduction at the best lag
     * @param confidence {@code min(0.95, 2 * strength)}
     * @param optimalLag best lag
     */
    public record CausalityResult(
            CausalityDirection causality, double strength, double confidence, int optimalLag) {}

    /**
     * @param index sample index of the (first) event
     * @param streams series involved
     * @param correlationScore agreement score of the involved z-scores
     * @param eventType spike, dip or mixed change
     * @param magnitude mean absolute z-score of the involved series
     */
    public record SynchronizedEvent(
            int index,
            List<String> streams,
            double correlationScore,
            SynchronizedEventType eventType,
            double magnitude) {}

    /**
     * @param stream follower series
     * @param delay delay in samples
     * @param correlation lagged correlation at that delay
     */
    public record Follower(String stream, int delay, double correlation) {}

    /**
     * @param initiator leading series
     * @param followers followers ordered by delay
     * @param cascadeStrength mean absolute follower correlation
     */
    public record Cascade(String initiator, List<Follower> followers, double cascadeStrength) {}
}
