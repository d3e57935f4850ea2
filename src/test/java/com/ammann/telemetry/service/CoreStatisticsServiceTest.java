/* (C)2026 */
package com.ammann.telemetry.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.telemetry.exception.InvalidParameterException;
import com.ammann.telemetry.support.TestSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CoreStatisticsServiceTest {

    private static final double[] ONE_TO_FIVE = {1, 2, 3, 4, 5};

    private final CoreStatisticsService stats = new CoreStatisticsService();

    @Nested
    @DisplayName("Moments")
    class Moments {

        @Test
        void meanAndSampleStandardDeviation() {
            assertThat(stats.mean(ONE_TO_FIVE)).isEqualTo(3.0);
            assertThat(stats.variance(ONE_TO_FIVE)).isCloseTo(2.5, within(1e-12));
            assertThat(stats.std(ONE_TO_FIVE)).isCloseTo(Math.sqrt(2.5), within(1e-12));
        }

        @Test
        void meanIgnoresOrder() {
            double[] shuffled = {4, 1, 5, 3, 2};

            assertThat(stats.mean(shuffled)).isEqualTo(stats.mean(ONE_TO_FIVE));
            assertThat(stats.std(shuffled)).isCloseTo(stats.std(ONE_TO_FIVE), within(1e-12));
        }

        @Test
        void degenerateInputYieldsZeros() {
            assertThat(stats.mean(new double[0])).isZero();
            assertThat(stats.std(new double[] {42})).isZero();
            assertThat(stats.median(new double[0])).isZero();
            assertThat(stats.skewness(new double[] {1, 2})).isZero();
            assertThat(stats.kurtosis(new double[] {1, 2, 3})).isZero();
        }

        @Test
        void constantSeriesHasNoSpreadOrShape() {
            double[] flat = TestSeries.constant(10, 7);

            assertThat(stats.std(flat)).isZero();
            assertThat(stats.skewness(flat)).isZero();
            assertThat(stats.kurtosis(flat)).isZero();
            assertThat(stats.zScores(flat)).containsOnly(0.0);
        }

        @Test
        void skewnessSignFollowsTheLongTail() {
            assertThat(stats.skewness(new double[] {1, 1, 1, 1, 10})).isPositive();
            assertThat(stats.skewness(new double[] {10, 10, 10, 10, 1})).isNegative();
            assertThat(stats.skewness(ONE_TO_FIVE)).isCloseTo(0.0, within(1e-12));
        }
    }

    @Nested
    @DisplayName("Order statistics")
    class OrderStatistics {

        @Test
        void medianOfOddAndEvenLengths() {
            assertThat(stats.median(new double[] {5, 1, 3})).isEqualTo(3.0);
            assertThat(stats.median(new double[] {4, 1, 3, 2})).isEqualTo(2.5);
        }

        @Test
        void quantileInterpolatesBetweenRanks() {
            assertThat(stats.quantile(ONE_TO_FIVE, 0)).isEqualTo(1.0);
            assertThat(stats.quantile(ONE_TO_FIVE, 1)).isEqualTo(5.0);
            assertThat(stats.quantile(new double[] {1, 2, 3, 4}, 0.5)).isEqualTo(2.5);
            assertThat(stats.iqr(ONE_TO_FIVE)).isEqualTo(2.0);
        }

        @Test
        void halfQuantileMatchesMedian() {
            double[] values = TestSeries.noise(51, 7);

            assertThat(stats.quantile(values, 0.5))
                    .isCloseTo(stats.median(values), within(1e-12));
        }

        @ParameterizedTest
        @ValueSource(doubles = {-0.1, 1.1, Double.NaN})
        void quantileRejectsPercentileOutsideUnitInterval(double percentile) {
            assertThatThrownBy(() -> stats.quantile(ONE_TO_FIVE, percentile))
                    .isInstanceOf(InvalidParameterException.class)
                    .hasMessageContaining("percentile");
        }
    }

    @Nested
    @DisplayName("Summaries")
    class Summaries {

        @Test
        void basicStatisticsCollectsAllFields() {
            CoreStatisticsService.BasicStatistics result = stats.basicStatistics(ONE_TO_FIVE);

            assertThat(result.count()).isEqualTo(5);
            assertThat(result.mean()).isEqualTo(3.0);
            assertThat(result.min()).isEqualTo(1.0);
            assertThat(result.max()).isEqualTo(5.0);
            assertThat(result.median()).isEqualTo(3.0);
            assertThat(result.q25()).isEqualTo(2.0);
            assertThat(result.q75()).isEqualTo(4.0);
            assertThat(result.iqr()).isEqualTo(2.0);
        }

        @Test
        void basicStatisticsOfEmptySeriesIsEmpty() {
            assertThat(stats.basicStatistics(new double[0]))
                    .isEqualTo(CoreStatisticsService.BasicStatistics.empty());
        }

        @Test
        void gaussianNoiseLooksNormal() {
            CoreStatisticsService.NormalityResult result =
                    stats.testNormality(TestSeries.noise(500, 3));

            assertThat(result.normal()).isTrue();
            assertThat(result.pValue()).isBetween(0.0, 1.0);
        }

        @Test
        void normalityNeedsThreeSamples() {
            CoreStatisticsService.NormalityResult result =
                    stats.testNormality(new double[] {1, 2});

            assertThat(result.normal()).isFalse();
            assertThat(result.pValue()).isZero();
        }

        @Test
        void normalPdfPeaksAtTheMean() {
            double peak = stats.normalPdf(0, 0, 1);

            assertThat(peak).isCloseTo(1 / Math.sqrt(2 * Math.PI), within(1e-12));
            assertThat(stats.normalPdf(1, 0, 1)).isLessThan(peak);
            assertThat(stats.normalPdf(0, 0, 0)).isZero();
        }
    }

    @Nested
    @DisplayName("Entropy")
    class Entropy {

        @Test
        void uniformHistogramHasMaximalEntropy() {
            double[] values = {0, 1, 2, 3, 4, 5, 6, 7};

            assertThat(stats.entropy(values, 8)).isCloseTo(3.0, within(1e-12));
        }

        @Test
        void constantSeriesHasZeroEntropy() {
            assertThat(stats.entropy(TestSeries.constant(20, 4))).isZero();
        }

        @Test
        void rejectsNonPositiveBinCount() {
            assertThatThrownBy(() -> stats.entropy(ONE_TO_FIVE, 0))
                    .isInstanceOf(InvalidParameterException.class);
        }
    }
}
