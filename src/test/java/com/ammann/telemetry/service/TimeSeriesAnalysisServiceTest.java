/* (C)2026 */
package com.ammann.telemetry.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.telemetry.enumeration.TrendDirection;
import com.ammann.telemetry.enumeration.TrendStrength;
import com.ammann.telemetry.exception.InvalidParameterException;
import com.ammann.telemetry.support.TestSeries;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TimeSeriesAnalysisServiceTest {

    private final TimeSeriesAnalysisService timeSeries =
            new TimeSeriesAnalysisService(new CoreStatisticsService());

    @Nested
    @DisplayName("Linear trend")
    class LinearTrend {

        @Test
        void perfectRampHasUnitSlopeAndFullFit() {
            TimeSeriesAnalysisService.TrendResult trend =
                    timeSeries.linearTrend(TestSeries.ramp(10));

            assertThat(trend.slope()).isCloseTo(1.0, within(1e-12));
            assertThat(trend.intercept()).isCloseTo(0.0, within(1e-12));
            assertThat(trend.rSquared()).isCloseTo(1.0, within(1e-12));
            assertThat(trend.direction()).isEqualTo(TrendDirection.UP);
            assertThat(trend.strength()).isEqualTo(TrendStrength.STRONG);
        }

        @Test
        void fallingSeriesTrendsDown() {
            TimeSeriesAnalysisService.TrendResult trend =
                    timeSeries.linearTrend(new double[] {10, 8, 6, 4, 2});

            assertThat(trend.slope()).isCloseTo(-2.0, within(1e-12));
            assertThat(trend.direction()).isEqualTo(TrendDirection.DOWN);
        }

        @Test
        void constantSeriesIsStableWithFullFit() {
            TimeSeriesAnalysisService.TrendResult trend =
                    timeSeries.linearTrend(TestSeries.constant(8, 3));

            assertThat(trend.slope()).isZero();
            assertThat(trend.rSquared()).isEqualTo(1.0);
            assertThat(trend.direction()).isEqualTo(TrendDirection.STABLE);
        }

        @Test
        void singleValueGivesWeakFlatTrend() {
            TimeSeriesAnalysisService.TrendResult trend =
                    timeSeries.linearTrend(new double[] {5});

            assertThat(trend.slope()).isZero();
            assertThat(trend.rSquared()).isZero();
            assertThat(trend.strength()).isEqualTo(TrendStrength.WEAK);
        }
    }

    @Nested
    @DisplayName("Smoothing")
    class Smoothing {

        @Test
        void unitWindowReproducesTheSeries() {
            double[] values = TestSeries.noise(30, 11);

            assertThat(timeSeries.simpleMovingAverage(values, 1)).containsExactly(values);
        }

        @Test
        void trailingAverageShrinksAtTheStart() {
            assertThat(timeSeries.simpleMovingAverage(new double[] {1, 2, 3, 4}, 2))
                    .containsExactly(1, 1.5, 2.5, 3.5);
        }

        @Test
        void windowLongerThanSeriesReturnsCopy() {
            double[] values = {1, 2, 3};

            assertThat(timeSeries.simpleMovingAverage(values, 5)).containsExactly(values);
        }

        @Test
        void rejectsNonPositiveWindow() {
            assertThatThrownBy(() -> timeSeries.simpleMovingAverage(new double[] {1, 2}, 0))
                    .isInstanceOf(InvalidParameterException.class)
                    .hasMessageContaining("window");
            assertThatThrownBy(() -> timeSeries.movingStandardDeviation(new double[] {1}, -1))
                    .isInstanceOf(InvalidParameterException.class);
        }

        @Test
        void exponentialAverageIsSeededWithFirstValue() {
            assertThat(timeSeries.exponentialMovingAverage(new double[] {1, 2, 3}, 0.5))
                    .containsExactly(1, 1.5, 2.25);
        }

        @Test
        void exponentialAverageFallsBackToDefaultAlpha() {
            double[] values = {0, 10};

            assertThat(timeSeries.exponentialMovingAverage(values, 7))
                    .containsExactly(timeSeries.exponentialMovingAverage(values));
            assertThat(timeSeries.exponentialMovingAverage(values)[1])
                    .isCloseTo(3.0, within(1e-12));
        }

        @Test
        void movingStandardDeviationOfConstantSeriesIsZero() {
            assertThat(timeSeries.movingStandardDeviation(TestSeries.constant(10, 2), 3))
                    .containsOnly(0.0);
        }
    }

    @Nested
    @DisplayName("Change points")
    class ChangePoints {

        @Test
        void levelShiftProducesChangePoints() {
            double[] values = new double[40];
            for (int i = 20; i < values.length; i++) {
                values[i] = 10;
            }

            List<TimeSeriesAnalysisService.ChangePoint> points =
                    timeSeries.detectChangePoints(values);

            assertThat(points).isNotEmpty();
            assertThat(points)
                    .extracting(TimeSeriesAnalysisService.ChangePoint::index)
                    .isSorted()
                    .allMatch(index -> index > 0 && index < values.length);
            assertThat(points).allMatch(point -> point.significance() > 2.0);
        }

        @Test
        void shortOrFlatSeriesHasNoChangePoints() {
            assertThat(timeSeries.detectChangePoints(TestSeries.ramp(9))).isEmpty();
            assertThat(timeSeries.detectChangePoints(TestSeries.constant(50, 1))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Autocorrelation and cycles")
    class Autocorrelation {

        @Test
        void sineIsCorrelatedAtItsPeriod() {
            TimeSeriesAnalysisService.AutocorrelationResult result =
                    timeSeries.autocorrelation(TestSeries.sine(120, 12));

            assertThat(result.correlations()).hasSize(31);
            assertThat(result.significantLags()).contains(12, 24);
            assertThat(result.optimalLag()).isEqualTo(1);
            assertThat(result.correlations()[12]).isGreaterThan(0.8);
            assertThat(result.correlations()[6]).isLessThan(-0.8);
        }

        @Test
        void maxLagIsCappedBelowSeriesLength() {
            TimeSeriesAnalysisService.AutocorrelationResult result =
                    timeSeries.autocorrelation(TestSeries.noise(10, 5), 50);

            assertThat(result.correlations()).hasSize(10);
        }

        @Test
        void constantSeriesIsFullyPersistent() {
            TimeSeriesAnalysisService.AutocorrelationResult result =
                    timeSeries.autocorrelation(TestSeries.constant(20, 4), 5);

            assertThat(result.correlations()).containsOnly(1.0);
            assertThat(result.persistent()).isTrue();
        }

        @Test
        void rejectsNonPositiveMaxLag() {
            assertThatThrownBy(() -> timeSeries.autocorrelation(TestSeries.ramp(10), 0))
                    .isInstanceOf(InvalidParameterException.class)
                    .hasMessageContaining("maxLag");
        }

        @Test
        void tooShortSeriesHasEmptyFunction() {
            assertThat(timeSeries.autocorrelation(new double[] {1, 2}).correlations()).isEmpty();
        }

        @Test
        void cyclesAreFoundAtThePeriod() {
            TimeSeriesAnalysisService.CyclicPatterns cycles =
                    timeSeries.detectCyclicPatterns(TestSeries.sine(120, 12));

            assertThat(cycles.periods()).contains(12);
            assertThat(cycles.strengths()).allMatch(strength -> strength > 0.3);
        }

        @Test
        void shortSeriesHasNoCycles() {
            assertThat(timeSeries.detectCyclicPatterns(TestSeries.ramp(5)).periods()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Seasonal decomposition")
    class Decomposition {

        @Test
        void componentsAddUpToTheSeries() {
            double[] values = TestSeries.sine(48, 12);

            TimeSeriesAnalysisService.SeasonalDecomposition result =
                    timeSeries.decompose(values, 12);

            for (int i = 0; i < values.length; i++) {
                assertThat(result.trend()[i] + result.seasonal()[i] + result.residual()[i])
                        .isCloseTo(values[i], within(1e-9));
            }
        }

        @Test
        void shortSeriesKeepsValuesAsTrend() {
            double[] values = {1, 2, 3};

            TimeSeriesAnalysisService.SeasonalDecomposition result =
                    timeSeries.decompose(values, 4);

            assertThat(result.trend()).containsExactly(values);
            assertThat(result.seasonal()).containsOnly(0.0);
        }

        @Test
        void rejectsNonPositivePeriod() {
            assertThatThrownBy(() -> timeSeries.decompose(TestSeries.ramp(10), 0))
                    .isInstanceOf(InvalidParameterException.class);
        }
    }
}
