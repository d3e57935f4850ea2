/* (C)2026 */
package com.ammann.telemetry.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

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
import com.ammann.telemetry.model.ValueRange;
import com.ammann.telemetry.support.TestSeries;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DataQualityServiceTest {

    private final DataQualityService service = new DataQualityService(new CoreStatisticsService());

    @Nested
    @DisplayName("Snapshot")
    class Snapshot {

        @Test
        void cleanSeriesIsPerfect() {
            double[] values = TestSeries.steady(30);

            DataQuality quality =
                    service.assessSnapshot(values, TestSeries.newestFirst(30), null);

            assertThat(quality.score()).isEqualTo(1.0);
            assertThat(quality.issues()).isEmpty();
            assertThat(quality.gaps()).isEmpty();
        }

        @Test
        void missingValuesCostUpToThirtyPercent() {
            double[] values = {1, Double.NaN, 2, 3};

            DataQuality quality = service.assessSnapshot(values, TestSeries.newestFirst(4), null);

            assertThat(quality.missingPoints()).isEqualTo(1);
            assertThat(quality.score()).isCloseTo(1 - 0.25 * 0.3, within(1e-12));
            assertThat(quality.issues()).containsExactly("1 missing/invalid values");
        }

        @Test
        void suspiciousValuesAreCountedAndPenalised() {
            DataQuality quality =
                    service.assessSnapshot(
                            TestSeries.withOutlier(), TestSeries.newestFirst(21), null);

            assertThat(quality.suspiciousValues()).isEqualTo(1);
            assertThat(quality.score()).isCloseTo(1 - 1.0 / 21, within(1e-12));
        }

        @Test
        void gapsInNewestFirstDataAreFound() {
            List<Instant> timestamps = new ArrayList<>(TestSeries.newestFirst(10));
            for (int i = 5; i < timestamps.size(); i++) {
                timestamps.set(i, timestamps.get(i).minusSeconds(30));
            }

            DataQuality quality = service.assessSnapshot(TestSeries.steady(10), timestamps, 1.0);

            assertThat(quality.gaps()).hasSize(1);
            assertThat(quality.gaps().get(0).durationMs()).isEqualTo(31_000L);
            assertThat(quality.score()).isCloseTo(0.9, within(1e-12));
        }

        @Test
        void snapshotIsIdempotent() {
            double[] values = TestSeries.withOutlier();
            List<Instant> timestamps = TestSeries.newestFirst(values.length);

            assertThat(service.assessSnapshot(values, timestamps, 1.0))
                    .isEqualTo(service.assessSnapshot(values, timestamps, 1.0));
        }

        @Test
        void scoreNeverDropsBelowZero() {
            double[] values = new double[10];
            Arrays.fill(values, Double.NaN);
            List<Instant> timestamps = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                timestamps.add(TestSeries.NOW.minusSeconds(i * 100L));
            }

            DataQuality quality = service.assessSnapshot(values, timestamps, 1.0);

            assertThat(quality.score()).isBetween(0.0, 1.0);
        }
    }

    @Nested
    @DisplayName("Sampling rate")
    class SamplingRate {

        @Test
        void requestedRateWins() {
            service.defaultSamplingRateHz = Optional.of(2.0);

            assertThat(service.resolveSamplingRate(0.5)).isEqualTo(0.5);
            assertThat(service.resolveSamplingRate(null)).isEqualTo(2.0);
        }

        @Test
        void noRateWithoutConfiguration() {
            assertThat(service.resolveSamplingRate(null)).isNull();
        }

        @Test
        void nonPositiveRateIsRejected() {
            assertThatThrownBy(() -> service.resolveSamplingRate(0.0))
                    .isInstanceOf(InvalidParameterException.class)
                    .hasMessageContaining("expectedSamplingRate");
        }
    }

    @Nested
    @DisplayName("Report")
    class Report {

        @Test
        void cleanStreamEarnsGradeA() {
            QualityReport report =
                    service.assessReport(
                            TestSeries.stream("zone-1-spacetemp", TestSeries.steady(20)),
                            null,
                            null);

            assertThat(report.grade()).isEqualTo(QualityGrade.A);
            assertThat(report.issues()).isEmpty();
            assertThat(report.recommendations()).isEmpty();
            assertThat(report.assessment().completeness()).isEqualTo(1.0);
            assertThat(report.context().sampleSize()).isEqualTo(20);
            assertThat(report.context().timeRange().from())
                    .isEqualTo(TestSeries.NOW.minusSeconds(19));
            assertThat(report.context().timeRange().to()).isEqualTo(TestSeries.NOW);
        }

        @Test
        void missingDataAndRangeViolationsAreHighSeverity() {
            double[] values = TestSeries.steady(10);
            values[1] = Double.NaN;
            values[3] = Double.NaN;
            values[5] = Double.NaN;
            values[7] = Double.NaN;
            values[8] = 40;

            QualityReport report =
                    service.assessReport(
                            TestSeries.stream("zone-1-spacetemp", values),
                            ValueRange.of(15, 30),
                            null);

            assertThat(report.assessment().completeness()).isCloseTo(0.6, within(1e-12));
            QualityIssue missing = issue(report, QualityIssueType.MISSING_DATA);
            assertThat(missing.severity()).isEqualTo(Severity.HIGH);
            assertThat(missing.count()).isEqualTo(4);
            QualityIssue range = issue(report, QualityIssueType.RANGE_VIOLATION);
            assertThat(range.severity()).isEqualTo(Severity.HIGH);
            assertThat(range.locations()).containsExactly(8);
            assertThat(report.recommendations())
                    .contains(
                            "Investigate data collection reliability",
                            "Verify sensor operating parameters");
        }

        @Test
        void spreadAroundZeroMeanIsFullNoise() {
            double[] values = new double[40];
            for (int i = 0; i < values.length; i++) {
                values[i] = i % 2 == 0 ? 5 : -5;
            }

            QualityReport report =
                    service.assessReport(
                            TestSeries.stream("outdoor-air-delta", values), null, null);

            assertThat(report.assessment().consistency()).isEqualTo(0.0);
            QualityIssue noise = issue(report, QualityIssueType.NOISE);
            assertThat(noise.percentage()).isEqualTo(100.0);
        }

        @Test
        void flatZeroStreamIsNotNoisy() {
            QualityReport report =
                    service.assessReport(
                            TestSeries.stream("outdoor-air-delta", TestSeries.constant(40, 0)),
                            null,
                            null);

            assertThat(report.assessment().consistency()).isEqualTo(1.0);
            assertThat(report.issues())
                    .extracting(QualityIssue::type)
                    .doesNotContain(QualityIssueType.NOISE);
        }

        @Test
        void driftIsReported() {
            double[] values = new double[40];
            for (int i = 0; i < values.length; i++) {
                values[i] = 20 + i;
            }

            QualityReport report =
                    service.assessReport(TestSeries.stream("boiler-flow", values), null, null);

            QualityIssue drift = issue(report, QualityIssueType.DRIFT);
            assertThat(drift.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(report.recommendations())
                    .contains("Monitor for continued drift and plan calibration");
        }

        @Test
        void gapsAreReportedWhenARateIsKnown() {
            List<Instant> timestamps = new ArrayList<>(TestSeries.newestFirst(20));
            for (int i = 10; i < timestamps.size(); i++) {
                timestamps.set(i, timestamps.get(i).minusSeconds(60));
            }

            QualityReport report =
                    service.assessReport(
                            TestSeries.stream(
                                    "zone-1-spacetemp", TestSeries.steady(20), timestamps),
                            null,
                            1.0);

            QualityIssue gaps = issue(report, QualityIssueType.GAPS);
            assertThat(gaps.count()).isEqualTo(1);
            assertThat(gaps.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(report.assessment().timeliness()).isCloseTo(0.9, within(1e-12));
        }

        @Test
        void reportIsDeterministicApartFromItsTimestamp() {
            StreamContext stream = TestSeries.stream("zone-1-spacetemp", TestSeries.withOutlier());

            QualityReport first = service.assessReport(stream, null, null);
            QualityReport second = service.assessReport(stream, null, null);

            assertThat(second.overallScore()).isEqualTo(first.overallScore());
            assertThat(second.issues()).isEqualTo(first.issues());
            assertThat(second.assessment()).isEqualTo(first.assessment());
        }
    }

    @Nested
    @DisplayName("Health monitoring")
    class Health {

        @Test
        void steadyStreamIsStable() {
            DataHealthTrend trend =
                    service.monitorHealth(
                            TestSeries.stream("zone-1-spacetemp", TestSeries.steady(400)), 100);

            assertThat(trend.windowCount()).isEqualTo(6);
            assertThat(trend.trend()).isEqualTo(HealthTrend.STABLE);
            assertThat(trend.recentChanges()).isEmpty();
        }

        @Test
        void recentGapsInNewestFirstDataDegradeHealth() {
            double[] values = TestSeries.steady(400);
            for (int i = 0; i < 200; i += 2) {
                values[i] = Double.NaN;
            }

            DataHealthTrend trend =
                    service.monitorHealth(TestSeries.stream("zone-1-spacetemp", values), 100);

            assertThat(trend.trend()).isEqualTo(HealthTrend.DEGRADING);
            assertThat(trend.healthScore()).isLessThan(0.95);
        }

        @Test
        void shortStreamIsScoredAsOneWindow() {
            DataHealthTrend trend =
                    service.monitorHealth(
                            TestSeries.stream("zone-1-spacetemp", TestSeries.steady(50)), 100);

            assertThat(trend.windowCount()).isEqualTo(1);
            assertThat(trend.trend()).isEqualTo(HealthTrend.STABLE);
        }

        @Test
        void rejectsNonPositiveWindow() {
            StreamContext stream = TestSeries.stream("zone-1-spacetemp", TestSeries.steady(10));

            assertThatThrownBy(() -> service.monitorHealth(stream, 0))
                    .isInstanceOf(InvalidParameterException.class);
        }
    }

    @Nested
    @DisplayName("Period comparison")
    class Comparison {

        @Test
        void newIssueTypesAndDegradationAreListed() {
            QualityReport clean =
                    service.assessReport(
                            TestSeries.stream("zone-1-spacetemp", TestSeries.steady(20)),
                            null,
                            null);
            double[] broken = TestSeries.steady(20);
            for (int i = 0; i < 10; i++) {
                broken[i * 2] = Double.NaN;
            }
            QualityReport degraded =
                    service.assessReport(
                            TestSeries.stream("zone-1-spacetemp", broken), null, null);

            QualityPeriodComparison comparison = service.comparePeriods(clean, degraded);

            assertThat(comparison.trendDirection()).isEqualTo(PeriodTrend.DEGRADED);
            assertThat(comparison.scoreChange()).isNegative();
            assertThat(comparison.significantChanges())
                    .contains(
                            "New issue type appeared: missing_data",
                            "completeness degraded by 50.0%");
        }

        @Test
        void resolvedIssuesAndImprovementAreListed() {
            double[] broken = TestSeries.steady(20);
            for (int i = 0; i < 10; i++) {
                broken[i * 2] = Double.NaN;
            }
            QualityReport before =
                    service.assessReport(
                            TestSeries.stream("zone-1-spacetemp", broken), null, null);
            QualityReport after =
                    service.assessReport(
                            TestSeries.stream("zone-1-spacetemp", TestSeries.steady(20)),
                            null,
                            null);

            QualityPeriodComparison comparison = service.comparePeriods(before, after);

            assertThat(comparison.trendDirection()).isEqualTo(PeriodTrend.IMPROVED);
            assertThat(comparison.significantChanges())
                    .contains("Issue type resolved: missing_data");
        }

        @Test
        void identicalReportsAreUnchanged() {
            QualityReport report =
                    service.assessReport(
                            TestSeries.stream("zone-1-spacetemp", TestSeries.steady(20)),
                            null,
                            null);

            QualityPeriodComparison comparison = service.comparePeriods(report, report);

            assertThat(comparison.trendDirection()).isEqualTo(PeriodTrend.UNCHANGED);
            assertThat(comparison.significantChanges()).isEmpty();
        }
    }

    private static QualityIssue issue(QualityReport report, QualityIssueType type) {
        return report.issues().stream()
                .filter(issue -> issue.type() == type)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No " + type + " issue in " + report));
    }
}
