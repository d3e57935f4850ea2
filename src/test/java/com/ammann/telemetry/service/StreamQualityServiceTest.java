/* (C)2026 */
package com.ammann.telemetry.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.telemetry.dto.DataHealthTrend;
import com.ammann.telemetry.dto.QualityPeriodComparison;
import com.ammann.telemetry.dto.QualityReport;
import com.ammann.telemetry.enumeration.HealthTrend;
import com.ammann.telemetry.enumeration.PeriodTrend;
import com.ammann.telemetry.enumeration.QualityGrade;
import com.ammann.telemetry.enumeration.QualityIssueType;
import com.ammann.telemetry.exception.StreamNotFoundException;
import com.ammann.telemetry.model.StreamQuery;
import com.ammann.telemetry.model.TimeRange;
import com.ammann.telemetry.model.ValueRange;
import com.ammann.telemetry.support.TestSeries;
import java.time.Duration;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.junit.jupiter.api.Test;

class StreamQualityServiceTest {

    private static final String ROOM = "zone-1-spacetemp";

    private final StreamAccessService access = mock(StreamAccessService.class);
    private final StreamQualityService quality =
            new StreamQualityService(
                    access,
                    new DataQualityService(new CoreStatisticsService()),
                    Runnable::run,
                    AnalysisMetrics.noop());

    private final TimeRange yesterday =
            TimeRange.lastPeriod(TestSeries.NOW.minus(Duration.ofDays(1)), Duration.ofDays(1));
    private final TimeRange today = TimeRange.lastPeriod(TestSeries.NOW, Duration.ofDays(1));

    private static double[] halfMissing(int count) {
        double[] values = TestSeries.steady(count);
        for (int i = 0; i < count; i += 2) {
            values[i] = Double.NaN;
        }
        return values;
    }

    @Test
    void reportUsesDefaultSliceAndDeclaredRange() {
        double[] values = TestSeries.steady(30);
        values[4] = 45;
        StreamQuery query = StreamQuery.of(ROOM);
        when(access.fetch(query, StreamQualityService.REPORT_COUNT))
                .thenReturn(TestSeries.stream(ROOM, values));

        QualityReport report =
                quality.assessStreamDataQuality(query, ValueRange.temperature(), null);

        verify(access).fetch(query, StreamQualityService.REPORT_COUNT);
        assertThat(report.streamId()).isEqualTo(ROOM);
        assertThat(report.issues())
                .anySatisfy(
                        issue -> {
                            assertThat(issue.type()).isEqualTo(QualityIssueType.RANGE_VIOLATION);
                            assertThat(issue.locations()).containsExactly(4);
                        });
    }

    @Test
    void cleanSliceGetsTopGrade() {
        when(access.fetch(any(), anyInt()))
                .thenReturn(TestSeries.stream(ROOM, TestSeries.steady(40)));

        QualityReport report = quality.assessStreamDataQuality(StreamQuery.recent(ROOM, 40));

        assertThat(report.grade()).isEqualTo(QualityGrade.A);
    }

    @Test
    void healthIsMonitoredOverTheRequestedWindow() {
        when(access.fetch(StreamQuery.window(ROOM, today), StreamQualityService.REPORT_COUNT))
                .thenReturn(TestSeries.stream(ROOM, TestSeries.steady(400)));

        DataHealthTrend trend = quality.monitorStreamHealth(ROOM, today);

        assertThat(trend.windowCount()).isEqualTo(6);
        assertThat(trend.trend()).isEqualTo(HealthTrend.STABLE);
    }

    @Test
    void degradedPeriodIsDetected() {
        when(access.fetch(StreamQuery.window(ROOM, yesterday), StreamQualityService.REPORT_COUNT))
                .thenReturn(TestSeries.stream(ROOM, TestSeries.steady(20)));
        when(access.fetch(StreamQuery.window(ROOM, today), StreamQualityService.REPORT_COUNT))
                .thenReturn(TestSeries.stream(ROOM, halfMissing(20)));

        QualityPeriodComparison comparison =
                quality.compareStreamQualityPeriods(ROOM, yesterday, today);

        assertThat(comparison.trendDirection()).isEqualTo(PeriodTrend.DEGRADED);
        assertThat(comparison.scoreChange()).isNegative();
        assertThat(comparison.significantChanges())
                .contains("New issue type appeared: missing_data");
    }

    @Test
    void periodsAreComparedOnTheFetchExecutor() {
        ManagedExecutor executor = ManagedExecutor.builder().maxAsync(4).maxQueued(64).build();
        try {
            StreamQualityService concurrent =
                    new StreamQualityService(
                            access,
                            new DataQualityService(new CoreStatisticsService()),
                            executor,
                            AnalysisMetrics.noop());
            when(access.fetch(
                            StreamQuery.window(ROOM, yesterday), StreamQualityService.REPORT_COUNT))
                    .thenReturn(TestSeries.stream(ROOM, halfMissing(20)));
            when(access.fetch(
                            StreamQuery.window(ROOM, today), StreamQualityService.REPORT_COUNT))
                    .thenReturn(TestSeries.stream(ROOM, TestSeries.steady(20)));

            QualityPeriodComparison comparison =
                    concurrent.compareStreamQualityPeriods(ROOM, yesterday, today);

            assertThat(comparison.trendDirection()).isEqualTo(PeriodTrend.IMPROVED);
            assertThat(comparison.scoreChange()).isPositive();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void failedPeriodFailsTheComparison() {
        when(access.fetch(StreamQuery.window(ROOM, yesterday), StreamQualityService.REPORT_COUNT))
                .thenReturn(TestSeries.stream(ROOM, TestSeries.steady(20)));
        when(access.fetch(StreamQuery.window(ROOM, today), StreamQualityService.REPORT_COUNT))
                .thenThrow(StreamNotFoundException.noData(ROOM));

        assertThatThrownBy(() -> quality.compareStreamQualityPeriods(ROOM, yesterday, today))
                .isInstanceOf(StreamNotFoundException.class);
    }
}
