/* (C)2026 */
package com.ammann.telemetry.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class AnalysisMetricsTest {

    @Test
    void fetchesAreCountedPerOutcomeAndTimed() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AnalysisMetrics metrics = new AnalysisMetrics(registry);

        metrics.recordFetch(AnalysisMetrics.OUTCOME_SUCCESS, TimeUnit.MILLISECONDS.toNanos(12));
        metrics.recordFetch(AnalysisMetrics.OUTCOME_SUCCESS, TimeUnit.MILLISECONDS.toNanos(8));
        metrics.recordFetch(AnalysisMetrics.OUTCOME_ERROR, TimeUnit.MILLISECONDS.toNanos(30));

        assertThat(
                        registry.get(AnalysisMetrics.FETCH_COUNTER)
                                .tag("outcome", AnalysisMetrics.OUTCOME_SUCCESS)
                                .counter()
                                .count())
                .isEqualTo(2.0);
        assertThat(
                        registry.get(AnalysisMetrics.FETCH_COUNTER)
                                .tag("outcome", AnalysisMetrics.OUTCOME_ERROR)
                                .counter()
                                .count())
                .isEqualTo(1.0);
        assertThat(registry.get(AnalysisMetrics.FETCH_TIMER).timer().count()).isEqualTo(3);
        assertThat(
                        registry.get(AnalysisMetrics.FETCH_TIMER)
                                .timer()
                                .totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(50.0);
    }

    @Test
    void analysesAreCountedPerMethod() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AnalysisMetrics metrics = new AnalysisMetrics(registry);

        metrics.recordAnalysis("granger-causality");
        metrics.recordAnalysis("granger-causality");
        metrics.recordAnalysis("pattern-detection");

        assertThat(
                        registry.get(AnalysisMetrics.ANALYSIS_COUNTER)
                                .tag("method", "granger-causality")
                                .counter()
                                .count())
                .isEqualTo(2.0);
        assertThat(registry.find(AnalysisMetrics.ANALYSIS_COUNTER).counters()).hasSize(2);
    }

    @Test
    void noopInstanceRecordsNothing() {
        AnalysisMetrics metrics = AnalysisMetrics.noop();

        assertThatCode(
                        () -> {
                            metrics.recordFetch(AnalysisMetrics.OUTCOME_NOT_FOUND, 1);
                            metrics.recordAnalysis("basic-statistics");
                        })
                .doesNotThrowAnyException();
    }
}
