package org.caureq.opsinsights.service.baseline;

import org.caureq.opsinsights.Series;
import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.service.source.MetricSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BaselineLearnerTest {
    private static final Instant NOW = Instant.parse("2026-03-08T00:00:00Z");

    @Mock
    MetricSource source;
    @Mock
    BaselineStore store;

    private BaselineLearner learner;

    @BeforeEach
    void setUp() {
        learner = new BaselineLearner(source, store, InsightsProps.defaults());
    }

    @Test
    void failingResourceDoesNotStopTheCycle() {
        var samples = Series.constant(NOW.minus(Duration.ofHours(10)), Duration.ofMinutes(5), 120, 42);
        when(source.getResourceIds()).thenReturn(List.of("vm1", "vm2", "vm3"));
        when(source.getMetrics(eq("vm1"), anyString(), any())).thenReturn(samples);
        when(source.getMetrics(eq("vm2"), anyString(), any())).thenThrow(new IllegalStateException("db down"));
        when(source.getMetrics(eq("vm3"), anyString(), any())).thenReturn(samples);

        var result = learner.runCycle();

        assertThat(result).isEqualTo(new BaselineLearner.CycleResult(2, 1, true));
        verify(store).learn(eq("vm1"), any());
        verify(store).learn(eq("vm3"), any());
        verify(store, never()).learn(eq("vm2"), any());
        verify(store).persist();
    }

    @Test
    void everyConfiguredMetricIsFetchedOverTheLearningWindow() {
        when(source.getResourceIds()).thenReturn(List.of("vm1"));
        when(source.getMetrics(eq("vm1"), anyString(), any())).thenReturn(List.of());

        learner.runCycle();

        for (String metric : List.of("cpu", "memory", "disk")) {
            verify(source).getMetrics("vm1", metric, Duration.ofDays(7));
        }
    }

    @Test
    void listingFailureSkipsTheCycle() {
        when(source.getResourceIds()).thenThrow(new IllegalStateException("db down"));

        var result = learner.runCycle();

        assertThat(result).isEqualTo(new BaselineLearner.CycleResult(0, 0, false));
        verify(store, never()).persist();
    }

    @Test
    void persistFailureIsReported() {
        when(source.getResourceIds()).thenReturn(List.of());
        doThrow(new IllegalStateException("disk full")).when(store).persist();

        var result = learner.runCycle();

        assertThat(result.persisted()).isFalse();
    }
}
