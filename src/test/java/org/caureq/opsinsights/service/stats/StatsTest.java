package org.caureq.opsinsights.service.stats;

import org.caureq.opsinsights.domain.model.Sample;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatsTest {
    private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");

    @Test
    void normalizeSortsAndKeepsLastWriteForSameTimestamp() {
        var samples = List.of(
                new Sample(T0.plusSeconds(120), 3),
                new Sample(T0, 1),
                new Sample(T0.plusSeconds(60), 2),
                new Sample(T0.plusSeconds(60), 20));

        var out = Stats.normalize(samples);

        assertThat(out).extracting(Sample::value).containsExactly(1.0, 20.0, 3.0);
    }

    @Test
    void lastWindowIsMeasuredFromNewestSample() {
        var samples = Stats.normalize(List.of(
                new Sample(T0, 1),
                new Sample(T0.plus(Duration.ofHours(10)), 2),
                new Sample(T0.plus(Duration.ofHours(30)), 3)));

        var window = Stats.lastWindow(samples, Duration.ofHours(20));

        assertThat(window).extracting(Sample::value).containsExactly(2.0, 3.0);
    }

    @Test
    void populationStdDev() {
        double[] v = {2, 4, 4, 4, 5, 5, 7, 9};
        assertThat(Stats.mean(v)).isEqualTo(5.0);
        assertThat(Stats.stdDev(v)).isEqualTo(2.0);
        assertThat(Stats.stdDev(new double[]{42})).isZero();
    }

    @Test
    void percentileInterpolatesLinearly() {
        double[] sorted = {1, 2, 3, 4};
        assertThat(Stats.percentile(sorted, 50)).isEqualTo(2.5);
        assertThat(Stats.percentile(sorted, 0)).isEqualTo(1.0);
        assertThat(Stats.percentile(sorted, 100)).isEqualTo(4.0);
        assertThat(Stats.median(new double[]{9, 1, 5})).isEqualTo(5.0);
    }

    @Test
    void regressionOnPerfectLine() {
        var samples = List.of(
                new Sample(T0, 1),
                new Sample(T0.plus(Duration.ofHours(1)), 3),
                new Sample(T0.plus(Duration.ofHours(2)), 5),
                new Sample(T0.plus(Duration.ofHours(3)), 7));

        var reg = Stats.linearRegression(samples);

        assertThat(reg.slopePerHour()).isCloseTo(2.0, within(1e-9));
        assertThat(reg.intercept()).isCloseTo(1.0, within(1e-9));
        assertThat(reg.rSquared()).isCloseTo(1.0, within(1e-9));
        assertThat(reg.n()).isEqualTo(4);
    }

    @Test
    void regressionOnConstantSeriesHasNoFit() {
        var samples = List.of(
                new Sample(T0, 5),
                new Sample(T0.plus(Duration.ofHours(1)), 5),
                new Sample(T0.plus(Duration.ofHours(2)), 5));

        var reg = Stats.linearRegression(samples);

        assertThat(reg.slopePerHour()).isZero();
        assertThat(reg.rSquared()).isZero();
        assertThat(Stats.linearRegression(List.of(new Sample(T0, 1)))).isEqualTo(Stats.Regression.EMPTY);
    }
}
