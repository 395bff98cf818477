package org.caureq.opsinsights.service.stats;

import org.caureq.opsinsights.domain.model.Sample;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Small numeric toolbox shared by the trend, baseline, pattern and forecast code.
 * Everything here is pure and allocation-light.
 */
public final class Stats {

    private static final double SECONDS_PER_HOUR = 3600.0;

    private Stats() {}

    /** Least-squares fit of value against time; x is measured in hours since the first sample. */
    public record Regression(double slopePerHour, double intercept, double rSquared, int n) {
        public static final Regression EMPTY = new Regression(0, 0, 0, 0);
    }

    /**
     * Sorts by timestamp and collapses samples sharing a timestamp, keeping the one that came last
     * in the input (last write wins).
     */
    public static List<Sample> normalize(List<Sample> samples) {
        if (samples == null || samples.isEmpty()) return List.of();
        var sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparing(Sample::timestamp)); // stable: input order kept for equal instants
        var out = new ArrayList<Sample>(sorted.size());
        for (Sample s : sorted) {
            int last = out.size() - 1;
            if (last >= 0 && out.get(last).timestamp().equals(s.timestamp())) {
                out.set(last, s);
            } else {
                out.add(s);
            }
        }
        return out;
    }

    /** Samples no older than {@code window} before the newest one. Input must be sorted. */
    public static List<Sample> lastWindow(List<Sample> sorted, Duration window) {
        if (sorted.isEmpty() || window == null) return sorted;
        Instant from = sorted.get(sorted.size() - 1).timestamp().minus(window);
        int i = 0;
        while (i < sorted.size() && sorted.get(i).timestamp().isBefore(from)) i++;
        return sorted.subList(i, sorted.size());
    }

    public static double[] values(List<Sample> samples) {
        double[] v = new double[samples.size()];
        for (int i = 0; i < v.length; i++) v[i] = samples.get(i).value();
        return v;
    }

    public static double mean(double[] v) {
        if (v.length == 0) return 0;
        double sum = 0;
        for (double x : v) sum += x;
        return sum / v.length;
    }

    /** Population standard deviation (divides by n). */
    public static double stdDev(double[] v) {
        if (v.length < 2) return 0;
        double m = mean(v);
        double sq = 0;
        for (double x : v) sq += (x - m) * (x - m);
        return Math.sqrt(sq / v.length);
    }

    /** Linear-interpolated percentile, {@code p} in [0, 100]. Input must be sorted ascending. */
    public static double percentile(double[] sortedValues, double p) {
        int n = sortedValues.length;
        if (n == 0) return 0;
        if (n == 1) return sortedValues[0];
        double rank = (p / 100.0) * (n - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        double frac = rank - lo;
        return sortedValues[lo] + (sortedValues[hi] - sortedValues[lo]) * frac;
    }

    public static double median(double[] v) {
        if (v.length == 0) return 0;
        double[] copy = Arrays.copyOf(v, v.length);
        Arrays.sort(copy);
        return percentile(copy, 50);
    }

    public static Regression linearRegression(List<Sample> sorted) {
        int n = sorted.size();
        if (n < 2) return Regression.EMPTY;

        Instant t0 = sorted.get(0).timestamp();
        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0, sumYY = 0;
        for (Sample s : sorted) {
            double x = Duration.between(t0, s.timestamp()).toMillis() / 1000.0 / SECONDS_PER_HOUR;
            double y = s.value();
            sumX += x;
            sumY += y;
            sumXY += x * y;
            sumXX += x * x;
            sumYY += y * y;
        }
        double sxx = n * sumXX - sumX * sumX;
        if (sxx == 0) {
            // all samples at one instant: no slope to fit
            return new Regression(0, sumY / n, 0, n);
        }
        double sxy = n * sumXY - sumX * sumY;
        double slope = sxy / sxx;
        double intercept = (sumY - slope * sumX) / n;

        double syy = n * sumYY - sumY * sumY;
        double r2 = syy <= 0 ? 0 : (sxy * sxy) / (sxx * syy);
        r2 = Math.max(0, Math.min(1, r2));
        return new Regression(slope, intercept, r2, n);
    }
}
