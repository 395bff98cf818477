package org.caureq.opsinsights;

import org.caureq.opsinsights.domain.model.Sample;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

/** Synthetic sample series. */
public final class Series {
    private Series() {}

    public static List<Sample> of(Instant start, Duration step, int count, IntToDoubleFunction value) {
        var out = new ArrayList<Sample>(count);
        for (int i = 0; i < count; i++) out.add(new Sample(start.plus(step.multipliedBy(i)), value.applyAsDouble(i)));
        return out;
    }

    /** Hourly samples rising linearly from {@code from} to {@code to}, ending at {@code end}. */
    public static List<Sample> linear(Instant end, Duration span, double from, double to) {
        int hours = (int) span.toHours();
        var start = end.minus(span);
        return of(start, Duration.ofHours(1), hours + 1, i -> from + (to - from) * i / hours);
    }

    public static List<Sample> constant(Instant start, Duration step, int count, double value) {
        return of(start, step, count, i -> value);
    }
}
