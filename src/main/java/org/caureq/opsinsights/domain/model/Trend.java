package org.caureq.opsinsights.domain.model;

/**
 * Direction and rate of one metric over a window. Derived on demand, never persisted.
 *
 * @param ratePerHour slope of the least-squares fit, in metric units per hour
 * @param confidence  R² of that fit (0 when there is not enough data)
 */
public record Trend(TrendDirection direction, double ratePerHour, double ratePerDay,
                    double current, double average, double min, double max, double stdDev,
                    int sampleCount, double confidence) {

    /** Fewer than two samples: no direction can be read. */
    public static Trend insufficient(int sampleCount, double current) {
        return new Trend(TrendDirection.STABLE, 0, 0, current, current, current, current, 0, sampleCount, 0);
    }

    public boolean hasSignal() { return sampleCount >= 2 && confidence > 0; }
}
