package org.caureq.opsinsights.service.trend;

import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.domain.model.Sample;
import org.caureq.opsinsights.domain.model.Trend;
import org.caureq.opsinsights.domain.model.TrendDirection;
import org.caureq.opsinsights.service.stats.Stats;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Classifies the direction of a metric over a window.
 * <p>
 * Stateless: the same window always yields the same trend. Volatility is checked before
 * slope because a noisy series has no meaningful direction.
 */
@Service
public class TrendAnalyzer {
    private final double growthThresholdPctPerHour;
    private final double volatilityRatio;
    private final Duration defaultWindow;

    public TrendAnalyzer(InsightsProps props) {
        this.growthThresholdPctPerHour = props.trend().growthThresholdPctPerHour();
        this.volatilityRatio = props.trend().volatilityRatio();
        this.defaultWindow = props.trend().window();
    }

    public Duration defaultWindow() { return defaultWindow; }

    public Trend computeTrend(List<Sample> points) {
        return computeTrend(points, defaultWindow);
    }

    public Trend computeTrend(List<Sample> points, Duration window) {
        var sorted = Stats.lastWindow(Stats.normalize(points), window == null ? defaultWindow : window);
        if (sorted.isEmpty()) return Trend.insufficient(0, 0);
        double current = sorted.get(sorted.size() - 1).value();
        if (sorted.size() < 2) return Trend.insufficient(1, current);

        double[] v = Stats.values(sorted);
        double mean = Stats.mean(v);
        double stdDev = Stats.stdDev(v);
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double x : v) {
            min = Math.min(min, x);
            max = Math.max(max, x);
        }

        var reg = Stats.linearRegression(sorted);
        double denominator = mean == 0 ? 1.0 : Math.abs(mean);
        double cv = stdDev / denominator;
        double normalizedPctPerHour = reg.slopePerHour() / denominator * 100.0;

        TrendDirection direction;
        if (cv > volatilityRatio) {
            direction = TrendDirection.VOLATILE;
        } else if (normalizedPctPerHour > growthThresholdPctPerHour) {
            direction = TrendDirection.GROWING;
        } else if (normalizedPctPerHour < -growthThresholdPctPerHour) {
            direction = TrendDirection.DECLINING;
        } else {
            direction = TrendDirection.STABLE;
        }

        return new Trend(direction, reg.slopePerHour(), reg.slopePerHour() * 24, current,
                mean, min, max, stdDev, sorted.size(), reg.rSquared());
    }
}
