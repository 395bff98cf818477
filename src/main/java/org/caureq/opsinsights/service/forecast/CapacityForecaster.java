package org.caureq.opsinsights.service.forecast;

import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.domain.model.CapacityForecast;
import org.caureq.opsinsights.domain.model.ForecastStatus;
import org.caureq.opsinsights.domain.model.Sample;
import org.caureq.opsinsights.service.InsufficientDataException;
import org.caureq.opsinsights.service.source.MetricSource;
import org.caureq.opsinsights.service.stats.Stats;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Linear extrapolation of a metric towards a capacity limit.
 * <ul>
 *   <li>fewer than {@code min-samples} points: {@link InsufficientDataException}</li>
 *   <li>flat or declining: empty (not growing is a normal outcome)</li>
 *   <li>growing and already at or over the limit: {@link ForecastStatus#AT_LIMIT}</li>
 * </ul>
 */
@Slf4j
@Service
public class CapacityForecaster {
    /** Beyond this an ETA carries no operational meaning; treated as not growing. */
    static final double MAX_HORIZON_HOURS = 24.0 * 365 * 10;

    private final MetricSource metricSource;
    private final InsightsProps.ForecastProps props;
    private final Clock clock;

    public CapacityForecaster(MetricSource metricSource, InsightsProps props, Clock clock) {
        this.metricSource = metricSource;
        this.props = props.forecast();
        this.clock = clock;
    }

    public double defaultLimit() { return props.defaultLimit(); }

    public Duration window() { return props.window(); }

    public Optional<CapacityForecast> forecast(String resourceId, String metric, Double limit) {
        var samples = metricSource.getMetrics(resourceId, metric, props.window());
        return forecast(resourceId, metric, samples, limit == null ? props.defaultLimit() : limit, clock.instant());
    }

    public Optional<CapacityForecast> forecast(String resourceId, String metric, List<Sample> samples,
                                               double limit, Instant now) {
        if (!Double.isFinite(limit) || limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number, got " + limit);
        }
        var window = Stats.lastWindow(Stats.normalize(samples), props.window());
        if (window.size() < props.minSamples()) {
            throw new InsufficientDataException("%s %s: %d samples, %d required".formatted(
                    resourceId, metric, window.size(), props.minSamples()), window.size(), props.minSamples());
        }

        var reg = Stats.linearRegression(window);
        double slope = reg.slopePerHour();
        if (!(slope > 0)) {
            log.debug("[Forecast] {} {} not growing (slope {}/h)", resourceId, metric, slope);
            return Optional.empty();
        }

        double current = window.get(window.size() - 1).value();
        if (current >= limit) {
            var desc = String.format(Locale.ROOT, "%s is at %.1f, already at or above limit %.1f",
                    metric, current, limit);
            return Optional.of(new CapacityForecast(resourceId, metric, ForecastStatus.AT_LIMIT, current, limit,
                    slope, slope * 24, now, 0, reg.rSquared(), window.size(), List.of(new Sample(now, current)), desc));
        }

        double hoursLeft = (limit - current) / slope;
        if (hoursLeft > MAX_HORIZON_HOURS) {
            log.debug("[Forecast] {} {} would reach {} in {} h, beyond horizon", resourceId, metric, limit, hoursLeft);
            return Optional.empty();
        }
        var eta = now.plusMillis(Math.round(hoursLeft * 3_600_000));
        double daysLeft = hoursLeft / 24.0;
        var desc = String.format(Locale.ROOT, "%s grows %.2f/day, reaches %.1f in %.1f days",
                metric, slope * 24, limit, daysLeft);
        return Optional.of(new CapacityForecast(resourceId, metric, ForecastStatus.WILL_REACH_LIMIT, current, limit,
                slope, slope * 24, eta, daysLeft, reg.rSquared(), window.size(),
                projection(now, current, slope, hoursLeft, limit), desc));
    }

    /** Evenly spaced points from now to the ETA, inclusive. */
    private List<Sample> projection(Instant now, double current, double slope, double hoursLeft, double limit) {
        int points = props.projectionPoints();
        var out = new ArrayList<Sample>(points + 1);
        for (int i = 0; i <= points; i++) {
            double h = hoursLeft * i / points;
            out.add(new Sample(now.plusMillis(Math.round(h * 3_600_000)), Math.min(limit, current + slope * h)));
        }
        return out;
    }
}
