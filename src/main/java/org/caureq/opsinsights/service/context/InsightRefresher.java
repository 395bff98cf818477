package org.caureq.opsinsights.service.context;

import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.domain.model.CapacityForecast;
import org.caureq.opsinsights.domain.model.Trend;
import org.caureq.opsinsights.service.InsufficientDataException;
import org.caureq.opsinsights.service.forecast.CapacityForecaster;
import org.caureq.opsinsights.service.source.MetricSource;
import org.caureq.opsinsights.service.stats.Stats;
import org.caureq.opsinsights.service.trend.TrendAnalyzer;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Background loop that runs the regressions (trends and forecasts) off the context hot path.
 * The assembler only reads the published snapshot.
 */
@Slf4j
@Service
public class InsightRefresher {
    private final MetricSource metricSource;
    private final TrendAnalyzer trendAnalyzer;
    private final CapacityForecaster forecaster;
    private final List<String> metrics;
    private final Clock clock;

    private volatile Map<String, ResourceInsights> snapshot = Map.of();

    public InsightRefresher(MetricSource metricSource, TrendAnalyzer trendAnalyzer, CapacityForecaster forecaster,
                            InsightsProps props, Clock clock) {
        this.metricSource = metricSource;
        this.trendAnalyzer = trendAnalyzer;
        this.forecaster = forecaster;
        this.metrics = props.baseline().metrics();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${insights.context.refresh-interval-ms:300000}",
            initialDelayString = "${insights.context.initial-delay-ms:15000}")
    public void scheduledRefresh() {
        refresh();
    }

    public int refresh() {
        List<String> ids;
        try {
            ids = metricSource.getResourceIds();
        } catch (RuntimeException e) {
            log.warn("[Context] cannot list resources, keeping previous insights: {}", e.getMessage());
            return 0;
        }
        var now = clock.instant();
        Duration fetch = trendAnalyzer.defaultWindow().compareTo(forecaster.window()) > 0
                ? trendAnalyzer.defaultWindow() : forecaster.window();
        var next = new HashMap<String, ResourceInsights>();
        for (String id : ids) {
            try {
                var trends = new TreeMap<String, Trend>();
                var forecasts = new TreeMap<String, CapacityForecast>();
                var latest = new TreeMap<String, Double>();
                for (String metric : metrics) {
                    var samples = Stats.normalize(metricSource.getMetrics(id, metric, fetch));
                    if (samples.isEmpty()) continue;
                    latest.put(metric, samples.get(samples.size() - 1).value());
                    trends.put(metric, trendAnalyzer.computeTrend(samples));
                    try {
                        forecaster.forecast(id, metric, samples, forecaster.defaultLimit(), now)
                                .ifPresent(f -> forecasts.put(metric, f));
                    } catch (InsufficientDataException e) {
                        log.debug("[Forecast] {} {}: {}", id, metric, e.getMessage());
                    }
                }
                next.put(id, new ResourceInsights(id, trends, forecasts, latest, now));
            } catch (RuntimeException e) {
                log.warn("[Context] refresh failed for {}, keeping previous insights: {}", id, e.getMessage());
                var prev = snapshot.get(id);
                if (prev != null) next.put(id, prev);
            }
        }
        snapshot = Map.copyOf(next);
        log.debug("[Context] refreshed insights for {} resources", next.size());
        return next.size();
    }

    public Optional<ResourceInsights> get(String resourceId) {
        return Optional.ofNullable(snapshot.get(resourceId));
    }

    public Collection<ResourceInsights> all() {
        return snapshot.values();
    }
}
