package org.caureq.opsinsights.api;

import lombok.RequiredArgsConstructor;
import org.caureq.opsinsights.domain.model.AnomalyVerdict;
import org.caureq.opsinsights.domain.model.CapacityForecast;
import org.caureq.opsinsights.domain.model.MetricBaseline;
import org.caureq.opsinsights.domain.model.Trend;
import org.caureq.opsinsights.service.ResourceNotFoundException;
import org.caureq.opsinsights.service.baseline.BaselineStore;
import org.caureq.opsinsights.service.forecast.CapacityForecaster;
import org.caureq.opsinsights.service.source.MetricSource;
import org.caureq.opsinsights.service.trend.TrendAnalyzer;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;

/**
 * Per-resource metric insights: trend, baselines, anomaly verdicts and capacity forecasts.
 */
@RestController
@RequestMapping("/api/insights")
@RequiredArgsConstructor
public class InsightsController {
    private final MetricSource metricSource;
    private final TrendAnalyzer trendAnalyzer;
    private final BaselineStore baselineStore;
    private final CapacityForecaster forecaster;

    @GetMapping("/trend")
    public Trend trend(@RequestParam("resource") String resource,
                       @RequestParam("metric") String metric,
                       @RequestParam(value = "window", required = false) Duration window) {
        var w = window == null ? trendAnalyzer.defaultWindow() : window;
        return trendAnalyzer.computeTrend(metricSource.getMetrics(resource, metric, w), w);
    }

    @GetMapping("/baselines")
    public List<MetricBaseline> baselines(@RequestParam("resource") String resource,
                                          @RequestParam(value = "metric", required = false) String metric) {
        if (metric != null && !metric.isBlank()) {
            return List.of(baselineStore.getBaseline(resource, metric)
                    .orElseThrow(() -> new ResourceNotFoundException(
                            "no mature baseline for %s %s".formatted(resource, metric))));
        }
        return baselineStore.getMatureBaselines(resource);
    }

    @GetMapping("/anomaly")
    public AnomalyVerdict anomaly(@RequestParam("resource") String resource,
                                  @RequestParam("metric") String metric,
                                  @RequestParam("value") double value) {
        return baselineStore.isAnomaly(resource, metric, value);
    }

    /** 204 when the metric is not growing. */
    @GetMapping("/forecast")
    public ResponseEntity<CapacityForecast> forecast(@RequestParam("resource") String resource,
                                                     @RequestParam("metric") String metric,
                                                     @RequestParam(value = "limit", required = false) Double limit) {
        return forecaster.forecast(resource, metric, limit)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
