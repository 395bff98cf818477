package org.caureq.opsinsights.service.context;

import org.caureq.opsinsights.domain.model.CapacityForecast;
import org.caureq.opsinsights.domain.model.Trend;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Pre-computed per-resource trends, forecasts and latest values, replaced whole on each refresh. Maps are sorted by metric. */
public record ResourceInsights(String resourceId, Map<String, Trend> trends,
                               Map<String, CapacityForecast> forecasts,
                               Map<String, Double> latest, Instant computedAt) {
    public ResourceInsights {
        trends = Collections.unmodifiableMap(new TreeMap<>(trends));
        forecasts = Collections.unmodifiableMap(new TreeMap<>(forecasts));
        latest = Collections.unmodifiableMap(new TreeMap<>(latest));
    }
}
