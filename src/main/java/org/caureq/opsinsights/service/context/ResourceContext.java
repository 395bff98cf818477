package org.caureq.opsinsights.service.context;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.caureq.opsinsights.domain.model.Anomaly;
import org.caureq.opsinsights.domain.model.CapacityForecast;
import org.caureq.opsinsights.domain.model.Change;
import org.caureq.opsinsights.domain.model.Finding;
import org.caureq.opsinsights.domain.model.MetricBaseline;
import org.caureq.opsinsights.domain.model.Prediction;
import org.caureq.opsinsights.domain.model.RemediationRecord;
import org.caureq.opsinsights.domain.model.Trend;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Everything known about one resource at build time. Built per request, never stored. */
public record ResourceContext(String resourceId, Instant builtAt,
                              Section<Map<String, Trend>> trends,
                              Section<List<MetricBaseline>> baselines,
                              Section<List<Anomaly>> anomalies,
                              Section<List<Prediction>> predictions,
                              Section<List<CapacityForecast>> forecasts,
                              Section<List<Change>> changes,
                              Section<List<RemediationRecord>> remediations,
                              Section<List<Finding>> findings,
                              Section<List<String>> notes,
                              HealthScore health) {

    @JsonIgnore
    public List<Section<?>> sections() {
        return List.of(trends, baselines, anomalies, predictions, forecasts, changes, remediations, findings, notes);
    }

    /** True when at least one section could not be fetched; callers may fall back to a simpler summary. */
    @JsonProperty("degraded")
    public boolean degraded() {
        return sections().stream().anyMatch(Section::isUnavailable);
    }
}
