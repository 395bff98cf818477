package org.caureq.opsinsights.service.context;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.caureq.opsinsights.domain.model.Anomaly;
import org.caureq.opsinsights.domain.model.CapacityForecast;
import org.caureq.opsinsights.domain.model.Change;
import org.caureq.opsinsights.domain.model.Prediction;
import org.caureq.opsinsights.domain.model.RemediationRecord;

import java.time.Instant;
import java.util.List;

/** Summary across all resources. Built per request, never stored. */
public record InfrastructureContext(Instant builtAt, int resourceCount,
                                    Section<List<Anomaly>> anomalies,
                                    Section<List<Prediction>> upcomingRisks,
                                    Section<List<CapacityForecast>> forecasts,
                                    Section<List<Change>> recentChanges,
                                    Section<List<RemediationRecord>> recentRemediations,
                                    Section<LearningStats> learning,
                                    HealthScore health) {

    @JsonIgnore
    public List<Section<?>> sections() {
        return List.of(anomalies, upcomingRisks, forecasts, recentChanges, recentRemediations, learning);
    }

    @JsonProperty("degraded")
    public boolean degraded() {
        return sections().stream().anyMatch(Section::isUnavailable);
    }
}
