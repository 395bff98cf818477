package org.caureq.opsinsights.domain.model;

import java.time.Instant;
import java.util.Map;

/** All learned baselines of one resource, swapped in as a whole after each learning pass. */
public record ResourceBaselines(String resourceId, Map<String, MetricBaseline> metrics, Instant learnedAt) {
    public ResourceBaselines {
        metrics = Map.copyOf(metrics);
    }
}
