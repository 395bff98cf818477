package org.caureq.opsinsights.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Learned "normal" range of one metric of one resource.
 *
 * @param hourlyMeans 24 slots indexed by UTC hour of day; a slot is null when no sample fell in that hour
 */
public record MetricBaseline(String resourceId, String metric, double mean, double stdDev,
                             Percentiles percentiles, int sampleCount, Instant learnedAt,
                             List<Double> hourlyMeans) {

    public MetricBaseline {
        hourlyMeans = hourlyMeans == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(hourlyMeans));
    }

    /** Record-level invariants checked when loading persisted state. */
    public void validate() {
        if (resourceId == null || resourceId.isBlank()) throw new IllegalStateException("baseline without resource id");
        if (metric == null || metric.isBlank()) throw new IllegalStateException("baseline without metric");
        if (sampleCount < 0) throw new IllegalStateException("negative sample count: " + sampleCount);
        if (!Double.isFinite(mean) || !Double.isFinite(stdDev) || stdDev < 0) {
            throw new IllegalStateException("invalid mean/stddev: " + mean + "/" + stdDev);
        }
        if (percentiles == null) throw new IllegalStateException("missing percentiles");
        if (learnedAt == null) throw new IllegalStateException("missing learnedAt");
        if (!hourlyMeans.isEmpty() && hourlyMeans.size() != 24) {
            throw new IllegalStateException("hourly profile must have 24 slots, got " + hourlyMeans.size());
        }
    }
}
