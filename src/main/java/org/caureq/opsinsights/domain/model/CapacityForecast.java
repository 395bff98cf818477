package org.caureq.opsinsights.domain.model;

import java.time.Instant;
import java.util.List;

public record CapacityForecast(String resourceId, String metric, ForecastStatus status,
                               double currentUsage, double limit, double growthPerHour, double growthPerDay,
                               Instant eta, double daysLeft, double confidence, int sampleCount,
                               List<Sample> projection, String description) {
    public CapacityForecast {
        projection = projection == null ? List.of() : List.copyOf(projection);
    }
}
