package org.caureq.opsinsights.domain.model;

import java.time.Instant;

public record Anomaly(String resourceId, String metric, double currentValue, double baselineMean,
                      double stdDev, double zScore, AnomalySeverity severity, Instant detectedAt,
                      String description) {}
