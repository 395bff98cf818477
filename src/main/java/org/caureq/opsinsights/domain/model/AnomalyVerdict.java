package org.caureq.opsinsights.domain.model;

public record AnomalyVerdict(boolean anomalous, double zScore, AnomalySeverity severity) {
    public static final AnomalyVerdict NONE = new AnomalyVerdict(false, 0, AnomalySeverity.NONE);
}
