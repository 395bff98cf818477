package org.caureq.opsinsights.domain.model;

public record Percentiles(double p5, double p25, double p50, double p75, double p95) {}
