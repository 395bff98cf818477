package org.caureq.opsinsights.domain.model;

import java.time.Instant;

public record HistoricalEvent(String resourceId, EventKind kind, Instant timestamp, EventSource source) {}
