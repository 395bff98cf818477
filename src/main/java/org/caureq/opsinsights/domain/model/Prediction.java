package org.caureq.opsinsights.domain.model;

import java.time.Instant;

/**
 * Expected next occurrence of a recurring event, evaluated against "now".
 *
 * @param daysUntil negative when the event is overdue
 */
public record Prediction(String resourceId, EventKind kind, Instant predictedAt, double daysUntil,
                         double confidence, boolean overdue, Instant lastOccurrence, String basis) {}
