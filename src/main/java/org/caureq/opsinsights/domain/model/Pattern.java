package org.caureq.opsinsights.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Recurrence learned from the event history of one (resource, kind).
 *
 * @param intervalCv coefficient of variation of the inter-event intervals (0 = perfectly regular)
 */
public record Pattern(String resourceId, EventKind kind, int occurrences, Duration medianInterval,
                      double intervalCv, double confidence, Instant firstOccurrence,
                      Instant lastOccurrence, Instant nextExpected) {}
