package org.caureq.opsinsights.domain.model;

import java.time.Instant;

/** A past finding about a resource, included verbatim in assembled context. */
public record Finding(String id, String resourceId, String type, String level, String message,
                      Instant raisedAt, boolean acknowledged) {}
