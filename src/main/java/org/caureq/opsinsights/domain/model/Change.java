package org.caureq.opsinsights.domain.model;

import java.time.Instant;

/** One detected difference between two successive snapshots of a resource. */
public record Change(String id, String resourceId, String resourceName, ChangeType type,
                     ResourceSnapshot before, ResourceSnapshot after, Instant detectedAt,
                     String description) {}
