package org.caureq.opsinsights.domain.model;

import java.time.Instant;
import java.util.Objects;

/** A single {@code (timestamp, value)} observation of one resource metric. */
public record Sample(Instant timestamp, double value) {
    public Sample {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
