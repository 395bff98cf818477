package org.caureq.opsinsights.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalySeverity {
    NONE, WARNING, CRITICAL;

    @JsonValue
    public String id() { return name().toLowerCase(); }
}
