package org.caureq.opsinsights.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventSource {
    ALERT, CHANGE, REMEDIATION;

    @JsonValue
    public String id() { return name().toLowerCase(); }
}
