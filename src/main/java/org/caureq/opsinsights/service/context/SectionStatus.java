package org.caureq.opsinsights.service.context;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SectionStatus {
    AVAILABLE, EMPTY, UNAVAILABLE;

    @JsonValue
    public String id() { return name().toLowerCase(); }
}
