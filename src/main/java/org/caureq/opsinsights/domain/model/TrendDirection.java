package org.caureq.opsinsights.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    STABLE, GROWING, DECLINING, VOLATILE;

    @JsonValue
    public String id() { return name().toLowerCase(); }
}
