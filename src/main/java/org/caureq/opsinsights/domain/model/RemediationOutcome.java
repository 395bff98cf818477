package org.caureq.opsinsights.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RemediationOutcome {
    RESOLVED, PARTIAL, FAILED, UNKNOWN;

    @JsonValue
    public String id() { return name().toLowerCase(); }

    @JsonCreator
    public static RemediationOutcome fromId(String raw) {
        if (raw == null || raw.isBlank()) return UNKNOWN;
        for (RemediationOutcome o : values()) {
            if (o.id().equalsIgnoreCase(raw.trim())) return o;
        }
        return UNKNOWN;
    }
}
