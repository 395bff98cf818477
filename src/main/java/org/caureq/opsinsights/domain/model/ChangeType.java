package org.caureq.opsinsights.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeType {
    CREATED, DELETED, CONFIG, STATUS, MIGRATED;

    @JsonValue
    public String id() { return name().toLowerCase(); }
}
