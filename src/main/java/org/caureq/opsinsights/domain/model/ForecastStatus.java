package org.caureq.opsinsights.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ForecastStatus {
    /** Growing towards the limit; ETA is in the future. */
    WILL_REACH_LIMIT,
    /** Current usage already meets or exceeds the limit. */
    AT_LIMIT;

    @JsonValue
    public String id() { return name().toLowerCase(); }
}
