package org.caureq.opsinsights.api.error;

import java.time.Instant;
import java.util.Map;

/** Error body of every failed API call. */
public record ApiError(
        Instant timestamp,
        ErrorCode code,
        String message,
        String path,
        String correlationId,
        Map<String, Object> details
) {
    public ApiError {
        details = details == null ? Map.of() : details;
    }
}
