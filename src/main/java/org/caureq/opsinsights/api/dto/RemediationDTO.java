package org.caureq.opsinsights.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import org.caureq.opsinsights.domain.model.RemediationOutcome;
import org.caureq.opsinsights.domain.model.RemediationRecord;

import java.time.Duration;
import java.time.Instant;

public record RemediationDTO(
        @NotBlank @Size(max = 128) String resourceId,
        @Size(max = 64) String findingId,
        @NotBlank @Size(max = 1000) String problem,
        @NotBlank @Size(max = 1000) String action,
        RemediationOutcome outcome,
        @PositiveOrZero Long timeToResolutionSeconds,
        @Size(max = 2000) String note,
        boolean automatic,
        Instant timestamp
) {
    public RemediationRecord toRecord() {
        return new RemediationRecord(null, timestamp, resourceId.trim(), findingId, problem.trim(), action.trim(),
                outcome == null ? RemediationOutcome.UNKNOWN : outcome,
                timeToResolutionSeconds == null ? null : Duration.ofSeconds(timeToResolutionSeconds),
                note, automatic);
    }
}
