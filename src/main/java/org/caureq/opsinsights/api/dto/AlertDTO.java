package org.caureq.opsinsights.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/** A fired alert as delivered by the alerting engine. */
public record AlertDTO(
        @NotBlank @Size(max = 128) String resourceId,
        @NotBlank @Size(max = 64) String type,
        @Size(max = 16) String level,
        @Size(max = 512) String message,
        Instant firedAt
) {}
