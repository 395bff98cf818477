package org.caureq.opsinsights.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.caureq.opsinsights.domain.model.EventKind;

import java.time.Instant;

public record PatternEventDTO(
        @NotBlank String resourceId,
        @NotNull EventKind kind,
        Instant timestamp   // defaults to now
) {}
