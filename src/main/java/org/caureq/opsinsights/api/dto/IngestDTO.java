package org.caureq.opsinsights.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.Map;

/** One collector report: current inventory facts plus metric values (percent). */
public record IngestDTO(
        @NotBlank @Size(max = 128) String resourceId,
        @Size(max = 128) String name,
        @Size(max = 32) String type,
        @Size(max = 64) String node,
        @Size(max = 32) String status,
        @PositiveOrZero Integer cpus,
        @PositiveOrZero Long memoryBytes,
        Instant ts,
        @NotEmpty Map<@NotBlank String, Double> metrics // ex: {"cpu": 42.5, "memory": 71.0}
) {}
