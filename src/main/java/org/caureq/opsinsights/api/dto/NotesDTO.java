package org.caureq.opsinsights.api.dto;

import jakarta.validation.constraints.Size;

/** Free text, one note per line; blank clears the notes. */
public record NotesDTO(@Size(max = 8000) String notes) {}
