package org.caureq.opsinsights.service.context;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One typed part of an assembled context. {@code data} is null unless the section is available;
 * {@code reason} explains an empty or unavailable section.
 */
public record Section<T>(String name, SectionStatus status, T data, String reason) {

    public static <T> Section<T> available(String name, T data) {
        return new Section<>(name, SectionStatus.AVAILABLE, data, null);
    }

    public static <T> Section<T> empty(String name) {
        return new Section<>(name, SectionStatus.EMPTY, null, "no historical signal available for " + name);
    }

    public static <T> Section<T> unavailable(String name, String reason) {
        return new Section<>(name, SectionStatus.UNAVAILABLE, null, reason);
    }

    @JsonIgnore
    public boolean isAvailable() { return status == SectionStatus.AVAILABLE; }

    @JsonIgnore
    public boolean isUnavailable() { return status == SectionStatus.UNAVAILABLE; }
}
