package org.caureq.opsinsights.domain.model;

/**
 * Point-in-time view of one resource as reported by the snapshot provider.
 * {@code cpus} and {@code memoryBytes} are the allocation, not the usage.
 */
public record ResourceSnapshot(String resourceId, String name, String type, String node, String status,
                               Integer cpus, Long memoryBytes) {

    public String displayName() {
        return (name == null || name.isBlank()) ? resourceId : name;
    }
}
