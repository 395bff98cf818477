package org.caureq.opsinsights.service.source;

import org.caureq.opsinsights.domain.model.ResourceSnapshot;

import java.util.List;

/** Full current inventory, consumed by the change detector. */
public interface SnapshotProvider {
    List<ResourceSnapshot> currentSnapshot();
}
