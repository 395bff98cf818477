package org.caureq.opsinsights.service.source;

import org.caureq.opsinsights.domain.model.Finding;

import java.util.List;

public interface FindingsSource {
    /** Most recent first. */
    List<Finding> findingsFor(String resourceId, int limit);
}
