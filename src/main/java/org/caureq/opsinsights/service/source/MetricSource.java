package org.caureq.opsinsights.service.source;

import org.caureq.opsinsights.domain.model.Sample;

import java.time.Duration;
import java.util.List;

/** Time-series provider. Results may have gaps; they are sorted and de-duplicated by timestamp. */
public interface MetricSource {
    List<Sample> getMetrics(String resourceId, String metric, Duration window);

    List<String> getResourceIds();
}
