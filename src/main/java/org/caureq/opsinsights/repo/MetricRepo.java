package org.caureq.opsinsights.repo;

import org.caureq.opsinsights.domain.Metric;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface MetricRepo extends JpaRepository<Metric, Long> {
    List<Metric> findByResourceIdAndMetricAndTsBetweenOrderByTsAscIdAsc(String resourceId, String metric,
                                                                         Instant from, Instant to);

    /** Resources that reported anything since the given instant. */
    @Query("select distinct m.resourceId from Metric m where m.ts >= :since order by m.resourceId")
    List<String> findResourceIdsSince(@Param("since") Instant since);
}
