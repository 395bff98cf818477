package org.caureq.opsinsights.service.source;

import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.domain.model.Sample;
import org.caureq.opsinsights.repo.MetricRepo;
import org.caureq.opsinsights.service.stats.Stats;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/** Metric source backed by the ingested {@code metric_samples} table. */
@Slf4j
@Service
public class JpaMetricSource implements MetricSource {
    private final MetricRepo metricRepo;
    private final Clock clock;
    private final Duration activeWindow;

    public JpaMetricSource(MetricRepo metricRepo, Clock clock, InsightsProps props) {
        this.metricRepo = metricRepo;
        this.clock = clock;
        this.activeWindow = props.baseline().learningWindow();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Sample> getMetrics(String resourceId, String metric, Duration window) {
        var to = clock.instant();
        var rows = metricRepo.findByResourceIdAndMetricAndTsBetweenOrderByTsAscIdAsc(
                resourceId, metric, to.minus(window), to);
        var samples = rows.stream().map(m -> new Sample(m.getTs(), m.getValue())).toList();
        log.debug("loaded {} {} samples for {}", samples.size(), metric, resourceId);
        return Stats.normalize(samples);
    }

    /** Resources that reported within the baseline learning window. */
    @Override
    @Transactional(readOnly = true)
    public List<String> getResourceIds() {
        return metricRepo.findResourceIdsSince(clock.instant().minus(activeWindow));
    }
}
