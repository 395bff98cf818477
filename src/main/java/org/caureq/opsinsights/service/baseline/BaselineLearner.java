package org.caureq.opsinsights.service.baseline;

import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.domain.model.Sample;
import org.caureq.opsinsights.service.source.MetricSource;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;

/** Background learning loop: relearns every known resource, then persists the store. */
@Slf4j
@Service
public class BaselineLearner {
    private final MetricSource metricSource;
    private final BaselineStore store;
    private final InsightsProps.BaselineProps props;

    public BaselineLearner(MetricSource metricSource, BaselineStore store, InsightsProps props) {
        this.metricSource = metricSource;
        this.store = store;
        this.props = props.baseline();
    }

    public record CycleResult(int learned, int failed, boolean persisted) {}

    @Scheduled(fixedDelayString = "${insights.baseline.learn-interval-ms:3600000}",
            initialDelayString = "${insights.baseline.initial-delay-ms:60000}")
    public void scheduledCycle() {
        runCycle();
    }

    public CycleResult runCycle() {
        List<String> ids;
        try {
            ids = metricSource.getResourceIds();
        } catch (RuntimeException e) {
            log.warn("[Baselines] cannot list resources, skipping cycle: {}", e.getMessage());
            return new CycleResult(0, 0, false);
        }

        int learned = 0, failed = 0;
        for (String id : ids) {
            try {
                var history = new LinkedHashMap<String, List<Sample>>();
                for (String metric : props.metrics()) {
                    history.put(metric, metricSource.getMetrics(id, metric, props.learningWindow()));
                }
                store.learn(id, history);
                learned++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("[Baselines] learning pass failed for {}: {}", id, e.getMessage());
            }
        }

        boolean persisted = true;
        try {
            store.persist();
        } catch (RuntimeException e) {
            persisted = false;
            log.warn("[Baselines] persist failed, will retry next cycle: {}", e.getMessage());
        }
        log.info("[Baselines] cycle done: {} learned, {} failed, {} with mature baselines",
                learned, failed, store.resourceCount());
        return new CycleResult(learned, failed, persisted);
    }
}
