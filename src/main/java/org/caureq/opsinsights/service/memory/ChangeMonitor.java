package org.caureq.opsinsights.service.memory;

import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.domain.model.Change;
import org.caureq.opsinsights.domain.model.EventKind;
import org.caureq.opsinsights.domain.model.EventSource;
import org.caureq.opsinsights.service.patterns.PatternDetector;
import org.caureq.opsinsights.service.source.SnapshotProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Polls the inventory, runs change detection and, when enabled, forwards status, config and
 * migration changes to the pattern detector as events. Events only flow this way.
 */
@Slf4j
@Service
public class ChangeMonitor {
    private final SnapshotProvider snapshotProvider;
    private final ChangeDetector detector;
    private final PatternDetector patternDetector;
    private final boolean recordAsEvents;

    public ChangeMonitor(SnapshotProvider snapshotProvider, ChangeDetector detector,
                         PatternDetector patternDetector, InsightsProps props) {
        this.snapshotProvider = snapshotProvider;
        this.detector = detector;
        this.patternDetector = patternDetector;
        this.recordAsEvents = props.changes().recordAsEvents();
    }

    @Scheduled(fixedDelayString = "${insights.changes.detect-interval-ms:60000}",
            initialDelayString = "${insights.changes.initial-delay-ms:10000}")
    public void scheduledPoll() {
        poll();
    }

    public List<Change> poll() {
        List<Change> changes;
        try {
            var snapshot = snapshotProvider.currentSnapshot();
            changes = detector.detect(snapshot);
        } catch (RuntimeException e) {
            log.warn("[Changes] snapshot poll failed: {}", e.getMessage());
            detector.flushIfDirty();
            return List.of();
        }
        if (recordAsEvents) {
            for (Change c : changes) {
                var kind = eventKind(c);
                if (kind == null) continue;
                try {
                    patternDetector.recordEvent(c.resourceId(), kind, c.detectedAt(), EventSource.CHANGE);
                } catch (RuntimeException e) {
                    log.warn("[Changes] could not record {} as event: {}", c.id(), e.getMessage());
                }
            }
        }
        return changes;
    }

    /** Created and deleted resources are not recurring events. */
    static EventKind eventKind(Change c) {
        return switch (c.type()) {
            case STATUS -> EventKind.STATUS_CHANGE;
            case CONFIG -> EventKind.CONFIG_CHANGE;
            case MIGRATED -> EventKind.MIGRATION;
            case CREATED, DELETED -> null;
        };
    }
}
