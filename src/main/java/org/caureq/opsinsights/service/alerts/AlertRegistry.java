package org.caureq.opsinsights.service.alerts;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.domain.AlertRecord;
import org.caureq.opsinsights.domain.model.EventKind;
import org.caureq.opsinsights.domain.model.EventSource;
import org.caureq.opsinsights.repo.AlertRepo;
import org.caureq.opsinsights.service.patterns.PatternDetector;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Alert history fed by the external alerting engine. Every fired alert is stored (it becomes a
 * past finding) and recorded as a pattern event.
 */
@Slf4j
@Component
public class AlertRegistry {
    @Value
    public static class Alert {
        String id;
        String resourceId;
        String type;    // cpu, memory, disk, oom, backup, ...
        String level;
        String message;
        Instant ts;
        boolean acknowledged;
    }

    private final AlertRepo repo;
    private final PatternDetector patternDetector;
    private final Clock clock;

    public AlertRegistry(AlertRepo repo, PatternDetector patternDetector, Clock clock) {
        this.repo = repo;
        this.patternDetector = patternDetector;
        this.clock = clock;
    }

    @Transactional
    public Alert fired(String resourceId, String type, String level, String message, Instant firedAt) {
        var rec = AlertRecord.builder()
                .resourceId(resourceId)
                .type(type)
                .level(level)
                .message(message == null || message.isBlank() ? type : message)
                .ts(firedAt == null ? clock.instant() : firedAt)
                .acknowledged(false)
                .build();
        var saved = repo.save(rec);
        var kind = EventKind.fromAlertType(type);
        boolean counted = patternDetector.recordEvent(saved.getResourceId(), kind, saved.getTs(), EventSource.ALERT);
        log.debug("alert {} {} on {} recorded as {}{}", saved.getId(), type, resourceId, kind.id(),
                counted ? "" : " (folded)");
        return toDto(saved);
    }

    @Transactional
    public int ack(String id) {
        return repo.findById(id).map(r -> {
            if (!r.isAcknowledged()) { r.setAcknowledged(true); repo.save(r); }
            return 1;
        }).orElse(0);
    }

    private Alert toDto(AlertRecord r) {
        return new Alert(r.getId(), r.getResourceId(), r.getType(), r.getLevel(), r.getMessage(), r.getTs(), r.isAcknowledged());
    }

    /** Query with optional filters and pagination (offset/limit). */
    @Transactional(readOnly = true)
    public List<Alert> query(String resourceId, Boolean ack, int limit, int offset) {
        int size = Math.max(1, Math.min(limit <= 0 ? 50 : limit, 500));
        int page = Math.max(0, offset / size);
        Pageable p = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "ts"));
        var stream = (
                resourceId != null && !resourceId.isBlank() && ack != null ?
                        repo.findByResourceIdAndAcknowledged(resourceId, ack, p).stream() :
                resourceId != null && !resourceId.isBlank() ?
                        repo.findByResourceId(resourceId, p).stream() :
                ack != null ?
                        repo.findByAcknowledged(ack, p).stream() :
                        repo.findAll(p).stream()
        );
        return stream.map(this::toDto).toList();
    }
}
