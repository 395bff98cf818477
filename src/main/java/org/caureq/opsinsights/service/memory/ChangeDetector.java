package org.caureq.opsinsights.service.memory;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.domain.model.Change;
import org.caureq.opsinsights.domain.model.ChangeType;
import org.caureq.opsinsights.domain.model.ResourceSnapshot;
import org.caureq.opsinsights.service.persistence.JsonStateFile;
import org.caureq.opsinsights.service.persistence.StateFiles;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Diffs successive inventory snapshots into discrete changes.
 * <p>
 * {@link #detect} is single-writer: the read-diff-replace of the previous snapshot runs under one
 * mutex. Queries read an immutable copy of the log published at the end of each call and never
 * wait on a running detection.
 */
@Slf4j
@Service
public class ChangeDetector {
    static final String FILE_NAME = "changes.json";
    private static final double GIB = 1024.0 * 1024 * 1024;

    private final int maxRetained;
    private final boolean reportInitial;
    private final Clock clock;
    private final JsonStateFile file;

    private final ReentrantLock detectLock = new ReentrantLock();
    private Map<String, ResourceSnapshot> previous;   // null until the first snapshot is seen
    private final Deque<Change> history = new ArrayDeque<>();
    private volatile List<Change> published = List.of(); // newest first
    private boolean dirty;

    public ChangeDetector(InsightsProps props, StateFiles files, Clock clock) {
        this.maxRetained = props.changes().maxRetained();
        this.reportInitial = props.changes().reportInitial();
        this.clock = clock;
        this.file = files.file(FILE_NAME);
    }

    /**
     * Diffs {@code current} against the previous snapshot and stores {@code current} as the new
     * previous one. The first snapshot ever seen only seeds state, unless
     * {@code insights.changes.report-initial} is set, in which case every resource in it is created.
     */
    public List<Change> detect(List<ResourceSnapshot> current) {
        Objects.requireNonNull(current, "snapshot");
        var next = new LinkedHashMap<String, ResourceSnapshot>();
        for (ResourceSnapshot s : current) {
            if (s != null && s.resourceId() != null && !s.resourceId().isBlank()) next.put(s.resourceId(), s);
        }

        detectLock.lock();
        try {
            var now = clock.instant();
            var changes = new ArrayList<Change>();
            if (previous == null && !reportInitial) {
                log.info("[Changes] first snapshot seen, seeding {} resources", next.size());
            } else {
                Map<String, ResourceSnapshot> prior = previous == null ? Map.of() : previous;
                for (var s : next.values()) {
                    var before = prior.get(s.resourceId());
                    if (before == null) {
                        changes.add(change(s.resourceId(), s.displayName(), ChangeType.CREATED, null, s, now,
                                "%s created%s".formatted(s.displayName(), s.node() == null ? "" : " on " + s.node())));
                    } else {
                        diff(before, s, now, changes);
                    }
                }
                for (var before : prior.values()) {
                    if (!next.containsKey(before.resourceId())) {
                        changes.add(change(before.resourceId(), before.displayName(), ChangeType.DELETED, before, null, now,
                                "%s deleted".formatted(before.displayName())));
                    }
                }
            }
            if (previous == null || !previous.equals(next)) dirty = true;
            previous = next;
            for (var c : changes) {
                history.addLast(c);
                if (history.size() > maxRetained) history.removeFirst();
            }
            if (!changes.isEmpty()) {
                publish();
                dirty = true;
                log.info("[Changes] {} changes detected", changes.size());
            }
            flushLocked();
            return List.copyOf(changes);
        } finally {
            detectLock.unlock();
        }
    }

    private void diff(ResourceSnapshot before, ResourceSnapshot after, Instant now, List<Change> out) {
        var name = after.displayName();
        boolean cpuDiff = before.cpus() != null && after.cpus() != null && !before.cpus().equals(after.cpus());
        boolean memDiff = before.memoryBytes() != null && after.memoryBytes() != null
                && !before.memoryBytes().equals(after.memoryBytes());
        if (cpuDiff || memDiff) {
            var parts = new ArrayList<String>();
            if (cpuDiff) parts.add("cpus %d -> %d".formatted(before.cpus(), after.cpus()));
            if (memDiff) parts.add(String.format(Locale.ROOT, "memory %.1f GiB -> %.1f GiB",
                    before.memoryBytes() / GIB, after.memoryBytes() / GIB));
            out.add(change(after.resourceId(), name, ChangeType.CONFIG, before, after, now,
                    name + " config changed: " + String.join(", ", parts)));
        }
        if (before.status() != null && after.status() != null && !before.status().equalsIgnoreCase(after.status())) {
            out.add(change(after.resourceId(), name, ChangeType.STATUS, before, after, now,
                    "%s status %s -> %s".formatted(name, before.status(), after.status())));
        }
        if (before.node() != null && after.node() != null && !before.node().equals(after.node())) {
            out.add(change(after.resourceId(), name, ChangeType.MIGRATED, before, after, now,
                    "%s migrated %s -> %s".formatted(name, before.node(), after.node())));
        }
    }

    private static Change change(String id, String name, ChangeType type, ResourceSnapshot before,
                                 ResourceSnapshot after, Instant at, String description) {
        return new Change(UUID.randomUUID().toString(), id, name, type, before, after, at, description);
    }

    private void publish() {
        var copy = new ArrayList<>(history);
        Collections.reverse(copy);
        published = List.copyOf(copy);
    }

    /** Newest first; {@code since} may be null. */
    public List<Change> getRecent(int limit, Instant since) {
        return published.stream()
                .filter(c -> since == null || !c.detectedAt().isBefore(since))
                .limit(Math.max(0, limit))
                .toList();
    }

    public List<Change> getForResource(String resourceId, int limit) {
        return published.stream()
                .filter(c -> c.resourceId().equals(resourceId))
                .limit(Math.max(0, limit))
                .toList();
    }

    public int count() {
        return published.size();
    }

    public boolean seeded() {
        detectLock.lock();
        try {
            return previous != null;
        } finally {
            detectLock.unlock();
        }
    }

    /** Retries a state write that failed during an earlier detection. */
    public void flushIfDirty() {
        detectLock.lock();
        try {
            flushLocked();
        } finally {
            detectLock.unlock();
        }
    }

    private void flushLocked() {
        if (!dirty) return;
        var doc = new LinkedHashMap<String, Object>();
        doc.put("savedAt", clock.instant());
        doc.put("previous", previous == null ? null : new ArrayList<>(previous.values()));
        doc.put("changes", new ArrayList<>(history));
        try {
            file.write(doc);
            dirty = false;
        } catch (RuntimeException e) {
            log.warn("[Changes] persist failed, will retry: {}", e.getMessage());
        }
    }

    @PostConstruct
    public void load() {
        Optional<JsonNode> doc;
        try {
            doc = file.readTree();
        } catch (RuntimeException e) {
            log.warn("[Changes] cannot read {}, starting empty: {}", file.path(), e.getMessage());
            return;
        }
        if (doc.isEmpty()) return;
        detectLock.lock();
        try {
            var prevNode = doc.get().path("previous");
            if (prevNode.isArray()) {
                var prev = new LinkedHashMap<String, ResourceSnapshot>();
                for (JsonNode n : prevNode) {
                    try {
                        var s = file.mapper().treeToValue(n, ResourceSnapshot.class);
                        if (s.resourceId() != null && !s.resourceId().isBlank()) prev.put(s.resourceId(), s);
                    } catch (Exception e) {
                        log.warn("[Changes] dropping invalid snapshot record: {}", e.getMessage());
                    }
                }
                previous = prev;
            }
            for (JsonNode n : doc.get().path("changes")) {
                try {
                    var c = file.mapper().treeToValue(n, Change.class);
                    if (c.resourceId() == null || c.type() == null || c.detectedAt() == null) {
                        throw new IllegalStateException("incomplete change " + n);
                    }
                    history.addLast(c);
                } catch (Exception e) {
                    log.warn("[Changes] dropping invalid change record: {}", e.getMessage());
                }
            }
            while (history.size() > maxRetained) history.removeFirst();
            publish();
        } finally {
            detectLock.unlock();
        }
        log.info("[Changes] loaded {} changes, previous snapshot {}", count(), previous == null ? "absent" : previous.size());
    }
}
