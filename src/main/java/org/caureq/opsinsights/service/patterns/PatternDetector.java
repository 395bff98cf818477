package org.caureq.opsinsights.service.patterns;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.domain.model.EventKind;
import org.caureq.opsinsights.domain.model.EventSource;
import org.caureq.opsinsights.domain.model.HistoricalEvent;
import org.caureq.opsinsights.domain.model.Pattern;
import org.caureq.opsinsights.domain.model.Prediction;
import org.caureq.opsinsights.service.persistence.JsonStateFile;
import org.caureq.opsinsights.service.persistence.StateFiles;
import org.caureq.opsinsights.service.stats.Stats;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Rolling log of discrete events per (resource, kind) and the recurrence learned from it.
 * <p>
 * Recording an event recomputes that key's pattern under the write lock; readers hold the
 * read lock, so they never see a half-rebuilt pattern set. Retention pruning only happens in
 * {@link #pruneAndPersist()}.
 */
@Slf4j
@Service
public class PatternDetector {
    static final String FILE_NAME = "patterns.json";
    private static final double MAX_CONFIDENCE = 0.95;
    private static final double HOURS_PER_DAY = 24.0;

    record Key(String resourceId, EventKind kind) {}

    private final InsightsProps.PatternProps props;
    private final Clock clock;
    private final JsonStateFile file;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Key, List<HistoricalEvent>> events = new HashMap<>();
    private final Map<Key, Pattern> patterns = new HashMap<>();
    private boolean dirty;

    public PatternDetector(InsightsProps props, StateFiles files, Clock clock) {
        this.props = props.patterns();
        this.clock = clock;
        this.file = files.file(FILE_NAME);
    }

    public boolean recordEvent(String resourceId, EventKind kind, Instant timestamp) {
        return recordEvent(resourceId, kind, timestamp, EventSource.ALERT);
    }

    /**
     * @return false when the event was folded into a recent one of the same key (dedupe window)
     */
    public boolean recordEvent(String resourceId, EventKind kind, Instant timestamp, EventSource source) {
        if (resourceId == null || resourceId.isBlank()) throw new IllegalArgumentException("resourceId is required");
        if (kind == null) throw new IllegalArgumentException("event kind is required");
        var ts = timestamp == null ? clock.instant() : timestamp;
        var event = new HistoricalEvent(resourceId, kind, ts, source == null ? EventSource.ALERT : source);
        var key = new Key(resourceId, kind);

        lock.writeLock().lock();
        try {
            var list = events.computeIfAbsent(key, k -> new ArrayList<>());
            for (HistoricalEvent e : list) {
                if (!props.dedupeWindow().isZero()
                        && Duration.between(e.timestamp(), ts).abs().compareTo(props.dedupeWindow()) <= 0) {
                    log.debug("[Patterns] {} {} at {} folded into {}", resourceId, kind.id(), ts, e.timestamp());
                    return false;
                }
            }
            int at = list.size();
            while (at > 0 && list.get(at - 1).timestamp().isAfter(ts)) at--;
            list.add(at, event);
            while (list.size() > props.maxEventsPerKey()) list.remove(0);
            recompute(key);
            dirty = true;
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[Patterns] recorded {} {} at {} ({})", resourceId, kind.id(), ts, event.source());
        return true;
    }

    /** Caller holds the write lock. */
    private void recompute(Key key) {
        var list = events.get(key);
        var p = list == null ? null : derive(key, list);
        if (p == null) patterns.remove(key);
        else patterns.put(key, p);
        if (list != null && list.isEmpty()) events.remove(key);
    }

    /** Null below the minimum event count or when every event shares one instant. */
    Pattern derive(Key key, List<HistoricalEvent> sorted) {
        if (sorted.size() < props.minEvents()) return null;
        double[] intervals = new double[sorted.size() - 1];
        for (int i = 1; i < sorted.size(); i++) {
            intervals[i - 1] = Duration.between(sorted.get(i - 1).timestamp(), sorted.get(i).timestamp()).toMillis();
        }
        double median = Stats.median(intervals);
        double mean = Stats.mean(intervals);
        if (median <= 0 || mean <= 0) return null;
        double cv = Stats.stdDev(intervals) / mean;
        int n = intervals.length;
        double confidence = Math.min(MAX_CONFIDENCE, ((double) n / (n + 2)) * (1.0 / (1.0 + cv)));

        var first = sorted.get(0).timestamp();
        var last = sorted.get(sorted.size() - 1).timestamp();
        var medianInterval = Duration.ofMillis(Math.round(median));
        return new Pattern(key.resourceId(), key.kind(), sorted.size(), medianInterval, cv, confidence,
                first, last, last.plus(medianInterval));
    }

    public Optional<Prediction> predict(String resourceId, EventKind kind) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(patterns.get(new Key(resourceId, kind))).map(p -> toPrediction(p, clock.instant()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Every prediction, soonest first. */
    public List<Prediction> getPredictions() {
        var now = clock.instant();
        lock.readLock().lock();
        try {
            return patterns.values().stream()
                    .map(p -> toPrediction(p, now))
                    .sorted(Comparator.comparing(Prediction::predictedAt))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Prediction> getPredictionsForResource(String resourceId) {
        return getPredictions().stream().filter(p -> p.resourceId().equals(resourceId)).toList();
    }

    public List<Pattern> getPatterns() {
        lock.readLock().lock();
        try {
            return patterns.values().stream()
                    .sorted(Comparator.comparing(Pattern::resourceId).thenComparing(p -> p.kind().id()))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<HistoricalEvent> getEvents(String resourceId, EventKind kind) {
        lock.readLock().lock();
        try {
            return List.copyOf(events.getOrDefault(new Key(resourceId, kind), List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int patternCount() {
        lock.readLock().lock();
        try {
            return patterns.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int eventCount() {
        lock.readLock().lock();
        try {
            return events.values().stream().mapToInt(List::size).sum();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static Prediction toPrediction(Pattern p, Instant now) {
        double daysUntil = Duration.between(now, p.nextExpected()).toMillis() / 3_600_000.0 / HOURS_PER_DAY;
        var basis = String.format(Locale.ROOT, "%d events, typically every %.1f days (cv %.2f)",
                p.occurrences(), p.medianInterval().toMillis() / 3_600_000.0 / HOURS_PER_DAY, p.intervalCv());
        return new Prediction(p.resourceId(), p.kind(), p.nextExpected(), daysUntil, p.confidence(),
                now.isAfter(p.nextExpected()), p.lastOccurrence(), basis);
    }

    @Scheduled(fixedDelayString = "${insights.patterns.flush-interval-ms:900000}",
            initialDelayString = "${insights.patterns.flush-interval-ms:900000}")
    public void scheduledFlush() {
        try {
            pruneAndPersist();
        } catch (RuntimeException e) {
            log.warn("[Patterns] flush failed, will retry: {}", e.getMessage());
        }
    }

    /** Drops events older than the retention horizon, then writes the state file if anything changed. */
    public int pruneAndPersist() {
        var cutoff = clock.instant().minus(props.retention());
        int pruned = 0;
        Map<String, Object> doc;
        lock.writeLock().lock();
        try {
            for (var key : new ArrayList<>(events.keySet())) {
                var list = events.get(key);
                int before = list.size();
                list.removeIf(e -> e.timestamp().isBefore(cutoff));
                if (list.size() != before) {
                    pruned += before - list.size();
                    recompute(key);
                }
            }
            if (pruned > 0) dirty = true;
            if (!dirty) return 0;
            doc = snapshotLocked();
            dirty = false;
        } finally {
            lock.writeLock().unlock();
        }
        try {
            file.write(doc);
        } catch (RuntimeException e) {
            markDirty();
            throw e;
        }
        log.info("[Patterns] persisted {} patterns ({} events pruned)", ((List<?>) doc.get("patterns")).size(), pruned);
        return pruned;
    }

    private void markDirty() {
        lock.writeLock().lock();
        try {
            dirty = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Map<String, Object> snapshotLocked() {
        var all = events.values().stream().flatMap(List::stream)
                .sorted(Comparator.comparing(HistoricalEvent::timestamp))
                .toList();
        var doc = new LinkedHashMap<String, Object>();
        doc.put("savedAt", clock.instant());
        doc.put("events", all);
        doc.put("patterns", new ArrayList<>(patterns.values()));
        return doc;
    }

    @PreDestroy
    void flushOnShutdown() {
        scheduledFlush();
    }

    /** Events are the source of truth; patterns are re-derived from them. */
    @PostConstruct
    public void load() {
        Optional<JsonNode> doc;
        try {
            doc = file.readTree();
        } catch (RuntimeException e) {
            log.warn("[Patterns] cannot read {}, starting empty: {}", file.path(), e.getMessage());
            return;
        }
        if (doc.isEmpty()) return;
        int loaded = 0, dropped = 0;
        lock.writeLock().lock();
        try {
            for (JsonNode node : doc.get().path("events")) {
                try {
                    var e = file.mapper().treeToValue(node, HistoricalEvent.class);
                    if (e.resourceId() == null || e.resourceId().isBlank() || e.kind() == null || e.timestamp() == null) {
                        throw new IllegalStateException("incomplete event " + node);
                    }
                    events.computeIfAbsent(new Key(e.resourceId(), e.kind()), k -> new ArrayList<>()).add(e);
                    loaded++;
                } catch (Exception ex) {
                    dropped++;
                    log.warn("[Patterns] dropping invalid event record: {}", ex.getMessage());
                }
            }
            for (var key : new ArrayList<>(events.keySet())) {
                var list = events.get(key);
                list.sort(Comparator.comparing(HistoricalEvent::timestamp));
                // the file may have been written under a larger cap
                int excess = list.size() - props.maxEventsPerKey();
                if (excess > 0) {
                    list.subList(0, excess).clear();
                    dropped += excess;
                    dirty = true;
                }
                recompute(key);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Patterns] loaded {} events, {} patterns ({} dropped)", loaded, patternCount(), dropped);
    }
}
