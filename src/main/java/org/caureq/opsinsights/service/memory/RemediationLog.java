package org.caureq.opsinsights.service.memory;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.domain.model.RemediationOutcome;
import org.caureq.opsinsights.domain.model.RemediationRecord;
import org.caureq.opsinsights.service.persistence.JsonStateFile;
import org.caureq.opsinsights.service.persistence.StateFiles;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Append-only record of remediation actions and their outcomes. Records are never edited or
 * de-duplicated; once {@code max-records} is reached the oldest is evicted.
 */
@Slf4j
@Service
public class RemediationLog {
    static final String FILE_NAME = "remediations.json";

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "with", "was", "were", "are", "has", "had", "not", "but", "from",
            "this", "that", "into", "after", "then", "than", "out", "its", "too");

    private final int maxRecords;
    private final Clock clock;
    private final JsonStateFile file;

    private final Object writeLock = new Object();
    private final Deque<RemediationRecord> records = new ArrayDeque<>();
    private volatile List<RemediationRecord> published = List.of(); // newest first
    private boolean dirty;

    public RemediationLog(InsightsProps props, StateFiles files, Clock clock) {
        this.maxRecords = props.remediation().maxRecords();
        this.clock = clock;
        this.file = files.file(FILE_NAME);
    }

    /** Appends a record, assigning a fresh id and, when absent, the current time. */
    public RemediationRecord log(RemediationRecord record) {
        if (record == null) throw new IllegalArgumentException("record is required");
        if (isBlank(record.resourceId())) throw new IllegalArgumentException("resourceId is required");
        if (isBlank(record.problem())) throw new IllegalArgumentException("problem is required");
        if (isBlank(record.action())) throw new IllegalArgumentException("action is required");

        var stored = record.withIdentity(UUID.randomUUID().toString(),
                record.timestamp() == null ? clock.instant() : record.timestamp());
        synchronized (writeLock) {
            records.addLast(stored);
            if (records.size() > maxRecords) records.removeFirst();
            publish();
            dirty = true;
            flushLocked();
        }
        log.info("[Remediation] {} on {}: {} ({})", stored.id(), stored.resourceId(), stored.action(), stored.outcome().id());
        return stored;
    }

    private void publish() {
        var copy = new ArrayList<>(records);
        copy.sort(Comparator.comparing(RemediationRecord::timestamp).reversed());
        published = Collections.unmodifiableList(copy);
    }

    /** Most recent first. */
    public List<RemediationRecord> getForResource(String resourceId, int limit) {
        return published.stream()
                .filter(r -> r.resourceId().equals(resourceId))
                .limit(Math.max(0, limit))
                .toList();
    }

    /** Most recent first across all resources; {@code since} may be null. */
    public List<RemediationRecord> recent(int limit, Instant since) {
        return published.stream()
                .filter(r -> since == null || !r.timestamp().isBefore(since))
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Records whose problem or action shares keywords with {@code problemText}. A shared problem
     * keyword scores 1, a shared action keyword 0.5. Ties go to resolved records, then to the
     * most recent.
     */
    public List<RemediationRecord> getSimilar(String problemText, int limit) {
        var query = tokens(problemText);
        if (query.isEmpty() || limit <= 0) return List.of();
        record Scored(RemediationRecord r, double score) {}
        return published.stream()
                .map(r -> new Scored(r, score(query, r)))
                .filter(s -> s.score() > 0)
                .sorted(Comparator.comparingDouble(Scored::score).reversed()
                        .thenComparingInt(s -> outcomeRank(s.r().outcome()))
                        .thenComparing(s -> s.r().timestamp(), Comparator.reverseOrder()))
                .limit(limit)
                .map(Scored::r)
                .toList();
    }

    static double score(Set<String> query, RemediationRecord r) {
        var problem = tokens(r.problem());
        var action = tokens(r.action());
        double score = 0;
        for (String t : query) {
            if (problem.contains(t)) score += 1.0;
            if (action.contains(t)) score += 0.5;
        }
        return score;
    }

    static Set<String> tokens(String text) {
        var out = new HashSet<String>();
        if (text == null) return out;
        for (String t : text.toLowerCase(Locale.ROOT).split("[^\\p{Alnum}]+")) {
            if (t.length() >= 3 && !STOPWORDS.contains(t)) out.add(t);
        }
        return out;
    }

    private static int outcomeRank(RemediationOutcome o) {
        return switch (o == null ? RemediationOutcome.UNKNOWN : o) {
            case RESOLVED -> 0;
            case PARTIAL -> 1;
            case UNKNOWN -> 2;
            case FAILED -> 3;
        };
    }

    public RemediationStats stats() {
        var snapshot = published;
        var byOutcome = new EnumMap<RemediationOutcome, Integer>(RemediationOutcome.class);
        for (var o : RemediationOutcome.values()) byOutcome.put(o, 0);
        int automatic = 0;
        for (var r : snapshot) {
            byOutcome.merge(r.outcome(), 1, Integer::sum);
            if (r.automatic()) automatic++;
        }
        int known = snapshot.size() - byOutcome.get(RemediationOutcome.UNKNOWN);
        double rate = known == 0 ? 0 : (double) byOutcome.get(RemediationOutcome.RESOLVED) / known;
        return new RemediationStats(snapshot.size(), byOutcome, automatic, rate);
    }

    public int count() {
        return published.size();
    }

    @Scheduled(fixedDelayString = "${insights.remediation.flush-interval-ms:60000}")
    public void flushIfDirty() {
        synchronized (writeLock) {
            flushLocked();
        }
    }

    private void flushLocked() {
        if (!dirty) return;
        var doc = new LinkedHashMap<String, Object>();
        doc.put("savedAt", clock.instant());
        doc.put("records", new ArrayList<>(records));
        try {
            file.write(doc);
            dirty = false;
        } catch (RuntimeException e) {
            log.warn("[Remediation] persist failed, will retry: {}", e.getMessage());
        }
    }

    @PostConstruct
    public void load() {
        Optional<JsonNode> doc;
        try {
            doc = file.readTree();
        } catch (RuntimeException e) {
            log.warn("[Remediation] cannot read {}, starting empty: {}", file.path(), e.getMessage());
            return;
        }
        if (doc.isEmpty()) return;
        int dropped = 0;
        synchronized (writeLock) {
            for (JsonNode n : doc.get().path("records")) {
                try {
                    var r = file.mapper().treeToValue(n, RemediationRecord.class);
                    if (isBlank(r.id()) || isBlank(r.resourceId()) || r.timestamp() == null) {
                        throw new IllegalStateException("incomplete record " + n);
                    }
                    records.addLast(r.outcome() == null ? r.withIdentity(r.id(), r.timestamp()) : r);
                } catch (Exception e) {
                    dropped++;
                    log.warn("[Remediation] dropping invalid record: {}", e.getMessage());
                }
            }
            while (records.size() > maxRecords) records.removeFirst();
            publish();
        }
        log.info("[Remediation] loaded {} records ({} dropped)", count(), dropped);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
