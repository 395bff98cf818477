package org.caureq.opsinsights.service.baseline;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.domain.model.Anomaly;
import org.caureq.opsinsights.domain.model.AnomalySeverity;
import org.caureq.opsinsights.domain.model.AnomalyVerdict;
import org.caureq.opsinsights.domain.model.MetricBaseline;
import org.caureq.opsinsights.domain.model.Percentiles;
import org.caureq.opsinsights.domain.model.ResourceBaselines;
import org.caureq.opsinsights.domain.model.Sample;
import org.caureq.opsinsights.service.persistence.JsonStateFile;
import org.caureq.opsinsights.service.persistence.StateFiles;
import org.caureq.opsinsights.service.stats.Stats;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Learned per-resource, per-metric baselines and the anomaly verdicts derived from them.
 * <p>
 * Each resource maps to one immutable {@link ResourceBaselines}. A learning pass builds the
 * replacement aside and publishes it with a single {@code put}, so readers see either the
 * previous complete set or the new one. Baselines with fewer than {@code min-samples} samples
 * are kept (they show learning progress) but are immature: they are never returned by
 * {@link #getBaseline} and never produce a verdict.
 */
@Slf4j
@Service
public class BaselineStore {
    static final String FILE_NAME = "baselines.json";

    private final InsightsProps.BaselineProps props;
    private final Clock clock;
    private final JsonStateFile file;
    private final Map<String, ResourceBaselines> baselines = new ConcurrentHashMap<>();

    public BaselineStore(InsightsProps props, StateFiles files, Clock clock) {
        this.props = props.baseline();
        this.clock = clock;
        this.file = files.file(FILE_NAME);
    }

    /** Learns every metric in {@code history} and swaps the resource's baseline set. */
    public ResourceBaselines learn(String resourceId, Map<String, List<Sample>> history) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId is required");
        }
        Instant now = clock.instant();
        var previous = baselines.get(resourceId);
        var metrics = new HashMap<String, MetricBaseline>(previous == null ? Map.of() : previous.metrics());
        if (history != null) {
            history.forEach((metric, samples) -> {
                var b = compute(resourceId, metric, samples, now);
                if (b != null) metrics.put(metric, b);
            });
        }
        var next = new ResourceBaselines(resourceId, metrics, now);
        baselines.put(resourceId, next);
        return next;
    }

    /** Null when the window holds no sample at all. */
    MetricBaseline compute(String resourceId, String metric, List<Sample> samples, Instant learnedAt) {
        var window = Stats.lastWindow(Stats.normalize(samples), props.learningWindow());
        if (window.isEmpty()) return null;

        double[] v = Stats.values(window);
        double mean = Stats.mean(v);
        double std = Stats.stdDev(v);
        double[] sorted = Arrays.copyOf(v, v.length);
        Arrays.sort(sorted);
        var pct = new Percentiles(
                Stats.percentile(sorted, 5),
                Stats.percentile(sorted, 25),
                Stats.percentile(sorted, 50),
                Stats.percentile(sorted, 75),
                Stats.percentile(sorted, 95));
        return new MetricBaseline(resourceId, metric, mean, std, pct, window.size(), learnedAt, hourlyProfile(window));
    }

    private static List<Double> hourlyProfile(List<Sample> window) {
        double[] sum = new double[24];
        int[] count = new int[24];
        for (Sample s : window) {
            int h = s.timestamp().atZone(ZoneOffset.UTC).getHour();
            sum[h] += s.value();
            count[h]++;
        }
        var out = new ArrayList<Double>(24);
        for (int h = 0; h < 24; h++) out.add(count[h] == 0 ? null : sum[h] / count[h]);
        return out;
    }

    public boolean isMature(MetricBaseline b) {
        return b != null && b.sampleCount() >= props.minSamples();
    }

    /** Mature baseline only; an immature or unknown one reads as not found. */
    public Optional<MetricBaseline> getBaseline(String resourceId, String metric) {
        var rb = baselines.get(resourceId);
        if (rb == null) return Optional.empty();
        return Optional.ofNullable(rb.metrics().get(metric)).filter(this::isMature);
    }

    /** All baselines of a resource, immature ones included. */
    public Optional<ResourceBaselines> getResourceBaselines(String resourceId) {
        return Optional.ofNullable(baselines.get(resourceId));
    }

    /** Mature baselines of a resource, sorted by metric. */
    public List<MetricBaseline> getMatureBaselines(String resourceId) {
        var rb = baselines.get(resourceId);
        if (rb == null) return List.of();
        return rb.metrics().values().stream()
                .filter(this::isMature)
                .sorted(Comparator.comparing(MetricBaseline::metric))
                .toList();
    }

    public AnomalyVerdict isAnomaly(String resourceId, String metric, double value) {
        return getBaseline(resourceId, metric).map(b -> verdict(b, value)).orElse(AnomalyVerdict.NONE);
    }

    AnomalyVerdict verdict(MetricBaseline b, double value) {
        // zero variance cannot tell an outlier from normal
        if (b.stdDev() == 0 || !Double.isFinite(value)) return AnomalyVerdict.NONE;
        double z = (value - b.mean()) / b.stdDev();
        double abs = Math.abs(z);
        AnomalySeverity severity = abs >= props.criticalZ() ? AnomalySeverity.CRITICAL
                : abs >= props.warningZ() ? AnomalySeverity.WARNING
                : AnomalySeverity.NONE;
        return new AnomalyVerdict(severity != AnomalySeverity.NONE, z, severity);
    }

    public Optional<Anomaly> detect(String resourceId, String metric, double value) {
        var b = getBaseline(resourceId, metric);
        if (b.isEmpty()) return Optional.empty();
        var v = verdict(b.get(), value);
        if (!v.anomalous()) return Optional.empty();
        var desc = String.format(Locale.ROOT, "%.1f is %.1f std devs %s baseline (mean: %.1f)",
                value, Math.abs(v.zScore()), v.zScore() >= 0 ? "above" : "below", b.get().mean());
        return Optional.of(new Anomaly(resourceId, metric, value, b.get().mean(), b.get().stdDev(),
                v.zScore(), v.severity(), clock.instant(), desc));
    }

    /** Anomalies among the given latest values, most severe first. */
    public List<Anomaly> detectAll(String resourceId, Map<String, Double> latest) {
        var out = new ArrayList<Anomaly>();
        latest.forEach((metric, value) -> {
            if (value != null) detect(resourceId, metric, value).ifPresent(out::add);
        });
        out.sort(Comparator.comparingDouble((Anomaly a) -> Math.abs(a.zScore())).reversed());
        return out;
    }

    public Set<String> resourceIds() {
        return new TreeSet<>(baselines.keySet());
    }

    /** Resources holding at least one mature baseline. */
    public int resourceCount() {
        return (int) baselines.values().stream()
                .filter(rb -> rb.metrics().values().stream().anyMatch(this::isMature))
                .count();
    }

    public void persist() {
        var all = baselines.values().stream()
                .flatMap(rb -> rb.metrics().values().stream())
                .sorted(Comparator.comparing(MetricBaseline::resourceId).thenComparing(MetricBaseline::metric))
                .toList();
        var doc = new LinkedHashMap<String, Object>();
        doc.put("savedAt", clock.instant());
        doc.put("baselines", all);
        file.write(doc);
        log.debug("[Baselines] persisted {} baselines to {}", all.size(), file.path());
    }

    /** Loads persisted baselines; an invalid record is dropped on its own. */
    @PostConstruct
    public void load() {
        Optional<JsonNode> doc;
        try {
            doc = file.readTree();
        } catch (RuntimeException e) {
            log.warn("[Baselines] cannot read {}, starting empty: {}", file.path(), e.getMessage());
            return;
        }
        if (doc.isEmpty()) return;

        var byResource = new HashMap<String, Map<String, MetricBaseline>>();
        int dropped = 0;
        for (JsonNode node : doc.get().path("baselines")) {
            try {
                var b = file.mapper().treeToValue(node, MetricBaseline.class);
                b.validate();
                byResource.computeIfAbsent(b.resourceId(), k -> new HashMap<>()).put(b.metric(), b);
            } catch (Exception e) {
                dropped++;
                log.warn("[Baselines] dropping invalid baseline record: {}", e.getMessage());
            }
        }
        byResource.forEach((id, metrics) -> {
            Instant learnedAt = metrics.values().stream().map(MetricBaseline::learnedAt)
                    .max(Comparator.naturalOrder()).orElse(clock.instant());
            baselines.put(id, new ResourceBaselines(id, metrics, learnedAt));
        });
        log.info("[Baselines] loaded {} resources from {} ({} dropped)", byResource.size(), file.path(), dropped);
    }
}
