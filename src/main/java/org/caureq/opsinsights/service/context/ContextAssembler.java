package org.caureq.opsinsights.service.context;

import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.domain.model.Anomaly;
import org.caureq.opsinsights.domain.model.CapacityForecast;
import org.caureq.opsinsights.domain.model.Change;
import org.caureq.opsinsights.domain.model.Finding;
import org.caureq.opsinsights.domain.model.MetricBaseline;
import org.caureq.opsinsights.domain.model.Prediction;
import org.caureq.opsinsights.domain.model.RemediationRecord;
import org.caureq.opsinsights.domain.model.Trend;
import org.caureq.opsinsights.service.baseline.BaselineStore;
import org.caureq.opsinsights.service.memory.ChangeDetector;
import org.caureq.opsinsights.service.memory.RemediationLog;
import org.caureq.opsinsights.service.patterns.PatternDetector;
import org.caureq.opsinsights.service.source.FindingsSource;
import org.caureq.opsinsights.service.source.NotesSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Builds resource and infrastructure contexts from already computed state.
 * <p>
 * Sections backed by published snapshots (trends, forecasts, changes, remediations) are read on
 * the calling thread. Lookups that may block (baselines, patterns, findings, notes) run on the
 * bounded context executor and are awaited until one shared deadline. A section that times out,
 * fails or finds the executor saturated is marked unavailable; the build itself never fails.
 */
@Slf4j
@Service
public class ContextAssembler {
    static final double RISK_HORIZON_DAYS = 7;

    private final BaselineStore baselineStore;
    private final PatternDetector patternDetector;
    private final ChangeDetector changeDetector;
    private final RemediationLog remediationLog;
    private final InsightRefresher insights;
    private final FindingsSource findingsSource;
    private final NotesSource notesSource;
    private final ExecutorService executor;
    private final InsightsProps.ContextProps props;
    private final Clock clock;

    public ContextAssembler(BaselineStore baselineStore, PatternDetector patternDetector,
                            ChangeDetector changeDetector, RemediationLog remediationLog,
                            InsightRefresher insights, FindingsSource findingsSource, NotesSource notesSource,
                            @Qualifier("contextExecutor") ExecutorService executor,
                            InsightsProps props, Clock clock) {
        this.baselineStore = baselineStore;
        this.patternDetector = patternDetector;
        this.changeDetector = changeDetector;
        this.remediationLog = remediationLog;
        this.insights = insights;
        this.findingsSource = findingsSource;
        this.notesSource = notesSource;
        this.executor = executor;
        this.props = props.context();
        this.clock = clock;
    }

    public Duration defaultDeadline() { return props.deadline(); }

    public ResourceContext buildForResource(String resourceId) {
        return buildForResource(resourceId, props.deadline());
    }

    public ResourceContext buildForResource(String resourceId, Duration deadline) {
        if (resourceId == null || resourceId.isBlank()) throw new IllegalArgumentException("resourceId is required");
        long started = System.nanoTime();
        long until = started + (deadline == null ? props.deadline() : deadline).toNanos();

        var current = insights.get(resourceId);

        Future<List<MetricBaseline>> baselinesF = submit(() -> baselineStore.getMatureBaselines(resourceId));
        Future<List<Anomaly>> anomaliesF = submit(() -> current
                .map(i -> baselineStore.detectAll(resourceId, i.latest())).orElse(List.of()));
        Future<List<Prediction>> predictionsF = submit(() -> limit(
                patternDetector.getPredictionsForResource(resourceId), props.maxPredictions()));
        Future<List<Finding>> findingsF = submit(() -> findingsSource.findingsFor(resourceId, props.maxFindings()));
        Future<List<String>> notesF = submit(() -> notesSource.notesFor(resourceId));

        // published snapshots, read on the calling thread
        Section<Map<String, Trend>> trends = inline("trends", () -> current
                .map(ResourceInsights::trends).orElse(Map.of()));
        Section<List<CapacityForecast>> forecasts = inline("forecasts", () -> current
                .map(i -> soonestFirst(i.forecasts().values())).orElse(List.of()));
        Section<List<Change>> changes = inline("changes",
                () -> changeDetector.getForResource(resourceId, props.maxChanges()));
        Section<List<RemediationRecord>> remediations = inline("remediations",
                () -> remediationLog.getForResource(resourceId, props.maxRemediations()));

        var baselines = await("baselines", baselinesF, until);
        var anomalies = await("anomalies", anomaliesF, until);
        var predictions = await("predictions", predictionsF, until);
        var findings = await("findings", findingsF, until);
        var notes = await("notes", notesF, until);
        purgeCancelled();

        var health = HealthScorer.score(dataOr(anomalies), dataOr(predictions), dataOr(forecasts));
        var ctx = new ResourceContext(resourceId, clock.instant(), trends, baselines, anomalies, predictions,
                forecasts, changes, remediations, findings, notes, health);
        logBuild("resource " + resourceId, started, ctx.degraded());
        return ctx;
    }

    public InfrastructureContext buildForInfrastructure() {
        return buildForInfrastructure(props.deadline());
    }

    public InfrastructureContext buildForInfrastructure(Duration deadline) {
        long started = System.nanoTime();
        long until = started + (deadline == null ? props.deadline() : deadline).toNanos();
        Instant now = clock.instant();
        Instant since = now.minus(props.recentWindow());
        var all = insights.all();

        Future<List<Anomaly>> anomaliesF = submit(() -> {
            var out = new ArrayList<Anomaly>();
            for (var i : all) out.addAll(baselineStore.detectAll(i.resourceId(), i.latest()));
            out.sort(Comparator.comparingDouble((Anomaly a) -> Math.abs(a.zScore())).reversed());
            return out;
        });
        Future<List<Prediction>> risksF = submit(() -> limit(patternDetector.getPredictions().stream()
                .filter(p -> p.daysUntil() <= RISK_HORIZON_DAYS && p.confidence() >= HealthScorer.RISK_CONFIDENCE)
                .toList(), props.maxPredictions()));
        Future<LearningStats> learningF = submit(() -> new LearningStats(
                baselineStore.resourceCount(), patternDetector.patternCount(), patternDetector.eventCount(),
                changeDetector.count(), remediationLog.count()));

        Section<List<CapacityForecast>> forecasts = inline("forecasts", () -> limit(soonestFirst(all.stream()
                .flatMap(i -> i.forecasts().values().stream()).toList()), props.maxPredictions()));
        Section<List<Change>> changes = inline("recent changes", () -> changeDetector.getRecent(props.maxChanges(), since));
        Section<List<RemediationRecord>> remediations = inline("recent remediations",
                () -> remediationLog.recent(props.maxRemediations(), since));

        var anomalies = await("anomalies", anomaliesF, until);
        var risks = await("upcoming risks", risksF, until);
        Section<LearningStats> learning = awaitValue("learning", learningF, until);
        purgeCancelled();

        var health = HealthScorer.score(dataOr(anomalies), dataOr(risks), dataOr(forecasts));
        var ctx = new InfrastructureContext(now, all.size(), anomalies, risks, forecasts, changes, remediations,
                learning, health);
        logBuild("infrastructure", started, ctx.degraded());
        return ctx;
    }

    private <T> Future<T> submit(Callable<T> task) {
        try {
            return executor.submit(task);
        } catch (RejectedExecutionException e) {
            var f = new CompletableFuture<T>();
            f.completeExceptionally(e);
            return f;
        }
    }

    private <T> Section<T> inline(String name, Supplier<T> read) {
        try {
            T value = read.get();
            return value == null || isEmpty(value) ? Section.empty(name) : Section.available(name, value);
        } catch (RuntimeException e) {
            log.warn("[Context] {} section failed: {}", name, e.toString());
            return Section.unavailable(name, "source failed: " + e.getMessage());
        }
    }

    /** Cancelled tasks still queued would otherwise hold queue slots until a worker frees up. */
    private void purgeCancelled() {
        if (executor instanceof ThreadPoolExecutor pool) pool.purge();
    }

    /** Empty collections and maps become {@link SectionStatus#EMPTY}. */
    private <T> Section<T> await(String name, Future<T> future, long untilNanos) {
        var s = awaitValue(name, future, untilNanos);
        if (s.isAvailable() && isEmpty(s.data())) return Section.empty(name);
        return s;
    }

    private <T> Section<T> awaitValue(String name, Future<T> future, long untilNanos) {
        try {
            long remaining = Math.max(0, untilNanos - System.nanoTime());
            T value = future.get(remaining, TimeUnit.NANOSECONDS);
            return value == null ? Section.empty(name) : Section.available(name, value);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Context] {} section timed out", name);
            return Section.unavailable(name, "timed out");
        } catch (ExecutionException e) {
            var cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RejectedExecutionException) {
                log.warn("[Context] {} section skipped, lookup pool is saturated", name);
                return Section.unavailable(name, "busy");
            }
            log.warn("[Context] {} section failed: {}", name, cause.toString());
            return Section.unavailable(name, "source failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Section.unavailable(name, "interrupted");
        }
    }

    private static boolean isEmpty(Object data) {
        if (data instanceof Collection<?> c) return c.isEmpty();
        if (data instanceof Map<?, ?> m) return m.isEmpty();
        return false;
    }

    private static <T> List<T> dataOr(Section<List<T>> s) {
        return s.isAvailable() ? s.data() : List.of();
    }

    private static <T> List<T> limit(List<T> list, int max) {
        return list.size() <= max ? list : List.copyOf(list.subList(0, max));
    }

    private static List<CapacityForecast> soonestFirst(Collection<CapacityForecast> forecasts) {
        return forecasts.stream().sorted(Comparator.comparingDouble(CapacityForecast::daysLeft)).toList();
    }

    private void logBuild(String what, long startedNanos, boolean degraded) {
        long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        if (degraded) log.info("[Context] {} built in {} ms (degraded)", what, ms);
        else log.debug("[Context] {} built in {} ms", what, ms);
    }
}
