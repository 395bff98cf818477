package org.caureq.opsinsights.service.context;

import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.domain.model.Anomaly;
import org.caureq.opsinsights.domain.model.CapacityForecast;
import org.caureq.opsinsights.domain.model.Change;
import org.caureq.opsinsights.domain.model.Finding;
import org.caureq.opsinsights.domain.model.ForecastStatus;
import org.caureq.opsinsights.domain.model.MetricBaseline;
import org.caureq.opsinsights.domain.model.Prediction;
import org.caureq.opsinsights.domain.model.RemediationRecord;
import org.caureq.opsinsights.domain.model.Trend;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Plain-text rendering of assembled contexts, for prompts and reports.
 * Every section gets a header; empty and unavailable sections say so explicitly.
 */
@Component
public class ContextFormatter {
    static final String TRUNCATED = "[truncated]";

    private final int maxChars;

    public ContextFormatter(InsightsProps props) {
        this.maxChars = props.context().maxChars();
    }

    public String format(ResourceContext ctx) {
        var sb = new StringBuilder();
        sb.append("# Resource ").append(ctx.resourceId())
                .append(" (health ").append(ctx.health().score()).append('/').append(ctx.health().grade()).append(")\n");
        if (ctx.degraded()) sb.append("Note: some sections are unavailable, context is partial.\n");

        section(sb, "Trends", ctx.trends(), m -> lines(m, ContextFormatter::trendLine));
        section(sb, "Baselines", ctx.baselines(), l -> list(l, ContextFormatter::baselineLine));
        section(sb, "Anomalies", ctx.anomalies(), l -> list(l, ContextFormatter::anomalyLine));
        section(sb, "Predicted recurrences", ctx.predictions(), l -> list(l, ContextFormatter::predictionLine));
        section(sb, "Capacity forecasts", ctx.forecasts(), l -> list(l, ContextFormatter::forecastLine));
        section(sb, "Recent changes", ctx.changes(), l -> list(l, ContextFormatter::changeLine));
        section(sb, "Past remediations", ctx.remediations(), l -> list(l, ContextFormatter::remediationLine));
        section(sb, "Past findings", ctx.findings(), l -> list(l, ContextFormatter::findingLine));
        section(sb, "Notes", ctx.notes(), l -> list(l, n -> n));
        healthFactors(sb, ctx.health());
        return truncate(sb.toString(), maxChars);
    }

    public String format(InfrastructureContext ctx) {
        var sb = new StringBuilder();
        sb.append("# Infrastructure (").append(ctx.resourceCount()).append(" resources, health ")
                .append(ctx.health().score()).append('/').append(ctx.health().grade()).append(")\n");
        if (ctx.degraded()) sb.append("Note: some sections are unavailable, context is partial.\n");

        section(sb, "Anomalies", ctx.anomalies(), l -> list(l, ContextFormatter::anomalyLine));
        section(sb, "Upcoming risks", ctx.upcomingRisks(), l -> list(l, ContextFormatter::predictionLine));
        section(sb, "Capacity forecasts", ctx.forecasts(), l -> list(l, ContextFormatter::forecastLine));
        section(sb, "Recent changes", ctx.recentChanges(), l -> list(l, ContextFormatter::changeLine));
        section(sb, "Recent remediations", ctx.recentRemediations(), l -> list(l, ContextFormatter::remediationLine));
        section(sb, "Learning", ctx.learning(), ContextFormatter::learningLines);
        healthFactors(sb, ctx.health());
        return truncate(sb.toString(), maxChars);
    }

    /** One line per concern, for tight prompts. */
    public String formatCompact(InfrastructureContext ctx) {
        var parts = new ArrayList<String>();
        parts.add("health %d/%s".formatted(ctx.health().score(), ctx.health().grade()));
        parts.add(count("anomalies", ctx.anomalies()));
        parts.add(count("risks", ctx.upcomingRisks()));
        if (ctx.forecasts().isAvailable() && !ctx.forecasts().data().isEmpty()) {
            var f = ctx.forecasts().data().get(0);
            parts.add(String.format(Locale.ROOT, "soonest limit %s %s in %.1fd", f.resourceId(), f.metric(), f.daysLeft()));
        }
        parts.add(count("changes", ctx.recentChanges()));
        parts.add(count("remediations", ctx.recentRemediations()));
        var line = String.join("; ", parts);
        return ctx.degraded() ? line + " (partial)" : line;
    }

    private static String count(String label, Section<? extends List<?>> s) {
        return switch (s.status()) {
            case AVAILABLE -> label + " " + s.data().size();
            case EMPTY -> label + " 0";
            case UNAVAILABLE -> label + " n/a";
        };
    }

    private static <T> void section(StringBuilder sb, String title, Section<T> s, Function<T, String> body) {
        sb.append("\n## ").append(title).append('\n');
        switch (s.status()) {
            case AVAILABLE -> sb.append(body.apply(s.data()));
            case EMPTY -> sb.append("No historical signal available for ").append(s.name()).append(".\n");
            case UNAVAILABLE -> sb.append("Unavailable (").append(s.reason()).append(").\n");
        }
    }

    private static void healthFactors(StringBuilder sb, HealthScore health) {
        if (health.factors().isEmpty()) return;
        sb.append("\n## Health factors\n");
        health.factors().forEach(f -> sb.append("- ").append(f).append('\n'));
    }

    private static <T> String list(List<T> items, Function<T, String> line) {
        var sb = new StringBuilder();
        for (T t : items) sb.append("- ").append(line.apply(t)).append('\n');
        return sb.toString();
    }

    private static <T> String lines(Map<String, T> items, BiFunction<String, T, String> line) {
        var sb = new StringBuilder();
        items.forEach((k, v) -> sb.append("- ").append(line.apply(k, v)).append('\n'));
        return sb.toString();
    }

    static String trendLine(String metric, Trend t) {
        if (t.sampleCount() < 2) return "%s: insufficient data (%d samples)".formatted(metric, t.sampleCount());
        return String.format(Locale.ROOT, "%s: %s, %+.2f/h (%+.2f/day), now %.1f, avg %.1f, range %.1f-%.1f, confidence %.2f",
                metric, t.direction().id(), t.ratePerHour(), t.ratePerDay(), t.current(), t.average(),
                t.min(), t.max(), t.confidence());
    }

    static String baselineLine(MetricBaseline b) {
        return String.format(Locale.ROOT, "%s: mean %.1f, std %.1f, p5-p95 %.1f-%.1f (%d samples)",
                b.metric(), b.mean(), b.stdDev(), b.percentiles().p5(), b.percentiles().p95(), b.sampleCount());
    }

    static String anomalyLine(Anomaly a) {
        return "%s %s on %s: %s".formatted(a.severity().id(), a.metric(), a.resourceId(), a.description());
    }

    static String predictionLine(Prediction p) {
        var span = formatDuration(Duration.ofMillis(Math.round(Math.abs(p.daysUntil()) * 86_400_000)));
        var when = p.overdue() ? "overdue by " + span : "expected in " + span;
        return String.format(Locale.ROOT, "%s on %s %s (confidence %.2f; %s)",
                p.kind().id(), p.resourceId(), when, p.confidence(), p.basis());
    }

    static String forecastLine(CapacityForecast f) {
        if (f.status() == ForecastStatus.AT_LIMIT) return "%s on %s: %s".formatted(f.metric(), f.resourceId(), f.description());
        return String.format(Locale.ROOT, "%s on %s: %s (confidence %.2f)",
                f.metric(), f.resourceId(), f.description(), f.confidence());
    }

    static String changeLine(Change c) {
        return "%s [%s] %s".formatted(c.detectedAt(), c.type().id(), c.description());
    }

    static String remediationLine(RemediationRecord r) {
        var sb = new StringBuilder()
                .append(r.timestamp()).append(' ')
                .append(r.problem()).append(" -> ").append(r.action())
                .append(" (").append(r.outcome().id());
        if (r.timeToResolution() != null) sb.append(", ").append(formatDuration(r.timeToResolution()));
        if (r.automatic()) sb.append(", automatic");
        sb.append(')');
        if (r.note() != null && !r.note().isBlank()) sb.append(": ").append(r.note());
        return sb.toString();
    }

    static String findingLine(Finding f) {
        return "%s %s %s: %s%s".formatted(f.raisedAt(), f.level() == null ? "info" : f.level(), f.type(), f.message(),
                f.acknowledged() ? " (acknowledged)" : "");
    }

    private static String learningLines(LearningStats s) {
        return "- resources with baselines: %d\n- recurring patterns: %d (%d events)\n- changes retained: %d\n- remediations logged: %d\n"
                .formatted(s.resourcesWithBaselines(), s.patternsDetected(), s.eventsTracked(),
                        s.changesRetained(), s.remediationsLogged());
    }

    /** Compact duration: {@code 45m}, {@code 2h30m}, {@code 1d1h}. */
    public static String formatDuration(Duration d) {
        if (d == null) return "-";
        long minutes = Math.abs(d.toMinutes());
        long days = minutes / (24 * 60);
        long hours = (minutes / 60) % 24;
        long mins = minutes % 60;
        if (days > 0) return hours > 0 ? days + "d" + hours + "h" : days + "d";
        if (hours > 0) return mins > 0 ? hours + "h" + mins + "m" : hours + "h";
        return mins + "m";
    }

    /** Cuts on a line boundary so that the result, marker included, fits {@code max}. */
    public static String truncate(String text, int max) {
        if (text.length() <= max) return text;
        int budget = Math.max(0, max - TRUNCATED.length() - 1);
        int cut = text.lastIndexOf('\n', budget);
        String head = cut > 0 ? text.substring(0, cut) : text.substring(0, budget);
        return head + "\n" + TRUNCATED;
    }
}
