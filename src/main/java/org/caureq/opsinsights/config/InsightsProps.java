package org.caureq.opsinsights.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Tuning knobs of the insights engine. Every value is optional; missing or
 * non-positive values fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "insights")
public record InsightsProps(TrendProps trend, BaselineProps baseline, PatternProps patterns,
                            ForecastProps forecast, ChangeProps changes, RemediationProps remediation,
                            ContextProps context, StorageProps storage) {

    public InsightsProps {
        if (trend == null) trend = new TrendProps(null, null, null);
        if (baseline == null) baseline = new BaselineProps(null, null, null, null, null);
        if (patterns == null) patterns = new PatternProps(null, null, null, null);
        if (forecast == null) forecast = new ForecastProps(null, null, null, null);
        if (changes == null) changes = new ChangeProps(null, null, null);
        if (remediation == null) remediation = new RemediationProps(null);
        if (context == null) context = new ContextProps(null, null, null, null, null, null, null);
        if (storage == null) storage = new StorageProps(null);
    }

    public static InsightsProps defaults() {
        return new InsightsProps(null, null, null, null, null, null, null, null);
    }

    /** Trend classification. Growth threshold is a percentage of the window mean per hour. */
    public record TrendProps(Duration window, Double growthThresholdPctPerHour, Double volatilityRatio) {
        public TrendProps {
            window = positiveOr(window, Duration.ofHours(24));
            // a 20 to 90 climb over eight days reads about 0.42 %/h on a 24h window; 1 %/h would call it stable
            growthThresholdPctPerHour = positiveOr(growthThresholdPctPerHour, 0.25);
            volatilityRatio = positiveOr(volatilityRatio, 0.2);
        }
    }

    public record BaselineProps(Duration learningWindow, Integer minSamples, Double warningZ,
                                Double criticalZ, List<String> metrics) {
        public BaselineProps {
            learningWindow = positiveOr(learningWindow, Duration.ofDays(7));
            minSamples = positiveOr(minSamples, 100);
            warningZ = positiveOr(warningZ, 2.0);
            criticalZ = positiveOr(criticalZ, 3.0);
            if (metrics == null || metrics.isEmpty()) metrics = List.of("cpu", "memory", "disk");
            else metrics = List.copyOf(metrics);
            if (criticalZ < warningZ) {
                throw new IllegalArgumentException("insights.baseline.critical-z must be >= warning-z");
            }
        }
    }

    public record PatternProps(Integer minEvents, Duration retention, Duration dedupeWindow, Integer maxEventsPerKey) {
        public PatternProps {
            minEvents = Math.max(3, positiveOr(minEvents, 3));
            retention = positiveOr(retention, Duration.ofDays(90));
            dedupeWindow = dedupeWindow == null || dedupeWindow.isNegative() ? Duration.ofHours(1) : dedupeWindow;
            maxEventsPerKey = positiveOr(maxEventsPerKey, 100);
        }
    }

    public record ForecastProps(Duration window, Integer minSamples, Integer projectionPoints, Double defaultLimit) {
        public ForecastProps {
            window = positiveOr(window, Duration.ofDays(7));
            minSamples = Math.max(2, positiveOr(minSamples, 20));
            projectionPoints = positiveOr(projectionPoints, 12);
            defaultLimit = positiveOr(defaultLimit, 100.0);
        }
    }

    /** {@code reportInitial}: emit created changes for the first snapshot instead of only seeding. */
    public record ChangeProps(Integer maxRetained, Boolean recordAsEvents, Boolean reportInitial) {
        public ChangeProps {
            maxRetained = positiveOr(maxRetained, 1000);
            if (recordAsEvents == null) recordAsEvents = true;
            if (reportInitial == null) reportInitial = false;
        }
    }

    public record RemediationProps(Integer maxRecords) {
        public RemediationProps {
            maxRecords = positiveOr(maxRecords, 500);
        }
    }

    public record ContextProps(Duration deadline, Integer maxChars, Duration recentWindow, Integer maxChanges,
                               Integer maxRemediations, Integer maxFindings, Integer maxPredictions) {
        public ContextProps {
            deadline = positiveOr(deadline, Duration.ofMillis(100));
            maxChars = positiveOr(maxChars, 6000);
            recentWindow = positiveOr(recentWindow, Duration.ofHours(24));
            maxChanges = positiveOr(maxChanges, 10);
            maxRemediations = positiveOr(maxRemediations, 5);
            maxFindings = positiveOr(maxFindings, 5);
            maxPredictions = positiveOr(maxPredictions, 5);
        }
    }

    public record StorageProps(String dataDir) {
        public StorageProps {
            if (dataDir == null || dataDir.isBlank()) dataDir = "./data";
        }
    }

    private static Duration positiveOr(Duration d, Duration def) {
        return (d == null || d.isZero() || d.isNegative()) ? def : d;
    }

    private static Integer positiveOr(Integer v, int def) {
        return (v == null || v <= 0) ? def : v;
    }

    private static Double positiveOr(Double v, double def) {
        return (v == null || v <= 0 || v.isNaN()) ? def : v;
    }
}
