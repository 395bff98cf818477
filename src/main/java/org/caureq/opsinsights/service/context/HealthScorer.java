package org.caureq.opsinsights.service.context;

import org.caureq.opsinsights.domain.model.Anomaly;
import org.caureq.opsinsights.domain.model.AnomalySeverity;
import org.caureq.opsinsights.domain.model.CapacityForecast;
import org.caureq.opsinsights.domain.model.ForecastStatus;
import org.caureq.opsinsights.domain.model.Prediction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Heuristic health score from current anomalies, imminent predictions and near capacity limits. */
public final class HealthScorer {
    static final double RISK_CONFIDENCE = 0.5;

    private HealthScorer() {}

    public static HealthScore score(List<Anomaly> anomalies, List<Prediction> predictions,
                                    List<CapacityForecast> forecasts) {
        int score = 100;
        var factors = new ArrayList<String>();
        for (var a : anomalies) {
            int d = a.severity() == AnomalySeverity.CRITICAL ? 20 : a.severity() == AnomalySeverity.WARNING ? 10 : 0;
            if (d == 0) continue;
            score -= d;
            factors.add("%s %s anomaly on %s".formatted(a.severity().id(), a.metric(), a.resourceId()));
        }
        for (var p : predictions) {
            if (p.confidence() < RISK_CONFIDENCE) continue;
            if (p.overdue() || p.daysUntil() <= 2) {
                score -= 10;
                factors.add(String.format(Locale.ROOT, "%s expected on %s %s", p.kind().id(), p.resourceId(),
                        p.overdue() ? "(overdue)" : "within 2 days"));
            }
        }
        for (var f : forecasts) {
            int d = f.status() == ForecastStatus.AT_LIMIT ? 25 : f.daysLeft() < 7 ? 15 : f.daysLeft() < 30 ? 5 : 0;
            if (d == 0) continue;
            score -= d;
            factors.add(String.format(Locale.ROOT, "%s on %s reaches limit in %.1f days",
                    f.metric(), f.resourceId(), f.daysLeft()));
        }
        score = Math.max(0, Math.min(100, score));
        return new HealthScore(score, grade(score), factors);
    }

    public static String grade(int score) {
        if (score >= 90) return "A";
        if (score >= 75) return "B";
        if (score >= 60) return "C";
        if (score >= 40) return "D";
        return "F";
    }
}
