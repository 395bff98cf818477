package org.caureq.opsinsights.service.context;

import java.util.List;

/** 0-100 score with letter grade; {@code factors} lists what pulled it down. */
public record HealthScore(int score, String grade, List<String> factors) {
    public HealthScore {
        factors = List.copyOf(factors);
    }
}
