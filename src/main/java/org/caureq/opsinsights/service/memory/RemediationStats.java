package org.caureq.opsinsights.service.memory;

import org.caureq.opsinsights.domain.model.RemediationOutcome;

import java.util.Map;

/**
 * @param successRate resolved share of the records with a known outcome, 0 when there are none
 */
public record RemediationStats(int total, Map<RemediationOutcome, Integer> byOutcome, int automatic,
                               double successRate) {}
