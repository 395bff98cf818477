package org.caureq.opsinsights.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * An action taken against a problem and how it turned out.
 *
 * @param findingId         optional link to the finding that prompted the action
 * @param timeToResolution  null when unknown
 */
public record RemediationRecord(String id, Instant timestamp, String resourceId, String findingId,
                                String problem, String action, RemediationOutcome outcome,
                                Duration timeToResolution, String note, boolean automatic) {

    public RemediationRecord withIdentity(String newId, Instant newTimestamp) {
        return new RemediationRecord(newId, newTimestamp, resourceId, findingId, problem, action,
                outcome == null ? RemediationOutcome.UNKNOWN : outcome, timeToResolution, note, automatic);
    }
}
