package org.caureq.opsinsights.service.memory;

import org.caureq.opsinsights.TestClock;
import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.domain.model.RemediationOutcome;
import org.caureq.opsinsights.domain.model.RemediationRecord;
import org.caureq.opsinsights.service.persistence.StateFiles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RemediationLogTest {
    private static final Instant NOW = Instant.parse("2026-03-08T00:00:00Z");

    @TempDir
    Path dir;

    private TestClock clock;
    private RemediationLog remediations;

    @BeforeEach
    void setUp() {
        clock = new TestClock(NOW);
        remediations = new RemediationLog(InsightsProps.defaults(), new StateFiles(dir), clock);
    }

    private static RemediationRecord rec(String resource, String problem, String action, RemediationOutcome outcome) {
        return new RemediationRecord(null, null, resource, null, problem, action, outcome, null, null, false);
    }

    @Test
    void loggingAssignsIdAndTimestamp() {
        var a = remediations.log(rec("vm1", "disk full", "cleared logs", RemediationOutcome.RESOLVED));
        var b = remediations.log(rec("vm1", "disk full", "cleared logs", RemediationOutcome.RESOLVED));

        assertThat(a.id()).isNotBlank().isNotEqualTo(b.id());
        assertThat(a.timestamp()).isEqualTo(NOW);
        // identical records are both kept
        assertThat(remediations.count()).isEqualTo(2);
    }

    @Test
    void suppliedTimestampIsKeptAndMissingOutcomeIsUnknown() {
        var at = NOW.minus(Duration.ofDays(2));
        var r = remediations.log(new RemediationRecord("ignored", at, "vm1", "f-1", "oom", "restart", null,
                Duration.ofMinutes(5), "note", true));

        assertThat(r.timestamp()).isEqualTo(at);
        assertThat(r.id()).isNotEqualTo("ignored");
        assertThat(r.outcome()).isEqualTo(RemediationOutcome.UNKNOWN);
        assertThat(r.findingId()).isEqualTo("f-1");
    }

    @Test
    void requiredFieldsAreValidated() {
        assertThatThrownBy(() -> remediations.log(rec(" ", "p", "a", null))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> remediations.log(rec("vm1", null, "a", null))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> remediations.log(rec("vm1", "p", "", null))).isInstanceOf(IllegalArgumentException.class);
        assertThat(remediations.count()).isZero();
    }

    @Test
    void queriesReturnNewestFirst() {
        remediations.log(rec("vm1", "first", "a1", RemediationOutcome.RESOLVED));
        clock.advance(Duration.ofHours(1));
        remediations.log(rec("vm2", "second", "a2", RemediationOutcome.RESOLVED));
        clock.advance(Duration.ofHours(1));
        remediations.log(rec("vm1", "third", "a3", RemediationOutcome.FAILED));

        assertThat(remediations.getForResource("vm1", 10)).extracting(RemediationRecord::problem)
                .containsExactly("third", "first");
        assertThat(remediations.recent(2, null)).extracting(RemediationRecord::problem)
                .containsExactly("third", "second");
        assertThat(remediations.recent(10, NOW.plus(Duration.ofMinutes(30)))).hasSize(2);
        assertThat(remediations.getForResource("vm3", 10)).isEmpty();
    }

    @Test
    void similarRanksProblemMatchesAboveActionMatches() {
        remediations.log(rec("vm1", "service crashed", "restart nginx", RemediationOutcome.RESOLVED));
        remediations.log(rec("vm2", "nginx memory leak", "restart service", RemediationOutcome.RESOLVED));
        remediations.log(rec("vm3", "backup failed", "rerun job", RemediationOutcome.RESOLVED));

        var similar = remediations.getSimilar("nginx high memory", 10);

        assertThat(similar).extracting(RemediationRecord::resourceId).containsExactly("vm2", "vm1");
    }

    @Test
    void similarTieGoesToResolvedThenNewest() {
        remediations.log(rec("failed", "disk full", "resize", RemediationOutcome.FAILED));
        clock.advance(Duration.ofMinutes(1));
        remediations.log(rec("old-ok", "disk full", "cleanup", RemediationOutcome.RESOLVED));
        clock.advance(Duration.ofMinutes(1));
        remediations.log(rec("new-ok", "disk full", "cleanup", RemediationOutcome.RESOLVED));

        assertThat(remediations.getSimilar("Disk is FULL!", 10)).extracting(RemediationRecord::resourceId)
                .containsExactly("new-ok", "old-ok", "failed");
        assertThat(remediations.getSimilar("disk", 1)).hasSize(1);
    }

    @Test
    void similarWithoutKeywordsIsEmpty() {
        remediations.log(rec("vm1", "disk full", "cleanup", RemediationOutcome.RESOLVED));

        assertThat(remediations.getSimilar("the and of", 5)).isEmpty();
        assertThat(remediations.getSimilar("kernel panic", 5)).isEmpty();
    }

    @Test
    void tokensAreLowercasedAndFiltered() {
        assertThat(RemediationLog.tokens("The CPU is at 99% on web-01"))
                .containsExactlyInAnyOrder("cpu", "web");
    }

    @Test
    void oldestRecordsAreEvicted() {
        var props = new InsightsProps(null, null, null, null, null, new InsightsProps.RemediationProps(2),
                null, null);
        var small = new RemediationLog(props, new StateFiles(dir), clock);
        for (int i = 0; i < 3; i++) {
            clock.advance(Duration.ofMinutes(1));
            small.log(rec("vm" + i, "p" + i, "a", RemediationOutcome.RESOLVED));
        }

        assertThat(small.recent(10, null)).extracting(RemediationRecord::resourceId).containsExactly("vm2", "vm1");
    }

    @Test
    void statsCountOutcomes() {
        remediations.log(rec("vm1", "p", "a", RemediationOutcome.RESOLVED));
        remediations.log(rec("vm1", "p", "a", RemediationOutcome.RESOLVED));
        remediations.log(rec("vm1", "p", "a", RemediationOutcome.FAILED));
        remediations.log(rec("vm1", "p", "a", null));
        remediations.log(new RemediationRecord(null, null, "vm1", null, "p", "a", RemediationOutcome.PARTIAL,
                null, null, true));

        var stats = remediations.stats();
        assertThat(stats.total()).isEqualTo(5);
        assertThat(stats.byOutcome()).containsEntry(RemediationOutcome.RESOLVED, 2)
                .containsEntry(RemediationOutcome.UNKNOWN, 1)
                .containsEntry(RemediationOutcome.PARTIAL, 1);
        assertThat(stats.automatic()).isEqualTo(1);
        assertThat(stats.successRate()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void emptyLogHasZeroSuccessRate() {
        assertThat(remediations.stats().successRate()).isZero();
    }

    @Test
    void recordsSurviveRestart() {
        var stored = remediations.log(new RemediationRecord(null, null, "vm1", "f-9", "oom killer", "raised memory",
                RemediationOutcome.PARTIAL, Duration.ofMinutes(42), "needs follow-up", false));

        var reloaded = new RemediationLog(InsightsProps.defaults(), new StateFiles(dir), clock);
        reloaded.load();

        assertThat(reloaded.getForResource("vm1", 5)).containsExactly(stored);
    }
}
