package org.caureq.opsinsights.service.alerts;

import org.caureq.opsinsights.TestClock;
import org.caureq.opsinsights.domain.AlertRecord;
import org.caureq.opsinsights.domain.model.EventKind;
import org.caureq.opsinsights.domain.model.EventSource;
import org.caureq.opsinsights.repo.AlertRepo;
import org.caureq.opsinsights.service.patterns.PatternDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertRegistryTest {
    private static final Instant NOW = Instant.parse("2026-03-08T00:00:00Z");

    @Mock
    AlertRepo repo;
    @Mock
    PatternDetector patterns;

    private AlertRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new AlertRegistry(repo, patterns, new TestClock(NOW));
    }

    @Test
    void firedAlertIsStoredAndRecordedAsEvent() {
        when(repo.save(any(AlertRecord.class))).thenAnswer(inv -> {
            AlertRecord r = inv.getArgument(0);
            r.setId("a-1");
            return r;
        });
        when(patterns.recordEvent("qemu/101", EventKind.HIGH_MEMORY, NOW, EventSource.ALERT)).thenReturn(true);

        var alert = registry.fired("qemu/101", "memory_high", "warning", null, null);

        assertThat(alert.getId()).isEqualTo("a-1");
        assertThat(alert.getTs()).isEqualTo(NOW);
        assertThat(alert.getMessage()).isEqualTo("memory_high");
        assertThat(alert.isAcknowledged()).isFalse();
    }

    @Test
    void unknownAlertTypeIsRecordedAsOther() {
        var at = NOW.minusSeconds(60);
        when(repo.save(any(AlertRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        registry.fired("qemu/101", "certificate_expiry", "critical", "cert expires soon", at);

        verify(patterns).recordEvent("qemu/101", EventKind.OTHER, at, EventSource.ALERT);
    }

    @Test
    void ackIsIdempotent() {
        var rec = AlertRecord.builder().id("a-1").resourceId("qemu/101").type("cpu").message("m")
                .ts(NOW).acknowledged(true).build();
        when(repo.findById("a-1")).thenReturn(Optional.of(rec));
        when(repo.findById("missing")).thenReturn(Optional.empty());

        assertThat(registry.ack("a-1")).isEqualTo(1);
        assertThat(registry.ack("missing")).isZero();
        verify(repo, never()).save(any());
    }
}
