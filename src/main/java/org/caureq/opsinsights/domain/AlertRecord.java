package org.caureq.opsinsights.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/** An alert fired by the external alerting engine; doubles as a past finding for context. */
@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alert_ts", columnList = "ts DESC"),
        @Index(name = "idx_alert_resource_ts", columnList = "resource_id, ts DESC")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AlertRecord {
    @Id
    @Column(length = 36)
    private String id; // UUID string

    @Column(name = "resource_id", nullable = false, length = 128)
    private String resourceId;

    @Column(nullable = false, length = 64)
    private String type; // cpu, memory, disk, oom, backup, ...

    @Column(length = 16)
    private String level; // warning, critical

    @Column(nullable = false, length = 512)
    private String message;

    @Column(nullable = false)
    private Instant ts;

    @Column(nullable = false)
    private boolean acknowledged;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (ts == null) ts = Instant.now();
    }
}
