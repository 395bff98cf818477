package org.caureq.opsinsights.domain;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;

/** A monitored resource as last reported by ingest, plus operator-authored notes. */
@Entity
@Table(name = "assets")
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class Asset {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_id", nullable = false, unique = true, length = 128)
    private String resourceId;   // ex: qemu/101, lxc/204, node/pve1

    @Column(length = 128)
    private String name;

    @Column(length = 32)
    private String type;   // vm, container, node, storage

    @Column(length = 64)
    private String node;   // proxmox node currently hosting the resource

    @Column(length = 32)
    private String status; // running, stopped, ...

    private Integer cpus;

    private Long memoryBytes;

    @Column(columnDefinition = "text")
    private String notes;  // one note per line

    private Instant lastSeen;
}
