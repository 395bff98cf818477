package org.caureq.opsinsights.domain;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;

/** One collected sample: a single metric value of one resource at one instant. */
@Entity
@Table(name = "metric_samples", indexes = {
        @Index(name = "idx_sample_resource_metric_ts", columnList = "resource_id, metric, ts"),
        @Index(name = "idx_sample_ts", columnList = "ts")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Metric {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_id", nullable = false, length = 128)
    private String resourceId;

    @Column(nullable = false, length = 32)
    private String metric;   // cpu, memory, disk (percent)

    @Column(name = "sample_value", nullable = false)
    private double value;

    @Column(nullable = false)
    private Instant ts;
}
