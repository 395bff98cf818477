package org.caureq.opsinsights.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.api.dto.IngestDTO;
import org.caureq.opsinsights.domain.Asset;
import org.caureq.opsinsights.domain.Metric;
import org.caureq.opsinsights.repo.AssetRepo;
import org.caureq.opsinsights.repo.MetricRepo;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class IngestService {
    private final AssetRepo assetRepo;
    private final MetricRepo metricRepo;
    private final Clock clock;

    /** Upserts the asset and stores one sample per finite metric value. Returns the number stored. */
    @Transactional
    public int ingest(IngestDTO d) {
        var resourceId = d.resourceId().trim();
        var ts = d.ts() == null ? clock.instant() : d.ts();

        var asset = assetRepo.findByResourceId(resourceId)
                .orElseGet(() -> {
                    var a = new Asset();
                    a.setResourceId(resourceId);
                    return a;
                });
        // absent fields keep the last reported value
        if (d.name() != null && !d.name().isBlank()) asset.setName(d.name().trim());
        if (d.type() != null && !d.type().isBlank()) asset.setType(d.type().trim());
        if (d.node() != null && !d.node().isBlank()) asset.setNode(d.node().trim());
        if (d.status() != null && !d.status().isBlank()) asset.setStatus(d.status().trim().toLowerCase(Locale.ROOT));
        if (d.cpus() != null) asset.setCpus(d.cpus());
        if (d.memoryBytes() != null) asset.setMemoryBytes(d.memoryBytes());
        asset.setLastSeen(clock.instant());
        assetRepo.save(asset);

        var rows = new ArrayList<Metric>();
        d.metrics().forEach((metric, value) -> {
            if (value == null || !Double.isFinite(value)) return;
            rows.add(Metric.builder()
                    .resourceId(resourceId)
                    .metric(metric.trim().toLowerCase(Locale.ROOT))
                    .value(value)
                    .ts(ts)
                    .build());
        });
        metricRepo.saveAll(rows);
        log.debug("ingested {} samples for {}", rows.size(), resourceId);
        return rows.size();
    }

    @Transactional
    public Asset updateNotes(String resourceId, String notes) {
        var asset = assetRepo.findByResourceId(resourceId)
                .orElseThrow(() -> new ResourceNotFoundException("unknown resource: " + resourceId));
        asset.setNotes(notes == null || notes.isBlank() ? null : notes.strip());
        return assetRepo.save(asset);
    }
}
