package org.caureq.opsinsights.service.source;

import lombok.RequiredArgsConstructor;
import org.caureq.opsinsights.domain.Asset;
import org.caureq.opsinsights.domain.model.ResourceSnapshot;
import org.caureq.opsinsights.repo.AssetRepo;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/** Inventory as last reported through ingest. Used when no Proxmox API is configured. */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "proxmox", name = "enabled", havingValue = "false", matchIfMissing = true)
public class AssetSnapshotProvider implements SnapshotProvider {
    private final AssetRepo assetRepo;

    @Override
    @Transactional(readOnly = true)
    public List<ResourceSnapshot> currentSnapshot() {
        return assetRepo.findAll().stream().map(AssetSnapshotProvider::toSnapshot).toList();
    }

    static ResourceSnapshot toSnapshot(Asset a) {
        return new ResourceSnapshot(a.getResourceId(), a.getName(), a.getType(), a.getNode(),
                a.getStatus(), a.getCpus(), a.getMemoryBytes());
    }
}
