package org.caureq.opsinsights.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsinsights.domain.model.ResourceSnapshot;
import org.caureq.opsinsights.service.ProxmoxClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/** Inventory read live from the Proxmox cluster. */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "proxmox", name = "enabled", havingValue = "true")
public class ProxmoxSnapshotProvider implements SnapshotProvider {
    private final ProxmoxClient proxmox;

    @Override
    public List<ResourceSnapshot> currentSnapshot() {
        JsonNode data = proxmox.clusterVms();
        var out = new ArrayList<ResourceSnapshot>();
        if (data == null || !data.isArray()) return out;
        for (var it : data) {
            var id = it.path("id").asText("");   // qemu/101, lxc/204
            if (id.isBlank()) continue;
            Integer cpus = it.hasNonNull("maxcpu") ? it.get("maxcpu").asInt() : null;
            Long mem = it.hasNonNull("maxmem") ? it.get("maxmem").asLong() : null;
            out.add(new ResourceSnapshot(
                    id,
                    it.path("name").asText(null),
                    it.path("type").asText(null),
                    it.path("node").asText(null),
                    it.path("status").asText(null),
                    cpus, mem));
        }
        log.debug("[Proxmox] snapshot with {} guests", out.size());
        return out;
    }
}
