package org.caureq.opsinsights.service.source;

import lombok.RequiredArgsConstructor;
import org.caureq.opsinsights.domain.model.Finding;
import org.caureq.opsinsights.repo.AlertRepo;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/** Past findings are the alerts fired for the resource. */
@Service
@RequiredArgsConstructor
public class AlertFindingsSource implements FindingsSource {
    private final AlertRepo alertRepo;

    @Override
    @Transactional(readOnly = true)
    public List<Finding> findingsFor(String resourceId, int limit) {
        var page = PageRequest.of(0, Math.max(1, limit), Sort.by(Sort.Direction.DESC, "ts"));
        return alertRepo.findByResourceId(resourceId, page).stream()
                .map(r -> new Finding(r.getId(), r.getResourceId(), r.getType(), r.getLevel(),
                        r.getMessage(), r.getTs(), r.isAcknowledged()))
                .toList();
    }
}
