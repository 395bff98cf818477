package org.caureq.opsinsights.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.opsinsights.api.dto.RemediationDTO;
import org.caureq.opsinsights.domain.model.RemediationRecord;
import org.caureq.opsinsights.service.memory.RemediationLog;
import org.caureq.opsinsights.service.memory.RemediationStats;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/remediations")
@RequiredArgsConstructor
public class RemediationController {
    private final RemediationLog remediationLog;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public RemediationRecord log(@Valid @RequestBody RemediationDTO body) {
        return remediationLog.log(body.toRecord());
    }

    @GetMapping
    public List<RemediationRecord> list(@RequestParam(value = "resource", required = false) String resource,
                                        @RequestParam(value = "limit", required = false) Integer limit) {
        int lim = clamp(limit, 20);
        if (resource != null && !resource.isBlank()) return remediationLog.getForResource(resource, lim);
        return remediationLog.recent(lim, null);
    }

    @GetMapping("/similar")
    public List<RemediationRecord> similar(@RequestParam("q") String q,
                                           @RequestParam(value = "limit", required = false) Integer limit) {
        return remediationLog.getSimilar(q, clamp(limit, 5));
    }

    @GetMapping("/stats")
    public RemediationStats stats() {
        return remediationLog.stats();
    }

    private static int clamp(Integer limit, int def) {
        return Math.max(1, Math.min(limit == null ? def : limit, 500));
    }
}
