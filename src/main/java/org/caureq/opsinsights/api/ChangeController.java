package org.caureq.opsinsights.api;

import lombok.RequiredArgsConstructor;
import org.caureq.opsinsights.domain.model.Change;
import org.caureq.opsinsights.service.memory.ChangeDetector;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/changes")
@RequiredArgsConstructor
public class ChangeController {
    private final ChangeDetector detector;

    /** Newest first. */
    @GetMapping
    public List<Change> list(@RequestParam(value = "resource", required = false) String resource,
                             @RequestParam(value = "since", required = false) Instant since,
                             @RequestParam(value = "limit", required = false) Integer limit) {
        int lim = Math.max(1, Math.min(limit == null ? 50 : limit, 1000));
        if (resource != null && !resource.isBlank()) return detector.getForResource(resource, lim);
        return detector.getRecent(lim, since);
    }
}
