package org.caureq.opsinsights.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.opsinsights.api.dto.AlertDTO;
import org.caureq.opsinsights.service.alerts.AlertRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Alert history feed: the alerting engine posts fired alerts; operators list and acknowledge them.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertsController {
    private final AlertRegistry registry;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AlertRegistry.Alert fired(@Valid @RequestBody AlertDTO body) {
        return registry.fired(body.resourceId().trim(), body.type().trim(), body.level(), body.message(), body.firedAt());
    }

    @GetMapping
    public List<AlertRegistry.Alert> list(
            @RequestParam(value = "resource", required = false) String resource,
            @RequestParam(value = "ack", required = false) Boolean ack,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset
    ) {
        int lim = (limit == null ? 50 : limit);
        int off = (offset == null ? 0 : offset);
        return registry.query(resource, ack, lim, off);
    }

    @PostMapping("/{id}/ack")
    public ResponseEntity<Map<String, Integer>> ack(@PathVariable String id) {
        int n = registry.ack(id);
        return ResponseEntity.ok(Map.of("acknowledged", n));
    }
}
