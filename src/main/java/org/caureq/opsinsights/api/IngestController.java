package org.caureq.opsinsights.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.opsinsights.api.dto.IngestDTO;
import org.caureq.opsinsights.service.IngestService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/** Collector reports. Stored samples feed trends, baselines and forecasts on their next refresh. */
@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
public class IngestController {
    private final IngestService ingestService;

    public record IngestResult(String resourceId, int stored, int skipped) {}

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public IngestResult ingest(@Valid @RequestBody IngestDTO body) {
        int stored = ingestService.ingest(body);
        return new IngestResult(body.resourceId().trim(), stored, body.metrics().size() - stored);
    }
}
