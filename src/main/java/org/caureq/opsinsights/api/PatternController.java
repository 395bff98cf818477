package org.caureq.opsinsights.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.opsinsights.api.dto.PatternEventDTO;
import org.caureq.opsinsights.domain.model.EventKind;
import org.caureq.opsinsights.domain.model.EventSource;
import org.caureq.opsinsights.domain.model.Pattern;
import org.caureq.opsinsights.domain.model.Prediction;
import org.caureq.opsinsights.service.ResourceNotFoundException;
import org.caureq.opsinsights.service.patterns.PatternDetector;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/patterns")
@RequiredArgsConstructor
public class PatternController {
    private final PatternDetector detector;

    @GetMapping
    public List<Pattern> patterns() {
        return detector.getPatterns();
    }

    @GetMapping("/predictions")
    public List<Prediction> predictions(@RequestParam(value = "resource", required = false) String resource) {
        return resource == null || resource.isBlank()
                ? detector.getPredictions()
                : detector.getPredictionsForResource(resource);
    }

    @GetMapping("/predict")
    public Prediction predict(@RequestParam("resource") String resource, @RequestParam("kind") String kind) {
        var k = EventKind.fromId(kind);
        return detector.predict(resource, k)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "no recurring %s pattern for %s".formatted(k.id(), resource)));
    }

    @PostMapping("/events")
    public ResponseEntity<Map<String, Object>> record(@Valid @RequestBody PatternEventDTO body) {
        boolean counted = detector.recordEvent(body.resourceId().trim(), body.kind(), body.timestamp(), EventSource.ALERT);
        return ResponseEntity.accepted().body(Map.of("recorded", counted));
    }
}
