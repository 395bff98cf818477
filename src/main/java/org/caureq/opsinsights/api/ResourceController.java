package org.caureq.opsinsights.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.opsinsights.api.dto.NotesDTO;
import org.caureq.opsinsights.service.IngestService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/resources")
@RequiredArgsConstructor
public class ResourceController {
    private final IngestService ingestService;

    @PutMapping("/notes")
    public ResponseEntity<Void> updateNotes(@RequestParam("resource") String resource,
                                            @RequestBody @Valid NotesDTO body) {
        ingestService.updateNotes(resource, body.notes());
        return ResponseEntity.noContent().build();
    }
}
