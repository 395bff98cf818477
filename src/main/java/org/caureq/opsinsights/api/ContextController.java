package org.caureq.opsinsights.api;

import lombok.RequiredArgsConstructor;
import org.caureq.opsinsights.service.context.ContextAssembler;
import org.caureq.opsinsights.service.context.ContextFormatter;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Assembled context for assistants and reports. JSON by default; {@code format=text} renders the
 * bounded text form, {@code format=compact} (infrastructure only) a one-line summary.
 */
@RestController
@RequestMapping("/api/context")
@RequiredArgsConstructor
public class ContextController {
    private final ContextAssembler assembler;
    private final ContextFormatter formatter;

    @GetMapping("/resource")
    public ResponseEntity<?> resource(@RequestParam("resource") String resource,
                                      @RequestParam(value = "format", required = false) String format) {
        var ctx = assembler.buildForResource(resource);
        if ("text".equalsIgnoreCase(format)) {
            return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(formatter.format(ctx));
        }
        return ResponseEntity.ok(ctx);
    }

    @GetMapping("/infrastructure")
    public ResponseEntity<?> infrastructure(@RequestParam(value = "format", required = false) String format) {
        var ctx = assembler.buildForInfrastructure();
        if ("text".equalsIgnoreCase(format)) {
            return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(formatter.format(ctx));
        }
        if ("compact".equalsIgnoreCase(format)) {
            return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(formatter.formatCompact(ctx));
        }
        return ResponseEntity.ok(ctx);
    }
}
