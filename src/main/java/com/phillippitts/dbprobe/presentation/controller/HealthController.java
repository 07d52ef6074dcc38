package com.phillippitts.dbprobe.presentation.controller;

import com.phillippitts.dbprobe.domain.RequestContext;
import com.phillippitts.dbprobe.service.health.DatabaseHealthProbe;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe. Always answers 200 with a plain-text body, {@code OK} or {@code BAD},
 * whatever the caller's {@code Accept} header asks for.
 */
@RestController
class HealthController {

    private final DatabaseHealthProbe probe;

    HealthController(DatabaseHealthProbe probe) {
        this.probe = probe;
    }

    @GetMapping("/health")
    ResponseEntity<String> health(RequestContext context) {
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(probe.check(context).body());
    }
}
