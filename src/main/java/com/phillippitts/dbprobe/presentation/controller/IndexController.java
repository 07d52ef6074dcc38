package com.phillippitts.dbprobe.presentation.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Landing route. Does not touch the database.
 */
@RestController
class IndexController {

    private static final Logger log = LogManager.getLogger(IndexController.class);

    @GetMapping("/")
    ResponseEntity<Map<String, Object>> index() {
        log.info("Index requested");
        return ResponseEntity.ok(Map.of(
                "service", "dbprobe",
                "timestamp", Instant.now().toString()
        ));
    }
}
