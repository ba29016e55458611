package com.phillippitts.truthtell.presentation.controller;

import com.phillippitts.truthtell.service.cache.ExpiringCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Manual trigger for the expiry sweep normally run by the scheduler.
 */
@RestController
class CacheController {

    private static final Logger LOG = LogManager.getLogger(CacheController.class);

    private final ExpiringCache cache;

    CacheController(ExpiringCache cache) {
        this.cache = cache;
    }

    @PostMapping("/api/clear-cache")
    ResponseEntity<Map<String, Object>> clearCache() {
        int removed = cache.sweep();
        LOG.info("Manual cache sweep removed {} expired entries", removed);
        return ResponseEntity.ok(Map.of(
                "message", "Cache cleared successfully",
                "removed", removed
        ));
    }
}
