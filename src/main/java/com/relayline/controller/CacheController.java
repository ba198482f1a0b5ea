package com.relayline.controller;

import com.relayline.cache.CacheStats;
import com.relayline.cache.ResponseCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Response cache statistics and management.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final ResponseCache responseCache;

    public CacheController(ResponseCache responseCache) {
        this.responseCache = responseCache;
    }

    @GetMapping("/stats")
    public ResponseEntity<CacheStats> getStats() {
        return ResponseEntity.ok(responseCache.stats());
    }

    @PostMapping("/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        responseCache.clear();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Response cache cleared"
        ));
    }
}
