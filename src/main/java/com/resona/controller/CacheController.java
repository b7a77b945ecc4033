package com.resona.controller;

import com.resona.cache.CacheKey;
import com.resona.cache.CacheStats;
import com.resona.service.AudioSynthesisService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Cache management controller.
 * Provides statistics and invalidation across memory, disk and remote tiers.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final AudioSynthesisService synthesisService;

    public CacheController(AudioSynthesisService synthesisService) {
        this.synthesisService = synthesisService;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<CacheStats> getStats() {
        return ResponseEntity.ok(synthesisService.getStats());
    }

    /**
     * Invalidate one entry in every tier and at the edge.
     */
    @DeleteMapping("/{key}")
    public ResponseEntity<Map<String, String>> invalidate(@PathVariable String key) {
        CacheKey cacheKey = CacheKey.parse(key);
        if (cacheKey == null) {
            return ResponseEntity.badRequest().body(Map.of(
                    "status", "error",
                    "message", "Invalid cache key: " + key
            ));
        }

        log.info("Cache invalidation requested for {}", cacheKey);
        synthesisService.invalidate(cacheKey);

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Cache entry invalidated",
                "key", cacheKey.value()
        ));
    }
}
