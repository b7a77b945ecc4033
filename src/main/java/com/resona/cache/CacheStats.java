package com.resona.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time cache statistics. Counters are monotonic for the process lifetime.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    /**
     * Lookups received (synthesis and cache-only).
     */
    private long totalRequests;

    /**
     * Lookups that missed every tier.
     */
    private long misses;

    /**
     * Generator invocations.
     */
    private long generations;

    /**
     * Callers that awaited another caller's in-flight generation.
     */
    private long coalesced;

    /**
     * Generations that failed.
     */
    private long generationFailures;

    /**
     * Hit counters keyed by tier label.
     */
    private Map<String, Long> hitsByTier;

    /**
     * Per-tier occupancy, bounded tiers only.
     */
    private Map<String, TierOccupancy> occupancy;

    public long getTotalHits() {
        return hitsByTier == null ? 0 : hitsByTier.values().stream().mapToLong(Long::longValue).sum();
    }

    /**
     * Hit rate (0.0-1.0) of one tier over all requests.
     */
    public double hitRate(CacheTier tier) {
        if (totalRequests == 0 || hitsByTier == null) {
            return 0.0;
        }
        return hitsByTier.getOrDefault(tier.label(), 0L) / (double) totalRequests;
    }

    public Map<String, Double> getHitRates() {
        Map<String, Double> rates = new LinkedHashMap<>();
        for (CacheTier tier : CacheTier.values()) {
            rates.put(tier.label(), hitRate(tier));
        }
        return rates;
    }

    /**
     * Overall hit rate (0.0-1.0).
     */
    public double getHitRate() {
        return totalRequests == 0 ? 0.0 : getTotalHits() / (double) totalRequests;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierOccupancy {
        private int size;
        private int capacity;
    }
}
