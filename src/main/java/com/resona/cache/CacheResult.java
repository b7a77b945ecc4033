package com.resona.cache;

/**
 * Outcome of {@link TieredCacheManager#getOrCreate}: the payload and where it came from.
 */
public record CacheResult(CacheKey key, byte[] payload, CacheSource source) {
}
