package com.resona.cache.tier;

import com.resona.cache.CacheEntry;
import com.resona.cache.CacheKey;
import com.resona.cache.CacheTier;

import java.time.Instant;
import java.util.Optional;

/**
 * Uniform contract of one cache tier.
 *
 * A miss and an expired entry both surface as {@link Optional#empty()}. Implementations
 * throw {@link com.resona.exception.TransientDependencyException} only when the backing
 * store itself cannot be reached.
 */
public interface TierStore {

    /**
     * @return which tier this store implements
     */
    CacheTier tier();

    /**
     * Fetch a live entry.
     *
     * @param key cache key
     * @return the entry, or empty on miss or expiry
     */
    Optional<CacheEntry> get(CacheKey key);

    /**
     * Store a payload, replacing any existing entry for the key.
     *
     * @param key       cache key
     * @param payload   audio bytes (copied by the tier)
     * @param createdAt creation time used for expiry; promotion passes the source entry's value
     */
    void put(CacheKey key, byte[] payload, Instant createdAt);

    /**
     * @return true if a live (unexpired) entry exists; never changes recency
     */
    boolean exists(CacheKey key);

    void remove(CacheKey key);
}
