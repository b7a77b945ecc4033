package com.resona.cache.tier;

/**
 * A local tier with a capacity bound and LRU eviction, swept for expired entries.
 */
public interface BoundedTierStore extends TierStore {

    /**
     * Remove every expired entry.
     *
     * @return number of entries removed
     */
    int removeExpired();

    int size();

    int capacity();
}
