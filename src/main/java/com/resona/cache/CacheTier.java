package com.resona.cache;

/**
 * Storage tiers, declared fastest first. Lookup order follows declaration order.
 */
public enum CacheTier {
    MEMORY,
    DISK,
    REMOTE;

    public String label() {
        return name().toLowerCase();
    }
}
