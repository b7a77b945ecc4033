package com.resona.cache;

/**
 * Which tier satisfied a request, or {@link #GENERATED} when the payload was freshly synthesized.
 */
public enum CacheSource {
    MEMORY,
    DISK,
    REMOTE,
    GENERATED;

    public static CacheSource of(CacheTier tier) {
        return switch (tier) {
            case MEMORY -> MEMORY;
            case DISK -> DISK;
            case REMOTE -> REMOTE;
        };
    }

    public boolean fromCache() {
        return this != GENERATED;
    }

    public String label() {
        return name().toLowerCase();
    }
}
