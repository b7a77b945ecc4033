package com.resona.cache;

import java.time.Instant;
import java.util.Objects;

/**
 * A payload stored in one tier. Each tier owns its own copy; promotion copies, it never shares.
 */
public final class CacheEntry {

    private final CacheKey key;
    private final byte[] payload;
    private final Instant createdAt;
    private final CacheTier tier;

    public CacheEntry(CacheKey key, byte[] payload, Instant createdAt, CacheTier tier) {
        this.key = Objects.requireNonNull(key, "key");
        this.payload = Objects.requireNonNull(payload, "payload").clone();
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.tier = Objects.requireNonNull(tier, "tier");
    }

    public CacheKey getKey() {
        return key;
    }

    /**
     * @return a copy of the stored bytes
     */
    public byte[] getPayload() {
        return payload.clone();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public int getSizeBytes() {
        return payload.length;
    }

    public CacheTier getTier() {
        return tier;
    }

    @Override
    public String toString() {
        return "CacheEntry{key=" + key + ", tier=" + tier + ", sizeBytes=" + payload.length
                + ", createdAt=" + createdAt + "}";
    }
}
