package com.resona.cache.tier;

import com.resona.cache.CacheEntry;
import com.resona.cache.CacheKey;
import com.resona.cache.CacheTier;
import com.resona.cache.ExpiryPolicy;
import com.resona.storage.ObjectStorageProvider;
import com.resona.storage.StoredObject;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Durable tier over an {@link ObjectStorageProvider}.
 *
 * Unbounded here; the backend's own lifecycle rules bound it. Expired objects are reported as
 * misses but never deleted by this tier. Backend outages propagate as
 * {@link com.resona.exception.TransientDependencyException}.
 */
@Slf4j
public class RemoteTierStore implements TierStore {

    private final ObjectStorageProvider provider;
    private final ExpiryPolicy expiryPolicy;

    public RemoteTierStore(ObjectStorageProvider provider, ExpiryPolicy expiryPolicy) {
        this.provider = provider;
        this.expiryPolicy = expiryPolicy;
    }

    @Override
    public CacheTier tier() {
        return CacheTier.REMOTE;
    }

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        Optional<Instant> lastModified = provider.headMetadata(key.value());
        if (lastModified.isEmpty()) {
            return Optional.empty();
        }
        if (expiryPolicy.isExpired(lastModified.get())) {
            log.debug("Remote entry expired (age {}): {}", expiryPolicy.age(lastModified.get()), key);
            return Optional.empty();
        }

        Optional<StoredObject> stored = provider.get(key.value());
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        Instant createdAt = stored.get().lastModified() != null ? stored.get().lastModified() : lastModified.get();
        return Optional.of(new CacheEntry(key, stored.get().payload(), createdAt, CacheTier.REMOTE));
    }

    @Override
    public void put(CacheKey key, byte[] payload, Instant createdAt) {
        provider.put(key.value(), payload, Map.of(
                "cachedAt", createdAt.toString(),
                "cacheKey", key.value()));
        log.debug("Stored in remote tier ({}): key={}, size={}B", provider.getName(), key, payload.length);
    }

    @Override
    public boolean exists(CacheKey key) {
        return provider.headMetadata(key.value())
                .map(modified -> !expiryPolicy.isExpired(modified))
                .orElse(false);
    }

    @Override
    public void remove(CacheKey key) {
        provider.delete(key.value());
    }

    public String getBackendName() {
        return provider.getName();
    }
}
