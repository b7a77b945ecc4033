package com.resona.cache.tier;

import com.resona.cache.CacheEntry;
import com.resona.cache.CacheKey;
import com.resona.cache.CacheTier;
import com.resona.cache.ExpiryPolicy;
import com.resona.cache.eviction.LruIndex;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process tier: bounded map with strict LRU eviction.
 */
@Slf4j
public class MemoryTierStore implements BoundedTierStore {

    private final LruIndex<CacheKey, CacheEntry> index;
    private final ExpiryPolicy expiryPolicy;
    private final ReentrantLock lock = new ReentrantLock();

    public MemoryTierStore(int capacity, ExpiryPolicy expiryPolicy) {
        this.index = new LruIndex<>(capacity);
        this.expiryPolicy = expiryPolicy;
    }

    @Override
    public CacheTier tier() {
        return CacheTier.MEMORY;
    }

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        lock.lock();
        try {
            CacheEntry entry = index.peek(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (expiryPolicy.isExpired(entry.getCreatedAt())) {
                index.remove(key);
                log.debug("Memory entry expired: {}", key);
                return Optional.empty();
            }
            index.get(key);
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(CacheKey key, byte[] payload, Instant createdAt) {
        CacheEntry entry = new CacheEntry(key, payload, createdAt, CacheTier.MEMORY);
        List<LruIndex.Evicted<CacheKey, CacheEntry>> evicted;
        lock.lock();
        try {
            evicted = index.put(key, entry);
        } finally {
            lock.unlock();
        }
        evicted.forEach(e -> log.debug("Memory entry evicted (LRU): {}", e.key()));
        log.debug("Stored in memory tier: key={}, size={}B", key, entry.getSizeBytes());
    }

    @Override
    public boolean exists(CacheKey key) {
        lock.lock();
        try {
            CacheEntry entry = index.peek(key);
            return entry != null && !expiryPolicy.isExpired(entry.getCreatedAt());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(CacheKey key) {
        lock.lock();
        try {
            index.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int removeExpired() {
        List<CacheKey> keys;
        lock.lock();
        try {
            keys = index.keysFromEldest();
        } finally {
            lock.unlock();
        }

        int removed = 0;
        for (CacheKey key : keys) {
            lock.lock();
            try {
                CacheEntry entry = index.peek(key);
                if (entry != null && expiryPolicy.isExpired(entry.getCreatedAt())) {
                    index.remove(key);
                    removed++;
                }
            } finally {
                lock.unlock();
            }
        }
        return removed;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return index.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return index.capacity();
    }
}
