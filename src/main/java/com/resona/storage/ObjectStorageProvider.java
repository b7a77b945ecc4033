package com.resona.storage;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Durable object store backing the remote cache tier.
 * Implementations translate backend outages into
 * {@link com.resona.exception.TransientDependencyException}; a missing object is not an error.
 */
public interface ObjectStorageProvider {

    /**
     * Get backend name (e.g., "s3", "redis").
     *
     * @return backend name
     */
    String getName();

    /**
     * Fetch an object with its last-modified time.
     *
     * @param key cache key
     * @return stored object, empty when not found
     */
    Optional<StoredObject> get(String key);

    /**
     * Store an object, replacing any previous version.
     *
     * @param key      cache key
     * @param payload  object bytes
     * @param metadata user metadata stored with the object
     */
    void put(String key, byte[] payload, Map<String, String> metadata);

    /**
     * Fetch only the last-modified time of an object.
     *
     * @param key cache key
     * @return last-modified time, empty when not found
     */
    Optional<Instant> headMetadata(String key);

    void delete(String key);

    /**
     * Cheap reachability check used by the health monitor.
     * Throws when the backend is not reachable.
     */
    void ping();
}
