package com.resona.storage;

import com.resona.exception.TransientDependencyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Redis-based object storage with compression.
 * Key patterns: audio:object:{key} (GZIP payload), audio:modified:{key} (epoch millis).
 * Both keys expire with the cache TTL.
 */
@Slf4j
public class RedisObjectStorageProvider implements ObjectStorageProvider {

    static final String DEPENDENCY = "redis-cache";
    private static final String OBJECT_PREFIX = "audio:object:";
    private static final String MODIFIED_PREFIX = "audio:modified:";

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final Duration ttl;

    public RedisObjectStorageProvider(RedisTemplate<String, byte[]> redisTemplate, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    @Override
    public String getName() {
        return "redis";
    }

    @Override
    public Optional<StoredObject> get(String key) {
        try {
            List<byte[]> values = redisTemplate.opsForValue().multiGet(List.of(OBJECT_PREFIX + key, MODIFIED_PREFIX + key));
            if (values == null || values.get(0) == null || values.get(1) == null) {
                log.debug("Redis cache miss: {}", key);
                return Optional.empty();
            }
            byte[] payload = decompress(values.get(0));
            return Optional.of(new StoredObject(payload, parseInstant(values.get(1))));
        } catch (DataAccessException e) {
            throw new TransientDependencyException(DEPENDENCY, "get " + key + " failed: " + e.getMessage(), e);
        } catch (IOException | NumberFormatException e) {
            log.warn("Unreadable Redis cache entry {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, byte[] payload, Map<String, String> metadata) {
        try {
            byte[] compressed = compress(payload);
            byte[] modified = String.valueOf(Instant.now().toEpochMilli()).getBytes(StandardCharsets.UTF_8);
            redisTemplate.opsForValue().set(OBJECT_PREFIX + key, compressed, ttl);
            redisTemplate.opsForValue().set(MODIFIED_PREFIX + key, modified, ttl);
            log.debug("Stored in Redis cache: key={}, ttl={}, size={}KB", key, ttl, compressed.length / 1024);
        } catch (DataAccessException e) {
            throw new TransientDependencyException(DEPENDENCY, "put " + key + " failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to compress payload for " + key, e);
        }
    }

    @Override
    public Optional<Instant> headMetadata(String key) {
        try {
            byte[] modified = redisTemplate.opsForValue().get(MODIFIED_PREFIX + key);
            if (modified == null) {
                return Optional.empty();
            }
            return Optional.of(parseInstant(modified));
        } catch (DataAccessException e) {
            throw new TransientDependencyException(DEPENDENCY, "head " + key + " failed: " + e.getMessage(), e);
        } catch (NumberFormatException e) {
            log.warn("Unreadable Redis modification time for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(List.of(OBJECT_PREFIX + key, MODIFIED_PREFIX + key));
            log.debug("Deleted from Redis cache: {}", key);
        } catch (DataAccessException e) {
            throw new TransientDependencyException(DEPENDENCY, "delete " + key + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void ping() {
        try {
            String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            if (!"PONG".equalsIgnoreCase(reply)) {
                throw new TransientDependencyException(DEPENDENCY, "unexpected PING reply: " + reply);
            }
        } catch (DataAccessException e) {
            throw new TransientDependencyException(DEPENDENCY, "PING failed: " + e.getMessage(), e);
        }
    }

    private static Instant parseInstant(byte[] value) {
        return Instant.ofEpochMilli(Long.parseLong(new String(value, StandardCharsets.UTF_8).trim()));
    }

    private static byte[] compress(byte[] payload) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
            gzipOut.write(payload);
            gzipOut.finish();
            return baos.toByteArray();
        }
    }

    private static byte[] decompress(byte[] compressed) throws IOException {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return gzipIn.readAllBytes();
        }
    }
}
