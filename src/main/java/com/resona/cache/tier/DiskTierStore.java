package com.resona.cache.tier;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resona.cache.CacheEntry;
import com.resona.cache.CacheKey;
import com.resona.cache.CacheTier;
import com.resona.cache.ExpiryPolicy;
import com.resona.cache.eviction.LruIndex;
import com.resona.exception.CacheConfigurationException;
import com.resona.exception.CorruptEntryException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Local persistent tier.
 *
 * Layout under the cache directory, per key:
 * - {@code <key>.audio}: payload bytes
 * - {@code <key>.meta}: JSON {@code {"timestamp": epochMillis, "sizeBytes": n, "key": "<key>"}}
 *
 * Both records must be present for a hit. The recency index lives in memory and is rebuilt
 * from the metadata records by {@link #initialize()}; payloads are never read at startup.
 * Writes (put, remove, eviction) are serialized by a single lock; payload reads are not.
 */
@Slf4j
public class DiskTierStore implements BoundedTierStore {

    static final String PAYLOAD_SUFFIX = ".audio";
    static final String METADATA_SUFFIX = ".meta";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final LruIndex<CacheKey, DiskRecord> index;
    private final ExpiryPolicy expiryPolicy;
    private final ObjectMapper objectMapper;
    private final ReentrantLock writeLock = new ReentrantLock();

    public DiskTierStore(Path directory, int capacity, ExpiryPolicy expiryPolicy, ObjectMapper objectMapper) {
        this.directory = directory;
        this.index = new LruIndex<>(capacity);
        this.expiryPolicy = expiryPolicy;
        this.objectMapper = objectMapper;
    }

    /**
     * Create the cache directory and rebuild the index from persisted metadata.
     * Oldest entries become least recently used. Corrupt or orphaned records are deleted.
     *
     * @return number of entries indexed
     */
    public int initialize() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CacheConfigurationException("Cannot create disk cache directory " + directory
                    + ": " + e.getMessage());
        }

        List<DiskRecord> records = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + METADATA_SUFFIX)) {
            for (Path metaPath : stream) {
                String fileName = metaPath.getFileName().toString();
                CacheKey key = CacheKey.parse(fileName.substring(0, fileName.length() - METADATA_SUFFIX.length()));
                if (key == null) {
                    log.warn("Ignoring foreign file in disk cache: {}", metaPath);
                    continue;
                }
                try {
                    DiskRecord record = readMetadata(key);
                    if (!Files.exists(payloadPath(key))) {
                        throw new CorruptEntryException("Payload record missing for " + key, null);
                    }
                    records.add(record);
                } catch (CorruptEntryException e) {
                    log.warn("Dropping corrupt disk cache entry {}: {}", key, e.getMessage());
                    deleteFiles(key);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan disk cache directory " + directory, e);
        }

        records.sort(Comparator.comparing(DiskRecord::createdAt));

        writeLock.lock();
        try {
            index.clear();
            for (DiskRecord record : records) {
                index.put(record.key(), record).forEach(evicted -> deleteFiles(evicted.key()));
            }
            removeOrphanFiles();
            log.info("Loaded {} disk cache entries from {}", index.size(), directory);
            return index.size();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public CacheTier tier() {
        return CacheTier.DISK;
    }

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        DiskRecord record;
        writeLock.lock();
        try {
            record = index.peek(key);
        } finally {
            writeLock.unlock();
        }
        if (record == null) {
            return Optional.empty();
        }
        if (expiryPolicy.isExpired(record.createdAt())) {
            log.debug("Disk entry expired: {}", key);
            remove(key);
            return Optional.empty();
        }

        byte[] payload;
        try {
            if (!Files.exists(metadataPath(key))) {
                throw new NoSuchFileException(metadataPath(key).toString());
            }
            payload = Files.readAllBytes(payloadPath(key));
            if (payload.length != record.sizeBytes()) {
                throw new CorruptEntryException("Payload size " + payload.length
                        + " does not match metadata size " + record.sizeBytes(), null);
            }
        } catch (NoSuchFileException e) {
            log.debug("Disk record vanished for {}, treating as miss", key);
            dropIfUnchanged(key, record);
            return Optional.empty();
        } catch (IOException | CorruptEntryException e) {
            log.warn("Unreadable disk cache entry {}, dropping: {}", key, e.getMessage());
            dropIfUnchanged(key, record);
            return Optional.empty();
        }

        writeLock.lock();
        try {
            if (index.peek(key) == record) {
                index.get(key);
            }
        } finally {
            writeLock.unlock();
        }
        return Optional.of(new CacheEntry(key, payload, record.createdAt(), CacheTier.DISK));
    }

    @Override
    public void put(CacheKey key, byte[] payload, Instant createdAt) {
        DiskRecord record = new DiskRecord(key, createdAt, payload.length);
        writeLock.lock();
        try {
            writeAtomically(payloadPath(key), payload);
            writeAtomically(metadataPath(key), objectMapper.writeValueAsBytes(DiskMetadata.of(record)));
            for (LruIndex.Evicted<CacheKey, DiskRecord> evicted : index.put(key, record)) {
                deleteFiles(evicted.key());
                log.debug("Disk entry evicted (LRU): {}", evicted.key());
            }
            log.debug("Stored in disk tier: key={}, size={}B", key, payload.length);
        } catch (IOException e) {
            index.remove(key);
            deleteFiles(key);
            throw new UncheckedIOException("Failed to write disk cache entry " + key, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean exists(CacheKey key) {
        DiskRecord record;
        writeLock.lock();
        try {
            record = index.peek(key);
        } finally {
            writeLock.unlock();
        }
        return record != null
                && !expiryPolicy.isExpired(record.createdAt())
                && Files.exists(payloadPath(key))
                && Files.exists(metadataPath(key));
    }

    @Override
    public void remove(CacheKey key) {
        writeLock.lock();
        try {
            index.remove(key);
            deleteFiles(key);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int removeExpired() {
        List<CacheKey> keys;
        writeLock.lock();
        try {
            keys = index.keysFromEldest();
        } finally {
            writeLock.unlock();
        }

        int removed = 0;
        for (CacheKey key : keys) {
            writeLock.lock();
            try {
                DiskRecord record = index.peek(key);
                if (record != null && expiryPolicy.isExpired(record.createdAt())) {
                    index.remove(key);
                    deleteFiles(key);
                    removed++;
                }
            } finally {
                writeLock.unlock();
            }
        }
        return removed;
    }

    @Override
    public int size() {
        writeLock.lock();
        try {
            return index.size();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int capacity() {
        return index.capacity();
    }

    Path payloadPath(CacheKey key) {
        return directory.resolve(key.value() + PAYLOAD_SUFFIX);
    }

    Path metadataPath(CacheKey key) {
        return directory.resolve(key.value() + METADATA_SUFFIX);
    }

    private DiskRecord readMetadata(CacheKey key) {
        try {
            DiskMetadata meta = objectMapper.readValue(metadataPath(key).toFile(), DiskMetadata.class);
            if (meta.key() == null || !meta.key().equals(key.value())) {
                throw new CorruptEntryException("Metadata key " + meta.key() + " does not match file name", null);
            }
            if (meta.sizeBytes() < 0 || meta.timestamp() <= 0) {
                throw new CorruptEntryException("Invalid metadata values " + meta, null);
            }
            return new DiskRecord(key, Instant.ofEpochMilli(meta.timestamp()), meta.sizeBytes());
        } catch (IOException e) {
            throw new CorruptEntryException("Unreadable metadata: " + e.getMessage(), e);
        }
    }

    private void dropIfUnchanged(CacheKey key, DiskRecord record) {
        writeLock.lock();
        try {
            if (index.peek(key) == record) {
                index.remove(key);
                deleteFiles(key);
            }
        } finally {
            writeLock.unlock();
        }
    }

    private void removeOrphanFiles() {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path path : stream) {
                String fileName = path.getFileName().toString();
                if (fileName.endsWith(TEMP_SUFFIX)) {
                    Files.deleteIfExists(path);
                } else if (fileName.endsWith(PAYLOAD_SUFFIX)) {
                    CacheKey key = CacheKey.parse(fileName.substring(0, fileName.length() - PAYLOAD_SUFFIX.length()));
                    if (key != null && !index.contains(key)) {
                        Files.deleteIfExists(path);
                        log.debug("Removed orphan payload record {}", path);
                    }
                }
            }
        } catch (IOException e) {
            log.warn("Failed to clean orphan files in {}", directory, e);
        }
    }

    private void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        Files.write(temp, bytes);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private void deleteFiles(CacheKey key) {
        try {
            Files.deleteIfExists(payloadPath(key));
            Files.deleteIfExists(metadataPath(key));
        } catch (IOException e) {
            log.warn("Failed to delete disk cache files for {}", key, e);
        }
    }

    /**
     * Index value: what the metadata record says about an entry.
     */
    record DiskRecord(CacheKey key, Instant createdAt, int sizeBytes) {
    }

    /**
     * Persisted metadata record.
     */
    record DiskMetadata(
            @JsonProperty("timestamp") long timestamp,
            @JsonProperty("sizeBytes") int sizeBytes,
            @JsonProperty("key") String key) {

        static DiskMetadata of(DiskRecord record) {
            return new DiskMetadata(record.createdAt().toEpochMilli(), record.sizeBytes(), record.key().value());
        }
    }
}
