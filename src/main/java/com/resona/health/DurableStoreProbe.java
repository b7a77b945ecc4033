package com.resona.health;

import com.resona.storage.ObjectStorageProvider;

import java.time.Duration;

/**
 * Durable store health: a backend ping (S3 HeadBucket, Redis PING).
 */
public class DurableStoreProbe implements HealthProbe {

    private final ObjectStorageProvider provider;

    public DurableStoreProbe(ObjectStorageProvider provider) {
        this.provider = provider;
    }

    @Override
    public String name() {
        return provider.getName().equals("s3") ? "S3" : "Redis";
    }

    @Override
    public DependencyType type() {
        return DependencyType.DURABLE_STORE;
    }

    @Override
    public ProbeResult probe() {
        long start = System.nanoTime();
        provider.ping();
        return ProbeResult.success(Duration.ofNanos(System.nanoTime() - start));
    }
}
