package com.resona.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resona.cache.ExpiryPolicy;
import com.resona.cache.ExpirySweeper;
import com.resona.cache.TieredCacheManager;
import com.resona.cache.tier.DiskTierStore;
import com.resona.cache.tier.MemoryTierStore;
import com.resona.cache.tier.RemoteTierStore;
import com.resona.cache.tier.TierStore;
import com.resona.failover.DegradedModeFlags;
import com.resona.metrics.MetricsRecorder;
import com.resona.storage.ObjectStorageProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Tiered audio cache: memory, disk and (optionally) remote tiers sharing one TTL.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    private final ResonaProperties properties;

    public CacheConfiguration(ResonaProperties properties) {
        properties.validate();
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExpiryPolicy expiryPolicy(Clock clock) {
        return new ExpiryPolicy(properties.getCache().getTtl(), clock);
    }

    @Bean
    public MemoryTierStore memoryTierStore(ExpiryPolicy expiryPolicy) {
        return new MemoryTierStore(properties.getCache().getMemory().getCapacity(), expiryPolicy);
    }

    @Bean
    public DiskTierStore diskTierStore(ExpiryPolicy expiryPolicy, ObjectMapper objectMapper) {
        ResonaProperties.DiskConfig disk = properties.getCache().getDisk();
        DiskTierStore store = new DiskTierStore(Path.of(disk.getDirectory()), disk.getCapacity(),
                expiryPolicy, objectMapper);
        store.initialize();
        return store;
    }

    @Bean
    public ThreadPoolTaskExecutor audioCacheExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("audio-cache-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Bean
    public TieredCacheManager tieredCacheManager(
            MemoryTierStore memoryTierStore,
            DiskTierStore diskTierStore,
            ObjectProvider<ObjectStorageProvider> storageProvider,
            ExpiryPolicy expiryPolicy,
            DegradedModeFlags flags,
            MetricsRecorder metrics,
            @Qualifier("audioCacheExecutor") ThreadPoolTaskExecutor audioCacheExecutor,
            Clock clock) {
        List<TierStore> tiers = new ArrayList<>(List.of(memoryTierStore, diskTierStore));

        ObjectStorageProvider provider = storageProvider.getIfAvailable();
        if (properties.getCache().getRemote().isEnabled() && provider != null) {
            tiers.add(new RemoteTierStore(provider, expiryPolicy));
        } else {
            log.warn("Remote cache tier disabled, caching in memory and disk only");
        }

        return new TieredCacheManager(tiers, flags, metrics, audioCacheExecutor, clock);
    }

    @Bean
    public ExpirySweeper expirySweeper(MemoryTierStore memoryTierStore, DiskTierStore diskTierStore,
                                       MetricsRecorder metrics) {
        return new ExpirySweeper(List.of(memoryTierStore, diskTierStore), metrics);
    }
}
