package com.resona.cache;

import com.resona.cache.tier.BoundedTierStore;
import com.resona.cache.tier.TierStore;
import com.resona.exception.AudioGenerationException;
import com.resona.exception.GenerationTimeoutException;
import com.resona.exception.GenerationUnavailableException;
import com.resona.exception.ResonaException;
import com.resona.exception.TransientDependencyException;
import com.resona.failover.DegradedModeFlags;
import com.resona.metrics.MetricUnit;
import com.resona.metrics.MetricsRecorder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;

/**
 * Multi-tier audio cache.
 *
 * Flow:
 * 1. Probe tiers fastest first (memory, disk, remote), skipping remote while it is bypassed
 * 2. On a hit, promote the payload into every faster tier (best-effort)
 * 3. On a full miss, run the generator once per key; concurrent callers await the same result
 * 4. Write the generated payload to memory and disk synchronously, to remote asynchronously
 *
 * Only a miss with no generated payload fails the caller. Write-through and promotion
 * failures are logged and metered.
 */
@Slf4j
public class TieredCacheManager {

    private final List<TierStore> tiers;
    private final DegradedModeFlags flags;
    private final MetricsRecorder metrics;
    private final Executor executor;
    private final Clock clock;

    private final ConcurrentHashMap<CacheKey, Flight> inFlight = new ConcurrentHashMap<>();

    private final LongAdder requests = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder generations = new LongAdder();
    private final LongAdder coalesced = new LongAdder();
    private final LongAdder generationFailures = new LongAdder();
    private final Map<CacheTier, LongAdder> hits = new EnumMap<>(CacheTier.class);

    /**
     * @param tiers    tier stores ordered fastest first
     * @param executor runs generations and asynchronous remote writes
     */
    public TieredCacheManager(
            List<TierStore> tiers,
            DegradedModeFlags flags,
            MetricsRecorder metrics,
            Executor executor,
            Clock clock) {
        this.tiers = List.copyOf(tiers);
        this.flags = flags;
        this.metrics = metrics;
        this.executor = executor;
        this.clock = clock;
        for (CacheTier tier : CacheTier.values()) {
            hits.put(tier, new LongAdder());
        }
        log.info("Initialized TieredCacheManager with tiers: {}",
                this.tiers.stream().map(t -> t.tier().label()).toList());
    }

    /**
     * Return cached audio for the key, or generate it.
     *
     * @param key       cache key
     * @param generator invoked at most once concurrently per key on a full miss
     * @param timeout   how long this caller waits for generation
     * @return payload and the tier that satisfied the request
     * @throws GenerationUnavailableException miss while generation is disabled
     * @throws AudioGenerationException       generation failed (same instance for every waiter)
     * @throws GenerationTimeoutException     generation did not finish within the timeout
     * @throws CancellationException          generation was cancelled
     */
    public CacheResult getOrCreate(CacheKey key, AudioGenerator generator, Duration timeout) {
        requests.increment();

        Optional<CacheResult> cached = probeTiers(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        if (flags.isGenerationDisabled()) {
            recordMiss();
            log.warn("Cache miss for {} while generation is disabled (cache-only mode)", key);
            throw new GenerationUnavailableException("Audio for key " + key
                    + " is not cached and synthesis is unavailable");
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Flight flight = new Flight();
            Flight existing = inFlight.putIfAbsent(key, flight);
            if (existing == null) {
                return lead(key, generator, flight, deadline, timeout);
            }
            if (existing.result.isDone()) {
                // cancelled, generator still unwinding
                awaitRelease(key, existing, deadline, timeout);
                continue;
            }

            recordMiss();
            coalesced.increment();
            metrics.increment("RequestCoalesced");
            log.debug("Awaiting in-flight generation for {}", key);
            return await(key, existing.result, deadline, timeout);
        }
    }

    /**
     * Cache-only lookup with promotion. Never generates.
     */
    public Optional<CacheResult> lookup(CacheKey key) {
        requests.increment();
        Optional<CacheResult> result = probeTiers(key);
        if (result.isEmpty()) {
            recordMiss();
        }
        return result;
    }

    /**
     * Release every caller waiting on an in-flight generation for the key with a
     * {@link CancellationException} and interrupt the generator. The key stays in flight
     * until the generator returns.
     *
     * @return true if a generation was in flight
     */
    public boolean cancel(CacheKey key) {
        Flight flight = inFlight.get(key);
        if (flight == null) {
            return false;
        }
        boolean cancelled = flight.result.completeExceptionally(
                new CancellationException("Audio generation cancelled for key " + key));
        if (cancelled) {
            flight.interruptRunner();
            log.info("Cancelled in-flight generation for {}", key);
        }
        return cancelled;
    }

    /**
     * Remove the key from every tier. Remote removal is skipped while the remote tier is bypassed.
     */
    public void invalidate(CacheKey key) {
        for (TierStore tier : tiers) {
            if (skipRemote(tier)) {
                continue;
            }
            try {
                tier.remove(key);
            } catch (RuntimeException e) {
                log.warn("Failed to remove {} from {} tier: {}", key, tier.tier().label(), e.getMessage());
                metrics.increment("InvalidationFailure", Map.of("tier", tier.tier().label()));
            }
        }
        log.info("Invalidated cache entry {}", key);
    }

    public boolean isInFlight(CacheKey key) {
        return inFlight.containsKey(key);
    }

    public CacheStats getStats() {
        Map<String, Long> hitsByTier = new LinkedHashMap<>();
        hits.forEach((tier, count) -> hitsByTier.put(tier.label(), count.sum()));

        Map<String, CacheStats.TierOccupancy> occupancy = new LinkedHashMap<>();
        for (TierStore tier : tiers) {
            if (tier instanceof BoundedTierStore bounded) {
                occupancy.put(tier.tier().label(), CacheStats.TierOccupancy.builder()
                        .size(bounded.size())
                        .capacity(bounded.capacity())
                        .build());
            }
        }

        return CacheStats.builder()
                .totalRequests(requests.sum())
                .misses(misses.sum())
                .generations(generations.sum())
                .coalesced(coalesced.sum())
                .generationFailures(generationFailures.sum())
                .hitsByTier(hitsByTier)
                .occupancy(occupancy)
                .build();
    }

    private Optional<CacheResult> probeTiers(CacheKey key) {
        for (int i = 0; i < tiers.size(); i++) {
            TierStore tier = tiers.get(i);
            if (skipRemote(tier)) {
                log.debug("Remote tier bypassed, skipping lookup for {}", key);
                continue;
            }

            Optional<CacheEntry> entry;
            try {
                entry = tier.get(key);
            } catch (TransientDependencyException e) {
                log.warn("{} tier unavailable for {}: {}", tier.tier().label(), key, e.getMessage());
                metrics.increment("TierReadFailure", Map.of("tier", tier.tier().label()));
                continue;
            }

            if (entry.isPresent()) {
                recordHit(tier.tier(), key);
                promote(entry.get(), tiers.subList(0, i));
                return Optional.of(new CacheResult(key, entry.get().getPayload(), CacheSource.of(tier.tier())));
            }
        }
        return Optional.empty();
    }

    private void promote(CacheEntry entry, List<TierStore> fasterTiers) {
        for (TierStore target : fasterTiers) {
            try {
                target.put(entry.getKey(), entry.getPayload(), entry.getCreatedAt());
                log.debug("Promoted {} from {} to {} tier", entry.getKey(), entry.getTier().label(),
                        target.tier().label());
            } catch (RuntimeException e) {
                log.warn("Failed to promote {} into {} tier: {}", entry.getKey(), target.tier().label(),
                        e.getMessage());
                metrics.increment("PromotionFailure", Map.of("tier", target.tier().label()));
            }
        }
    }

    private CacheResult lead(CacheKey key, AudioGenerator generator, Flight flight,
                             long deadline, Duration timeout) {
        // Another leader may have finished between the tier probe and winning the in-flight slot.
        Optional<CacheEntry> raced = peekFastest(key);
        if (raced.isPresent()) {
            CacheEntry entry = raced.get();
            recordHit(entry.getTier(), key);
            CacheResult result = new CacheResult(key, entry.getPayload(), CacheSource.of(entry.getTier()));
            release(key, flight);
            flight.result.complete(result);
            return result;
        }

        recordMiss();
        try {
            executor.execute(() -> generate(key, generator, flight));
        } catch (RejectedExecutionException e) {
            generationFailures.increment();
            release(key, flight);
            flight.result.completeExceptionally(new AudioGenerationException(key.value(), e));
        }
        return await(key, flight.result, deadline, timeout);
    }

    private Optional<CacheEntry> peekFastest(CacheKey key) {
        if (tiers.isEmpty()) {
            return Optional.empty();
        }
        try {
            return tiers.get(0).get(key);
        } catch (RuntimeException e) {
            log.debug("Re-check of {} tier failed for {}: {}", tiers.get(0).tier().label(), key, e.getMessage());
            return Optional.empty();
        }
    }

    private void generate(CacheKey key, AudioGenerator generator, Flight flight) {
        flight.attachRunner();
        try {
            if (flight.result.isDone()) {
                return;
            }
            generations.increment();
            long start = System.nanoTime();
            byte[] payload = generator.generate(key);
            if (payload == null) {
                throw new IllegalStateException("Generator returned no audio");
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            metrics.record("GenerationLatency", elapsedMs, MetricUnit.MILLISECONDS, Map.of());
            log.info("Generated audio for {} ({}B in {}ms)", key, payload.length, elapsedMs);

            writeThrough(key, payload, clock.instant());
            release(key, flight);
            flight.result.complete(new CacheResult(key, payload, CacheSource.GENERATED));
        } catch (GenerationUnavailableException | AudioGenerationException e) {
            failGeneration(key, flight, e);
        } catch (RuntimeException e) {
            if (!flight.result.isDone()) {
                metrics.increment("GenerationFailure");
                log.error("Audio generation failed for {}", key, e);
            }
            failGeneration(key, flight, new AudioGenerationException(key.value(), e));
        } finally {
            flight.detachRunner();
            release(key, flight);
        }
    }

    private void failGeneration(CacheKey key, Flight flight, ResonaException error) {
        release(key, flight);
        if (flight.result.completeExceptionally(error)) {
            generationFailures.increment();
        } else {
            log.debug("Generation for {} ended after cancellation: {}", key, error.getMessage());
        }
    }

    // Free the slot before completing the result: a woken caller must not find the finished flight.
    private void release(CacheKey key, Flight flight) {
        inFlight.remove(key, flight);
        flight.finished.complete(null);
    }

    private void recordHit(CacheTier tier, CacheKey key) {
        hits.get(tier).increment();
        metrics.increment("CacheHit", Map.of("tier", tier.label()));
        log.debug("Cache hit in {} tier: {}", tier.label(), key);
    }

    private void recordMiss() {
        misses.increment();
        metrics.increment("CacheMiss");
    }

    private void writeThrough(CacheKey key, byte[] payload, Instant createdAt) {
        for (TierStore tier : tiers) {
            if (tier.tier() == CacheTier.REMOTE) {
                if (!flags.isRemoteTierBypassed()) {
                    writeRemoteAsync(tier, key, payload, createdAt);
                }
                continue;
            }
            try {
                tier.put(key, payload, createdAt);
            } catch (RuntimeException e) {
                log.warn("Write-through to {} tier failed for {}: {}", tier.tier().label(), key, e.getMessage());
                metrics.increment("WriteThroughFailure", Map.of("tier", tier.tier().label()));
            }
        }
    }

    private void writeRemoteAsync(TierStore remote, CacheKey key, byte[] payload, Instant createdAt) {
        try {
            CompletableFuture.runAsync(() -> remote.put(key, payload, createdAt), executor)
                    .exceptionally(e -> {
                        Throwable cause = e.getCause() != null ? e.getCause() : e;
                        log.warn("Remote write-through failed for {}: {}", key, cause.getMessage());
                        metrics.increment("WriteThroughFailure", Map.of("tier", CacheTier.REMOTE.label()));
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Remote write-through rejected for {}: {}", key, e.getMessage());
            metrics.increment("WriteThroughFailure", Map.of("tier", CacheTier.REMOTE.label()));
        }
    }

    private CacheResult await(CacheKey key, CompletableFuture<CacheResult> result, long deadline,
                              Duration timeout) {
        try {
            return result.get(remaining(deadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            metrics.increment("GenerationTimeout");
            throw new GenerationTimeoutException(key.value(), timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AudioGenerationException(key.value(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ResonaException resonaException) {
                throw resonaException;
            }
            throw new AudioGenerationException(key.value(), cause);
        }
    }

    private void awaitRelease(CacheKey key, Flight flight, long deadline, Duration timeout) {
        try {
            flight.finished.get(remaining(deadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            metrics.increment("GenerationTimeout");
            throw new GenerationTimeoutException(key.value(), timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AudioGenerationException(key.value(), e);
        } catch (ExecutionException e) {
            throw new AudioGenerationException(key.value(), e.getCause());
        }
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    private boolean skipRemote(TierStore tier) {
        return tier.tier() == CacheTier.REMOTE && flags.isRemoteTierBypassed();
    }

    /**
     * One generation run. The key's slot is held until the generator returns, however
     * early its callers stop waiting.
     */
    private static final class Flight {

        private final CompletableFuture<CacheResult> result = new CompletableFuture<>();
        private final CompletableFuture<Void> finished = new CompletableFuture<>();
        private Thread runner;

        synchronized void attachRunner() {
            runner = Thread.currentThread();
        }

        // Clears a pending interrupt so the pooled thread does not carry it into its next task.
        synchronized void detachRunner() {
            runner = null;
            Thread.interrupted();
        }

        synchronized void interruptRunner() {
            if (runner != null) {
                runner.interrupt();
            }
        }
    }
}
