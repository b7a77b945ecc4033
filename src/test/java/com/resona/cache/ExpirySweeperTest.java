package com.resona.cache;

import com.resona.cache.tier.BoundedTierStore;
import com.resona.cache.tier.MemoryTierStore;
import com.resona.metrics.MetricUnit;
import com.resona.metrics.MetricsRecorder;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for ExpirySweeper.
 */
class ExpirySweeperTest {

    private MutableClock clock;
    private MetricsRecorder metrics;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        metrics = mock(MetricsRecorder.class);
    }

    @Test
    void testSweepRemovesOnlyExpiredEntries() {
        MemoryTierStore memory = new MemoryTierStore(10, new ExpiryPolicy(Duration.ofHours(24), clock));
        memory.put(new CacheKey(DigestUtils.sha256Hex("old")), new byte[]{1}, clock.instant());
        clock.advance(Duration.ofHours(20));
        memory.put(new CacheKey(DigestUtils.sha256Hex("new")), new byte[]{2}, clock.instant());
        clock.advance(Duration.ofHours(5));

        ExpirySweeper sweeper = new ExpirySweeper(List.of(memory), metrics);

        assertEquals(1, sweeper.sweep());
        assertEquals(1, memory.size());
        verify(metrics).record("ExpiredEntriesRemoved", 1, MetricUnit.COUNT, Map.of("tier", "memory"));
    }

    @Test
    void testFailingTierDoesNotStopSweep() {
        BoundedTierStore broken = mock(BoundedTierStore.class);
        when(broken.tier()).thenReturn(CacheTier.DISK);
        when(broken.removeExpired()).thenThrow(new IllegalStateException("disk unavailable"));
        BoundedTierStore healthy = mock(BoundedTierStore.class);
        when(healthy.tier()).thenReturn(CacheTier.MEMORY);
        when(healthy.removeExpired()).thenReturn(3);

        ExpirySweeper sweeper = new ExpirySweeper(List.of(broken, healthy), metrics);

        assertEquals(3, sweeper.sweep());
        verify(healthy).removeExpired();
    }

    @Test
    void testNothingExpiredRecordsNothing() {
        MemoryTierStore memory = new MemoryTierStore(10, new ExpiryPolicy(Duration.ofHours(24), clock));
        memory.put(new CacheKey(DigestUtils.sha256Hex("fresh")), new byte[]{1}, clock.instant());

        assertEquals(0, new ExpirySweeper(List.of(memory), metrics).sweep());
        verifyNoInteractions(metrics);
    }
}
