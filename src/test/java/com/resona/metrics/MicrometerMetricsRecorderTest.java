package com.resona.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MicrometerMetricsRecorder.
 */
class MicrometerMetricsRecorderTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsRecorder recorder;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        recorder = new MicrometerMetricsRecorder(registry);
    }

    @Test
    void testIncrementCreatesTaggedCounter() {
        recorder.increment("CacheHit", Map.of("tier", "memory"));
        recorder.increment("CacheHit", Map.of("tier", "memory"));
        recorder.increment("CacheHit", Map.of("tier", "disk"));

        Counter memory = registry.find("resona.CacheHit").tag("tier", "memory").counter();
        assertNotNull(memory);
        assertEquals(2.0, memory.count());
        assertEquals(1.0, registry.find("resona.CacheHit").tag("tier", "disk").counter().count());
    }

    @Test
    void testMillisecondsBecomeTimer() {
        recorder.record("GenerationLatency", 250, MetricUnit.MILLISECONDS, Map.of());

        Timer timer = registry.find("resona.GenerationLatency").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(250.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    void testOtherUnitsBecomeSummaries() {
        recorder.record("PollyHealthCheck", 1, MetricUnit.NONE, null);
        recorder.record("PollyHealthCheck", 0, MetricUnit.NONE, null);

        DistributionSummary summary = registry.find("resona.PollyHealthCheck").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(1.0, summary.totalAmount(), 0.001);
    }

    @Test
    void testRegistryConflictIsSwallowed() {
        recorder.increment("Conflicting");

        assertDoesNotThrow(() -> recorder.record("Conflicting", 5, MetricUnit.MILLISECONDS, Map.of()));
    }
}
