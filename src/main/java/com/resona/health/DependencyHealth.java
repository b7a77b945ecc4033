package com.resona.health;

import java.time.Duration;
import java.time.Instant;

/**
 * Health of one dependency after its latest probe. Immutable; the monitor swaps in the result
 * of {@link #next} after every probe.
 *
 * State machine:
 * - failure: counter + 1; DEGRADED while below the threshold, FAILED at or above it
 * - success: counter reset to 0, HEALTHY
 */
public record DependencyHealth(
        String name,
        DependencyType type,
        int consecutiveFailures,
        HealthStatus status,
        Instant lastCheckedAt,
        Duration lastLatency,
        String lastError) {

    public static DependencyHealth initial(String name, DependencyType type) {
        return new DependencyHealth(name, type, 0, HealthStatus.HEALTHY, null, null, null);
    }

    public DependencyHealth next(ProbeResult result, int failureThreshold, Instant now) {
        if (result.success()) {
            return new DependencyHealth(name, type, 0, HealthStatus.HEALTHY, now, result.latency(), null);
        }
        int failures = consecutiveFailures + 1;
        HealthStatus nextStatus = failures >= failureThreshold ? HealthStatus.FAILED : HealthStatus.DEGRADED;
        return new DependencyHealth(name, type, failures, nextStatus, now, result.latency(), result.error());
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
