package com.resona.health;

import java.time.Instant;

/**
 * A previously degraded or failed dependency probed healthy again.
 */
public record DependencyRecoveredEvent(String dependency, DependencyType type, HealthStatus previousStatus,
                                       Instant occurredAt) {
}
