package com.resona.health;

import java.time.Instant;

/**
 * A dependency crossed the consecutive-failure threshold.
 */
public record DependencyFailedEvent(String dependency, DependencyType type, int consecutiveFailures,
                                    String lastError, Instant occurredAt) {
}
