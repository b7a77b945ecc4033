package com.resona.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fixed time-to-live check shared by every tier. An entry is valid while
 * {@code now - createdAt < ttl}.
 */
public class ExpiryPolicy {

    private final Duration ttl;
    private final Clock clock;

    public ExpiryPolicy(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean isExpired(Instant createdAt) {
        return !Duration.between(createdAt, clock.instant()).minus(ttl).isNegative();
    }

    public Duration age(Instant createdAt) {
        return Duration.between(createdAt, clock.instant());
    }

    public Instant now() {
        return clock.instant();
    }

    public Duration getTtl() {
        return ttl;
    }
}
