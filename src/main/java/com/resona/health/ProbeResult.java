package com.resona.health;

import java.time.Duration;

/**
 * Outcome of one health probe.
 */
public record ProbeResult(boolean success, Duration latency, String error) {

    public static ProbeResult success(Duration latency) {
        return new ProbeResult(true, latency, null);
    }

    public static ProbeResult failure(Duration latency, String error) {
        return new ProbeResult(false, latency, error);
    }
}
