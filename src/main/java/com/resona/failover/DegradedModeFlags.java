package com.resona.failover;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide degraded operating modes, one per dependency.
 *
 * Reads are lock-free. Writes go through {@link FailoverController} only, which is why the
 * setters are package-private.
 */
@Component
public class DegradedModeFlags {

    public enum SynthesisMode {
        /** Primary synthesis provider. */
        NORMAL,
        /** Alternate provider instance after the primary failed. */
        ALTERNATE,
        /** Generation disabled; serve cached audio only. */
        CACHE_ONLY
    }

    public enum RemoteTierMode {
        NORMAL,
        BYPASSED
    }

    public enum DeliveryMode {
        EDGE,
        DIRECT
    }

    private final AtomicReference<SynthesisMode> synthesis = new AtomicReference<>(SynthesisMode.NORMAL);
    private final AtomicReference<RemoteTierMode> remoteTier = new AtomicReference<>(RemoteTierMode.NORMAL);
    private final AtomicReference<DeliveryMode> delivery = new AtomicReference<>(DeliveryMode.EDGE);

    public SynthesisMode synthesis() {
        return synthesis.get();
    }

    public RemoteTierMode remoteTier() {
        return remoteTier.get();
    }

    public DeliveryMode delivery() {
        return delivery.get();
    }

    public boolean isGenerationDisabled() {
        return synthesis.get() == SynthesisMode.CACHE_ONLY;
    }

    public boolean isRemoteTierBypassed() {
        return remoteTier.get() == RemoteTierMode.BYPASSED;
    }

    public boolean isEdgeBypassed() {
        return delivery.get() == DeliveryMode.DIRECT;
    }

    public Snapshot snapshot() {
        return new Snapshot(synthesis.get(), remoteTier.get(), delivery.get());
    }

    SynthesisMode setSynthesis(SynthesisMode mode) {
        return synthesis.getAndSet(mode);
    }

    RemoteTierMode setRemoteTier(RemoteTierMode mode) {
        return remoteTier.getAndSet(mode);
    }

    DeliveryMode setDelivery(DeliveryMode mode) {
        return delivery.getAndSet(mode);
    }

    public record Snapshot(SynthesisMode synthesis, RemoteTierMode remoteTier, DeliveryMode delivery) {
    }
}
