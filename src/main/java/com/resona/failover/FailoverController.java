package com.resona.failover;

import com.resona.alert.AlertDispatcher;
import com.resona.config.ResonaProperties.RecoveryPolicy;
import com.resona.failover.DegradedModeFlags.DeliveryMode;
import com.resona.failover.DegradedModeFlags.RemoteTierMode;
import com.resona.failover.DegradedModeFlags.SynthesisMode;
import com.resona.health.DependencyFailedEvent;
import com.resona.health.DependencyHealthListener;
import com.resona.health.DependencyRecoveredEvent;
import com.resona.health.DependencyType;
import com.resona.metrics.MetricsRecorder;
import com.resona.synthesis.SpeechSynthesisProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Installs degraded modes when a dependency fails and restores them on recovery.
 *
 * Strategy per dependency type:
 * - SYNTHESIS: switch to the alternate provider if it answers, otherwise cache-only
 * - ALTERNATE_SYNTHESIS: cache-only if synthesis is currently served by the alternate
 * - DURABLE_STORE: bypass the remote tier (memory and disk only)
 * - EDGE_DELIVERY: serve audio directly instead of through the edge
 *
 * Every flag write happens here, under this object's monitor.
 */
@Slf4j
public class FailoverController implements DependencyHealthListener {

    private static final String NORMAL = "NORMAL";

    private final DegradedModeFlags flags;
    private final SpeechSynthesisProvider alternateProvider;
    private final AlertDispatcher alertDispatcher;
    private final MetricsRecorder metrics;
    private final RecoveryPolicy recoveryPolicy;
    private final Map<DependencyType, Supplier<String>> strategies = new EnumMap<>(DependencyType.class);

    /**
     * @param alternateProvider may be null; synthesis failure then goes straight to cache-only
     */
    public FailoverController(
            DegradedModeFlags flags,
            SpeechSynthesisProvider alternateProvider,
            AlertDispatcher alertDispatcher,
            MetricsRecorder metrics,
            RecoveryPolicy recoveryPolicy) {
        this.flags = flags;
        this.alternateProvider = alternateProvider;
        this.alertDispatcher = alertDispatcher;
        this.metrics = metrics;
        this.recoveryPolicy = recoveryPolicy;

        strategies.put(DependencyType.SYNTHESIS, this::failoverSynthesis);
        strategies.put(DependencyType.ALTERNATE_SYNTHESIS, this::failoverAlternateSynthesis);
        strategies.put(DependencyType.DURABLE_STORE, this::bypassRemoteTier);
        strategies.put(DependencyType.EDGE_DELIVERY, this::bypassEdge);
    }

    @Override
    public void onDependencyFailed(DependencyFailedEvent event) {
        triggerFailover(event.type(), event.dependency(),
                event.consecutiveFailures() + " consecutive health check failures: " + event.lastError());
    }

    @Override
    public void onDependencyRecovered(DependencyRecoveredEvent event) {
        if (recoveryPolicy == RecoveryPolicy.MANUAL) {
            log.info("{} is healthy again; degraded mode kept until manual recovery", event.dependency());
            return;
        }
        restore(event.type(), event.dependency());
    }

    /**
     * Install the degraded mode for a dependency type and send one alert.
     *
     * @return the mode now in effect
     */
    public synchronized String triggerFailover(DependencyType type, String dependency, String reason) {
        log.error("Triggering failover for {} ({}): {}", dependency, type, reason);
        String mode = strategies.get(type).get();
        metrics.increment("ServiceFailover", Map.of("dependency", dependency, "mode", mode));
        alertDispatcher.dispatchFailover(dependency, reason, mode);
        return mode;
    }

    /**
     * Return a dependency type to normal operation. For the alternate synthesis provider this
     * means serving from it again when synthesis fell back to cache-only while it was down.
     *
     * @return true if a degraded mode was cleared
     */
    public synchronized boolean restore(DependencyType type, String dependency) {
        String mode = switch (type) {
            case SYNTHESIS -> flags.setSynthesis(SynthesisMode.NORMAL) != SynthesisMode.NORMAL ? NORMAL : null;
            case ALTERNATE_SYNTHESIS -> restoreAlternateSynthesis();
            case DURABLE_STORE -> flags.setRemoteTier(RemoteTierMode.NORMAL) != RemoteTierMode.NORMAL ? NORMAL : null;
            case EDGE_DELIVERY -> flags.setDelivery(DeliveryMode.EDGE) != DeliveryMode.EDGE ? NORMAL : null;
        };
        if (mode == null) {
            return false;
        }
        log.info("Restored {} for {} ({})", mode, dependency, type);
        metrics.increment("ServiceRecovery", Map.of("dependency", dependency));
        alertDispatcher.dispatchRecovery(dependency, mode);
        return true;
    }

    public RecoveryPolicy getRecoveryPolicy() {
        return recoveryPolicy;
    }

    private String failoverSynthesis() {
        if (alternateProvider != null && flags.synthesis() == SynthesisMode.NORMAL) {
            try {
                alternateProvider.checkAvailable();
                flags.setSynthesis(SynthesisMode.ALTERNATE);
                log.warn("Synthesis switched to alternate provider {}", alternateProvider.getName());
                return SynthesisMode.ALTERNATE.name();
            } catch (RuntimeException e) {
                log.error("Alternate provider {} also unavailable: {}", alternateProvider.getName(), e.getMessage());
            }
        }
        flags.setSynthesis(SynthesisMode.CACHE_ONLY);
        log.error("Synthesis disabled, serving cached audio only");
        return SynthesisMode.CACHE_ONLY.name();
    }

    private String failoverAlternateSynthesis() {
        if (flags.synthesis() == SynthesisMode.ALTERNATE) {
            flags.setSynthesis(SynthesisMode.CACHE_ONLY);
            log.error("Alternate synthesis provider down while in use, serving cached audio only");
            return SynthesisMode.CACHE_ONLY.name();
        }
        log.warn("Alternate synthesis provider down while not in use (synthesis mode {})", flags.synthesis());
        return flags.synthesis().name();
    }

    private String restoreAlternateSynthesis() {
        if (alternateProvider == null || flags.synthesis() != SynthesisMode.CACHE_ONLY) {
            return null;
        }
        flags.setSynthesis(SynthesisMode.ALTERNATE);
        log.warn("Synthesis resumed on alternate provider {}", alternateProvider.getName());
        return SynthesisMode.ALTERNATE.name();
    }

    private String bypassRemoteTier() {
        flags.setRemoteTier(RemoteTierMode.BYPASSED);
        log.error("Remote tier bypassed, serving from memory and disk only");
        return RemoteTierMode.BYPASSED.name();
    }

    private String bypassEdge() {
        flags.setDelivery(DeliveryMode.DIRECT);
        log.error("Edge delivery bypassed, serving audio directly");
        return DeliveryMode.DIRECT.name();
    }
}
