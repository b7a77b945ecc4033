package com.resona.health;

import com.resona.config.ResonaProperties;
import com.resona.metrics.MetricUnit;
import com.resona.metrics.MetricsRecorder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic health checks of external dependencies.
 *
 * Each probe runs on its own fixed-delay schedule and is bounded by the probe timeout; a probe
 * that times out or throws counts as a failure. The probe task is the only writer of its
 * dependency's {@link DependencyHealth}. Listeners are notified once on entering FAILED and once
 * on returning to HEALTHY.
 */
@Slf4j
public class DependencyHealthMonitor {

    private final Map<String, HealthProbe> probes = new LinkedHashMap<>();
    private final Map<String, DependencyHealth> health = new ConcurrentHashMap<>();
    private final List<DependencyHealthListener> listeners;
    private final MetricsRecorder metrics;
    private final ResonaProperties.HealthConfig config;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private final ExecutorService probeExecutor;

    public DependencyHealthMonitor(
            List<HealthProbe> probes,
            List<DependencyHealthListener> listeners,
            MetricsRecorder metrics,
            ResonaProperties.HealthConfig config,
            Clock clock) {
        for (HealthProbe probe : probes) {
            this.probes.put(probe.name(), probe);
            this.health.put(probe.name(), DependencyHealth.initial(probe.name(), probe.type()));
        }
        this.listeners = List.copyOf(listeners);
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
        this.probeExecutor = Executors.newCachedThreadPool(daemonThreads("health-probe"));
    }

    @PostConstruct
    public void start() {
        if (!config.isEnabled()) {
            log.info("Health monitoring disabled");
            return;
        }
        scheduler = Executors.newScheduledThreadPool(Math.max(1, probes.size()), daemonThreads("health-scheduler"));
        long intervalMs = config.getInterval().toMillis();
        for (String name : probes.keySet()) {
            scheduler.scheduleWithFixedDelay(() -> runScheduled(name), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }
        log.info("Started health monitoring of {} every {} (timeout {}, failure threshold {})",
                probes.keySet(), config.getInterval(), config.getTimeout(), config.getFailureThreshold());
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        probeExecutor.shutdownNow();
        log.info("Stopped health monitoring");
    }

    /**
     * Probe one dependency now and apply the result.
     *
     * @param name probe name
     * @return health after the probe
     */
    public DependencyHealth runProbe(String name) {
        HealthProbe probe = probes.get(name);
        if (probe == null) {
            throw new IllegalArgumentException("Unknown dependency: " + name);
        }

        ProbeResult result = execute(probe);
        recordMetrics(probe, result);

        DependencyHealth previous = health.get(name);
        DependencyHealth next = previous.next(result, config.getFailureThreshold(), clock.instant());
        health.put(name, next);

        if (result.success()) {
            log.debug("{} health check passed in {}ms", name, result.latency().toMillis());
        } else {
            log.warn("{} health check failed ({} consecutive): {}", name, next.consecutiveFailures(), result.error());
        }

        if (previous.status() != HealthStatus.FAILED && next.status() == HealthStatus.FAILED) {
            log.error("{} marked FAILED after {} consecutive failures", name, next.consecutiveFailures());
            notifyFailed(new DependencyFailedEvent(name, probe.type(), next.consecutiveFailures(),
                    next.lastError(), next.lastCheckedAt()));
        } else if (previous.status() != HealthStatus.HEALTHY && next.status() == HealthStatus.HEALTHY) {
            log.info("{} recovered (was {})", name, previous.status());
            notifyRecovered(new DependencyRecoveredEvent(name, probe.type(), previous.status(),
                    next.lastCheckedAt()));
        }
        return next;
    }

    public Optional<DependencyHealth> getHealth(String name) {
        return Optional.ofNullable(health.get(name));
    }

    /**
     * @return health of every dependency, in registration order
     */
    public List<DependencyHealth> snapshot() {
        List<DependencyHealth> result = new ArrayList<>();
        for (String name : probes.keySet()) {
            result.add(health.get(name));
        }
        return result;
    }

    private void runScheduled(String name) {
        try {
            runProbe(name);
        } catch (RuntimeException e) {
            // keep the schedule alive
            log.error("Health check task for {} failed", name, e);
        }
    }

    private ProbeResult execute(HealthProbe probe) {
        long start = System.nanoTime();
        Future<ProbeResult> future = probeExecutor.submit(probe::probe);
        try {
            ProbeResult result = future.get(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ProbeResult.failure(elapsed(start), "probe returned no result");
            }
            return result.latency() != null ? result : new ProbeResult(result.success(), elapsed(start), result.error());
        } catch (TimeoutException e) {
            future.cancel(true);
            return ProbeResult.failure(elapsed(start), "timed out after " + config.getTimeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ProbeResult.failure(elapsed(start), cause.getMessage() != null
                    ? cause.getMessage() : cause.getClass().getSimpleName());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ProbeResult.failure(elapsed(start), "interrupted");
        }
    }

    private void recordMetrics(HealthProbe probe, ProbeResult result) {
        metrics.record(probe.name() + "HealthCheck", result.success() ? 1 : 0, MetricUnit.NONE, Map.of());
        if (result.latency() != null) {
            metrics.record(probe.name() + "ResponseTime", result.latency().toMillis(), MetricUnit.MILLISECONDS,
                    Map.of());
        }
    }

    private void notifyFailed(DependencyFailedEvent event) {
        for (DependencyHealthListener listener : listeners) {
            try {
                listener.onDependencyFailed(event);
            } catch (RuntimeException e) {
                log.error("Health listener {} failed handling {}", listener.getClass().getSimpleName(), event, e);
            }
        }
    }

    private void notifyRecovered(DependencyRecoveredEvent event) {
        for (DependencyHealthListener listener : listeners) {
            try {
                listener.onDependencyRecovered(event);
            } catch (RuntimeException e) {
                log.error("Health listener {} failed handling {}", listener.getClass().getSimpleName(), event, e);
            }
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
