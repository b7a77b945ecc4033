package com.resona.controller;

import com.resona.config.ResonaProperties;
import com.resona.failover.DegradedModeFlags;
import com.resona.failover.FailoverController;
import com.resona.health.DependencyHealth;
import com.resona.health.DependencyHealthMonitor;
import com.resona.health.DependencyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints: dependency health, degraded modes, manual failover and recovery.
 */
@Slf4j
@RestController
@RequestMapping("/v1/system")
public class SystemController {

    private final DependencyHealthMonitor healthMonitor;
    private final FailoverController failoverController;
    private final DegradedModeFlags flags;
    private final ResonaProperties properties;

    public SystemController(
            DependencyHealthMonitor healthMonitor,
            FailoverController failoverController,
            DegradedModeFlags flags,
            ResonaProperties properties) {
        this.healthMonitor = healthMonitor;
        this.failoverController = failoverController;
        this.flags = flags;
        this.properties = properties;
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> dependencies = new LinkedHashMap<>();
        for (DependencyHealth health : healthMonitor.snapshot()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", health.type().name());
            entry.put("status", health.status().name());
            entry.put("consecutiveFailures", health.consecutiveFailures());
            entry.put("lastCheckedAt", health.lastCheckedAt() != null ? health.lastCheckedAt().toString() : null);
            entry.put("lastLatencyMs", health.lastLatency() != null ? health.lastLatency().toMillis() : null);
            entry.put("lastError", health.lastError());
            dependencies.put(health.name(), entry);
        }

        DegradedModeFlags.Snapshot modes = flags.snapshot();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("timestamp", Instant.now().toString());
        status.put("region", properties.getSynthesis().getRegion());
        status.put("dependencies", dependencies);
        status.put("modes", Map.of(
                "synthesis", modes.synthesis().name(),
                "remoteTier", modes.remoteTier().name(),
                "delivery", modes.delivery().name()
        ));
        status.put("recoveryPolicy", failoverController.getRecoveryPolicy().name());
        return ResponseEntity.ok(status);
    }

    /**
     * Force failover of a dependency type, as if its health check had crossed the threshold.
     */
    @PostMapping("/failover/{dependency}")
    public ResponseEntity<Map<String, String>> failover(@PathVariable String dependency) {
        DependencyType type = DependencyType.fromPath(dependency);
        if (type == null) {
            return unknownDependency(dependency);
        }
        log.warn("Manual failover requested for {}", type);
        String mode = failoverController.triggerFailover(type, type.name(), "Manual trigger");
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "dependency", type.name(),
                "mode", mode
        ));
    }

    @PostMapping("/recover/{dependency}")
    public ResponseEntity<Map<String, String>> recover(@PathVariable String dependency) {
        DependencyType type = DependencyType.fromPath(dependency);
        if (type == null) {
            return unknownDependency(dependency);
        }
        log.info("Manual recovery requested for {}", type);
        boolean changed = failoverController.restore(type, type.name());
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "dependency", type.name(),
                "message", changed ? "Normal operation restored" : "Already in normal operation"
        ));
    }

    private ResponseEntity<Map<String, String>> unknownDependency(String dependency) {
        return ResponseEntity.badRequest().body(Map.of(
                "status", "error",
                "message", "Unknown dependency: " + dependency + ". Expected one of "
                        + List.of(DependencyType.values())
        ));
    }
}
