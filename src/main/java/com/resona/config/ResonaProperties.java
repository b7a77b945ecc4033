package com.resona.config;

import com.resona.exception.CacheConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for Resona.
 */
@Data
@Component
@ConfigurationProperties(prefix = "resona")
public class ResonaProperties {

    private CacheConfig cache = new CacheConfig();
    private SynthesisConfig synthesis = new SynthesisConfig();
    private HealthConfig health = new HealthConfig();
    private EdgeConfig edge = new EdgeConfig();
    private AlertsConfig alerts = new AlertsConfig();
    private FailoverConfig failover = new FailoverConfig();
    private PrecacheConfig precache = new PrecacheConfig();

    @Data
    public static class CacheConfig {
        private Duration ttl = Duration.ofHours(24);
        private Duration sweepInterval = Duration.ofHours(1);
        private Duration generationTimeout = Duration.ofSeconds(30);
        private MemoryConfig memory = new MemoryConfig();
        private DiskConfig disk = new DiskConfig();
        private RemoteConfig remote = new RemoteConfig();
    }

    @Data
    public static class MemoryConfig {
        private int capacity = 50;
    }

    @Data
    public static class DiskConfig {
        private int capacity = 200;
        private String directory = "./cache/audio";
    }

    @Data
    public static class RemoteConfig {
        private boolean enabled = true;
        private String backend = "s3";
        private String bucket = "safety-alert-audio-cache";
        private String prefix = "audio-cache/";
    }

    @Data
    public static class SynthesisConfig {
        private String region = "ap-south-1";
        private String fallbackRegion = "us-east-1";
        private String defaultVoice = "Joanna";
        private String defaultFormat = "mp3";
        private String defaultEngine = "neural";
    }

    @Data
    public static class HealthConfig {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(60);
        private Duration timeout = Duration.ofSeconds(5);
        private int failureThreshold = 3;
    }

    @Data
    public static class EdgeConfig {
        private String distributionId;
        private String domain;
    }

    @Data
    public static class AlertsConfig {
        private String topicArn;
        private String serviceName = "SafetyAlertSystem";
    }

    @Data
    public static class FailoverConfig {
        private RecoveryPolicy recovery = RecoveryPolicy.AUTOMATIC;
    }

    @Data
    public static class PrecacheConfig {
        private boolean enabled = false;
        private List<String> alerts = new ArrayList<>(List.of(
                "Emergency alert activated",
                "Weather warning issued",
                "Traffic alert in your area",
                "System maintenance notification",
                "Alert acknowledged",
                "Emergency services contacted"));
        private List<String> voices = new ArrayList<>(List.of("Joanna", "Matthew", "Amy"));
    }

    /**
     * What happens to a degraded-mode flag once its dependency probes healthy again.
     */
    public enum RecoveryPolicy {
        AUTOMATIC,
        MANUAL
    }

    /**
     * Reject values the cache cannot operate with. Called once while the context starts.
     *
     * @throws CacheConfigurationException on the first invalid value
     */
    public void validate() {
        requirePositive("resona.cache.ttl", cache.getTtl());
        requirePositive("resona.cache.sweep-interval", cache.getSweepInterval());
        requirePositive("resona.cache.generation-timeout", cache.getGenerationTimeout());
        if (cache.getMemory().getCapacity() <= 0) {
            throw new CacheConfigurationException("resona.cache.memory.capacity must be positive, was "
                    + cache.getMemory().getCapacity());
        }
        if (cache.getDisk().getCapacity() <= 0) {
            throw new CacheConfigurationException("resona.cache.disk.capacity must be positive, was "
                    + cache.getDisk().getCapacity());
        }
        if (cache.getDisk().getDirectory() == null || cache.getDisk().getDirectory().isBlank()) {
            throw new CacheConfigurationException("resona.cache.disk.directory must be set");
        }
        if (health.getFailureThreshold() <= 0) {
            throw new CacheConfigurationException("resona.health.failure-threshold must be positive, was "
                    + health.getFailureThreshold());
        }
        requirePositive("resona.health.interval", health.getInterval());
        requirePositive("resona.health.timeout", health.getTimeout());
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new CacheConfigurationException(name + " must be a positive duration, was " + value);
        }
    }
}
