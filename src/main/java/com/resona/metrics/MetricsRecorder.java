package com.resona.metrics;

import java.util.Map;

/**
 * Fire-and-forget metrics sink. Implementations must never throw into the caller.
 */
public interface MetricsRecorder {

    /**
     * Record a single value.
     *
     * @param name  metric name (e.g., "CacheHit")
     * @param value value to record
     * @param unit  unit of the value
     * @param tags  dimensions, may be empty
     */
    void record(String name, double value, MetricUnit unit, Map<String, String> tags);

    default void increment(String name, Map<String, String> tags) {
        record(name, 1, MetricUnit.COUNT, tags);
    }

    default void increment(String name) {
        record(name, 1, MetricUnit.COUNT, Map.of());
    }
}
