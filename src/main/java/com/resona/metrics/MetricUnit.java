package com.resona.metrics;

/**
 * Unit attached to a recorded value.
 */
public enum MetricUnit {
    COUNT,
    MILLISECONDS,
    BYTES,
    NONE
}
