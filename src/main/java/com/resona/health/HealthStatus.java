package com.resona.health;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    FAILED
}
