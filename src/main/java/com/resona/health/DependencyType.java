package com.resona.health;

import java.util.Locale;

/**
 * Kinds of external dependency tracked by the health monitor. Each kind has its own
 * failover strategy.
 */
public enum DependencyType {
    SYNTHESIS,
    /** Standby synthesis provider used while the primary is down. */
    ALTERNATE_SYNTHESIS,
    DURABLE_STORE,
    EDGE_DELIVERY;

    /**
     * Resolve a path segment such as {@code synthesis}, {@code durable-store} or {@code edge_delivery}.
     *
     * @return the type, or null when unknown
     */
    public static DependencyType fromPath(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (DependencyType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
