package com.resona.health;

/**
 * Observer of dependency health transitions. Callbacks run on the probe thread.
 */
public interface DependencyHealthListener {

    /**
     * Called exactly once per transition into {@link HealthStatus#FAILED}.
     */
    default void onDependencyFailed(DependencyFailedEvent event) {
    }

    /**
     * Called when a degraded or failed dependency returns to {@link HealthStatus#HEALTHY}.
     */
    default void onDependencyRecovered(DependencyRecoveredEvent event) {
    }
}
