package com.resona.health;

/**
 * Real reachability check of one external dependency.
 */
public interface HealthProbe {

    /**
     * @return dependency name used in logs, events and the status endpoint
     */
    String name();

    DependencyType type();

    /**
     * Run the check. Throwing counts as a failure; so does exceeding the monitor's timeout.
     */
    ProbeResult probe();
}
