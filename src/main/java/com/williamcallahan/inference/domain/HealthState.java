package com.williamcallahan.inference.domain;

/**
 * Health of a provider as observed by background probes.
 */
public enum HealthState {
    UNKNOWN("unknown"),
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy");

    private final String label;

    HealthState(String label) {
        this.label = label;
    }

    /** Returns the lowercase label used in status reports. */
    public String label() {
        return label;
    }

    /** Reports whether requests may still be routed to a provider in this state. */
    public boolean isUsable() {
        return this != UNHEALTHY;
    }
}
