package com.healthgate.health;

/**
 * Overall health status of an aggregation run.
 */
public enum HealthStatus {

    /** All selected checks passed. */
    HEALTHY,

    /** The process is alive but at least one readiness dependency is down. */
    DEGRADED,

    /** The process cannot serve traffic. */
    UNHEALTHY
}
