package com.healthgate.health;

/**
 * Classifies a registered check by which probe question it answers.
 */
public enum CheckKind {

    /** Process-local check. A failure means the process itself should be restarted. */
    LIVENESS,

    /** Dependency round-trip. A failure means the process should not receive traffic. */
    READINESS,

    /** Counts toward both the liveness and the readiness rule. */
    BOTH;

    /** Returns true if a failure of this kind makes the whole process unhealthy. */
    public boolean countsTowardLiveness() {
        return this != READINESS;
    }

    /** Returns true if a failure of this kind takes the process out of traffic rotation. */
    public boolean countsTowardReadiness() {
        return this != LIVENESS;
    }
}
