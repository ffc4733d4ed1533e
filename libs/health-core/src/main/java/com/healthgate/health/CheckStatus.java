package com.healthgate.health;

/**
 * Status of a single check within one aggregation run.
 */
public enum CheckStatus {

    /** The probe completed its round-trip successfully. */
    HEALTHY,

    /** The probe reported a failure or threw. */
    UNHEALTHY,

    /** The probe did not answer within its time budget. Distinct from a broken dependency. */
    TIMED_OUT;

    /** Returns true for {@link #UNHEALTHY} and {@link #TIMED_OUT}. */
    public boolean isFailure() {
        return this != HEALTHY;
    }
}
