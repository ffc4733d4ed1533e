package com.healthgate.health;

import java.util.List;

/**
 * Folds individual check outcomes into one overall {@link HealthStatus}.
 * <p>
 * A failed liveness-counted check always yields {@link HealthStatus#UNHEALTHY}. A failed
 * readiness-counted check yields {@link HealthStatus#DEGRADED} under {@link #LENIENT} and
 * {@link HealthStatus#UNHEALTHY} under {@link #STRICT}. A check of kind {@link CheckKind#BOTH}
 * takes part in both rules, so its failure is always {@link HealthStatus#UNHEALTHY}.
 */
public enum MergePolicy {

    /** Readiness failures degrade the process but keep it in rotation. */
    LENIENT,

    /** Readiness failures make the process unhealthy. */
    STRICT;

    /**
     * Merges the given outcomes. An empty list is {@link HealthStatus#HEALTHY}.
     *
     * @param outcomes outcomes of one run, in any order
     * @return the overall status
     */
    public HealthStatus merge(List<CheckOutcome> outcomes) {
        boolean readinessFailed = false;
        for (CheckOutcome outcome : outcomes) {
            if (!outcome.status().isFailure()) {
                continue;
            }
            if (outcome.kind().countsTowardLiveness()) {
                return HealthStatus.UNHEALTHY;
            }
            readinessFailed = true;
        }
        if (!readinessFailed) {
            return HealthStatus.HEALTHY;
        }
        return this == STRICT ? HealthStatus.UNHEALTHY : HealthStatus.DEGRADED;
    }
}
