package com.healthgate.health;

/**
 * Selects which registered checks take part in one aggregation run.
 */
public enum KindFilter {

    ALL,

    LIVENESS,

    READINESS;

    /**
     * Returns whether a check of the given kind is selected by this filter.
     * {@link CheckKind#BOTH} checks are selected by every filter.
     */
    public boolean matches(CheckKind kind) {
        return switch (this) {
            case ALL -> true;
            case LIVENESS -> kind.countsTowardLiveness();
            case READINESS -> kind.countsTowardReadiness();
        };
    }
}
