package com.healthgate.health;

/**
 * The three externally exposed views of the same checker.
 */
public enum ReportMode {

    /** Every registered check; used for dashboards and operators. */
    FULL(KindFilter.ALL),

    /** Liveness-counted checks only; used by process supervisors to decide restarts. */
    LIVENESS(KindFilter.LIVENESS),

    /** Readiness-counted checks only; used by traffic routers to decide admission. */
    READINESS(KindFilter.READINESS);

    private final KindFilter filter;

    ReportMode(KindFilter filter) {
        this.filter = filter;
    }

    public KindFilter filter() {
        return filter;
    }

    /**
     * Maps an overall status to the HTTP status code of this view. Liveness answers 200 only
     * when healthy; the full and readiness views also answer 200 when degraded.
     */
    public int httpStatus(HealthStatus overall) {
        boolean available = this == LIVENESS
                ? overall == HealthStatus.HEALTHY
                : overall != HealthStatus.UNHEALTHY;
        return available ? HealthResponse.OK : HealthResponse.SERVICE_UNAVAILABLE;
    }
}
