package com.healthgate.health;

/**
 * The mountable unit: one shared {@link HealthChecker} rendered through a
 * {@link HealthReporter} in each {@link ReportMode}. Route naming is left to the host.
 * <p>
 * Construct it once and pass it explicitly to whatever serves the routes; several independent
 * endpoints (e.g. one per sub-service) can coexist.
 */
public final class HealthEndpoint {

    private final HealthChecker checker;
    private final HealthReporter reporter;

    public HealthEndpoint(HealthChecker checker, HealthReporter reporter) {
        if (checker == null) {
            throw new IllegalArgumentException("checker must not be null");
        }
        if (reporter == null) {
            throw new IllegalArgumentException("reporter must not be null");
        }
        this.checker = checker;
        this.reporter = reporter;
    }

    public HealthResponse respond(ReportMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        return reporter.render(checker.check(mode.filter()), mode);
    }

    public HealthResponse full() {
        return respond(ReportMode.FULL);
    }

    public HealthResponse liveness() {
        return respond(ReportMode.LIVENESS);
    }

    public HealthResponse readiness() {
        return respond(ReportMode.READINESS);
    }

    public HealthChecker checker() {
        return checker;
    }
}
