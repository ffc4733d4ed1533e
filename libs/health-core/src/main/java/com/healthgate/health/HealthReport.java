package com.healthgate.health;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Aggregate result of one health check run.
 *
 * @param status      overall status after merging
 * @param outcomes    individual outcomes, in registration order
 * @param generatedAt when the run finished
 */
public record HealthReport(
        HealthStatus status,
        List<CheckOutcome> outcomes,
        Instant generatedAt
) {

    public HealthReport {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (generatedAt == null) {
            throw new IllegalArgumentException("generatedAt must not be null");
        }
        outcomes = List.copyOf(outcomes);
    }

    /** A healthy report without outcomes, used when no check matches the filter. */
    public static HealthReport empty(Instant generatedAt) {
        return new HealthReport(HealthStatus.HEALTHY, List.of(), generatedAt);
    }

    /** Looks up the outcome of a check by name. */
    public Optional<CheckOutcome> outcome(String name) {
        return outcomes.stream().filter(o -> o.name().equals(name)).findFirst();
    }
}
