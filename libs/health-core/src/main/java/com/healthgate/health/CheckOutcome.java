package com.healthgate.health;

import java.time.Duration;

/**
 * Result of one check within one aggregation run. Created fresh on every run.
 *
 * @param name    registered check name
 * @param kind    kind the check was registered with
 * @param status  outcome status
 * @param message failure reason, or an informational note for healthy outcomes (nullable)
 * @param latency time from launch until the outcome was known
 */
public record CheckOutcome(
        String name,
        CheckKind kind,
        CheckStatus status,
        String message,
        Duration latency
) {

    public CheckOutcome {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (latency == null || latency.isNegative()) {
            throw new IllegalArgumentException("latency must not be null or negative");
        }
    }

    /** Creates an outcome from what the probe reported. */
    public static CheckOutcome of(String name, CheckKind kind, ProbeResult result, Duration latency) {
        return new CheckOutcome(name, kind, result.status(), result.message(), latency);
    }

    /** Creates an unhealthy outcome. */
    public static CheckOutcome unhealthy(String name, CheckKind kind, String reason, Duration latency) {
        return new CheckOutcome(name, kind, CheckStatus.UNHEALTHY, reason, latency);
    }

    /** Creates a timed-out outcome. */
    public static CheckOutcome timedOut(String name, CheckKind kind, String reason, Duration latency) {
        return new CheckOutcome(name, kind, CheckStatus.TIMED_OUT, reason, latency);
    }

    /** Returns the failure reason, or null when the check is healthy. */
    public String reason() {
        return status == CheckStatus.HEALTHY ? null : message;
    }

    public long latencyMs() {
        return latency.toMillis();
    }
}
