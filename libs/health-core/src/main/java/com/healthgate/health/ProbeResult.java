package com.healthgate.health;

/**
 * What a probe reports after its single backend round-trip.
 * <p>
 * Probes only ever report {@link CheckStatus#HEALTHY} or {@link CheckStatus#UNHEALTHY};
 * {@link CheckStatus#TIMED_OUT} is assigned by the aggregator.
 *
 * @param status  HEALTHY or UNHEALTHY
 * @param message failure reason (required when unhealthy) or optional informational note
 */
public record ProbeResult(CheckStatus status, String message) {

    public ProbeResult {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (status == CheckStatus.TIMED_OUT) {
            throw new IllegalArgumentException("TIMED_OUT is assigned by the aggregator, not by probes");
        }
        if (status == CheckStatus.UNHEALTHY && (message == null || message.isBlank())) {
            throw new IllegalArgumentException("an unhealthy result requires a reason");
        }
    }

    /** Creates a healthy result without a message. */
    public static ProbeResult healthy() {
        return new ProbeResult(CheckStatus.HEALTHY, null);
    }

    /** Creates a healthy result with an informational message (e.g. "HTTP 200 OK"). */
    public static ProbeResult healthy(String message) {
        return new ProbeResult(CheckStatus.HEALTHY, message);
    }

    /** Creates an unhealthy result with a short human-readable reason. */
    public static ProbeResult unhealthy(String reason) {
        return new ProbeResult(CheckStatus.UNHEALTHY, reason);
    }

    public boolean isHealthy() {
        return status == CheckStatus.HEALTHY;
    }
}
