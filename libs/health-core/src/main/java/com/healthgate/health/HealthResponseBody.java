package com.healthgate.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON body of a health route.
 * <pre>
 * {
 *   "status": "degraded",
 *   "service": "orders-service",
 *   "version": "1.4.0",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "checks": [
 *     {"name": "db", "kind": "readiness", "status": "healthy", "latency_ms": 4},
 *     {"name": "cache", "kind": "readiness", "status": "unhealthy", "reason": "refused", "latency_ms": 5}
 *   ]
 * }
 * </pre>
 *
 * @param status    overall status, lowercase
 * @param service   service name
 * @param version   service version (omitted when not configured)
 * @param timestamp ISO-8601 time the report was generated
 * @param checks    per-check entries in registration order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponseBody(
        String status,
        String service,
        String version,
        String timestamp,
        List<CheckEntry> checks
) {

    public HealthResponseBody {
        checks = List.copyOf(checks);
    }

    /**
     * One check in the body.
     *
     * @param name      check name
     * @param kind      liveness, readiness or both
     * @param status    healthy, unhealthy or timed_out
     * @param reason    failure reason (only for failed checks)
     * @param message   informational note (only for healthy checks that reported one)
     * @param latencyMs probe latency in milliseconds
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CheckEntry(
            String name,
            String kind,
            String status,
            String reason,
            String message,
            @JsonProperty("latency_ms") long latencyMs
    ) {
    }
}
