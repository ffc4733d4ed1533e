package com.healthgate.health;

import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for a single dependency probe.
 * <p>
 * Implementations capture their backend handle (pool, connection factory, client) at
 * construction and perform exactly one lightweight round-trip per call, without mutating
 * state visible to other clients. Failures should be reported as
 * {@link ProbeResult#unhealthy(String)}; anything that still escapes (a thrown exception,
 * an exceptionally completed future) is caught by {@link HealthChecker} and converted.
 * <p>
 * Example usage:
 * <pre>{@code
 * HealthCheck postgres = () -> CompletableFuture.supplyAsync(() -> {
 *     try (Connection c = dataSource.getConnection()) {
 *         return c.isValid(2) ? ProbeResult.healthy() : ProbeResult.unhealthy("connection invalid");
 *     } catch (SQLException e) {
 *         return ProbeResult.unhealthy("connection failed: " + e.getMessage());
 *     }
 * });
 * }</pre>
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Performs the probe and returns the result asynchronously.
     *
     * @return a future that completes with the probe result
     */
    CompletableFuture<ProbeResult> check();
}
