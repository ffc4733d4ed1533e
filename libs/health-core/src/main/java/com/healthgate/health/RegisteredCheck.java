package com.healthgate.health;

import java.time.Duration;

/**
 * A check as held by the frozen {@link HealthChecker}.
 *
 * @param name    unique, case-sensitive name
 * @param kind    liveness, readiness or both
 * @param timeout per-check override of the configured default (nullable)
 * @param check   the probe
 */
public record RegisteredCheck(String name, CheckKind kind, Duration timeout, HealthCheck check) {

    public RegisteredCheck {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        if (timeout != null) {
            HealthCheckerConfig.requirePositive(timeout, "timeout");
        }
    }

    /**
     * Returns the budget this check runs under: its own override, else the configured default,
     * never more than the global timeout.
     */
    public Duration effectiveTimeout(HealthCheckerConfig config) {
        Duration own = timeout != null ? timeout : config.perCheckTimeout();
        return own.compareTo(config.globalTimeout()) > 0 ? config.globalTimeout() : own;
    }
}
