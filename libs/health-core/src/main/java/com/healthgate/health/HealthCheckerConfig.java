package com.healthgate.health;

import java.time.Duration;

/**
 * Build-time configuration of a {@link HealthChecker}.
 *
 * @param globalTimeout   budget for a whole fan-out round; stragglers are reported TIMED_OUT
 * @param perCheckTimeout default budget for a single check, overridable per registration
 * @param mergePolicy     how readiness failures affect the overall status
 */
public record HealthCheckerConfig(
        Duration globalTimeout,
        Duration perCheckTimeout,
        MergePolicy mergePolicy
) {

    /** Default budget for a whole round (10 seconds). */
    public static final Duration DEFAULT_GLOBAL_TIMEOUT = Duration.ofSeconds(10);

    /** Default budget for an individual check (5 seconds). */
    public static final Duration DEFAULT_PER_CHECK_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Compact constructor: null values fall back to the defaults, non-positive durations are
     * rejected.
     */
    public HealthCheckerConfig {
        if (globalTimeout == null) {
            globalTimeout = DEFAULT_GLOBAL_TIMEOUT;
        }
        if (perCheckTimeout == null) {
            perCheckTimeout = DEFAULT_PER_CHECK_TIMEOUT;
        }
        if (mergePolicy == null) {
            mergePolicy = MergePolicy.LENIENT;
        }
        requirePositive(globalTimeout, "globalTimeout");
        requirePositive(perCheckTimeout, "perCheckTimeout");
    }

    public static HealthCheckerConfig defaults() {
        return new HealthCheckerConfig(null, null, null);
    }

    public HealthCheckerConfig withGlobalTimeout(Duration timeout) {
        return new HealthCheckerConfig(timeout, perCheckTimeout, mergePolicy);
    }

    public HealthCheckerConfig withPerCheckTimeout(Duration timeout) {
        return new HealthCheckerConfig(globalTimeout, timeout, mergePolicy);
    }

    public HealthCheckerConfig withMergePolicy(MergePolicy policy) {
        return new HealthCheckerConfig(globalTimeout, perCheckTimeout, policy);
    }

    static void requirePositive(Duration duration, String field) {
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(field + " must be positive");
        }
    }
}
