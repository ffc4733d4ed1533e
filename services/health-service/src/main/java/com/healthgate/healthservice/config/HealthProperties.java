package com.healthgate.healthservice.config;

import com.healthgate.health.CheckKind;
import com.healthgate.health.HealthCheckerConfig;
import com.healthgate.health.MergePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the health routes and the checker behind them.
 *
 * <p>Spring Boot binds YAML/env properties to this record at startup and validates them via Bean
 * Validation. Invalid config fails the startup. Everything here is read once, when the checker is
 * built; nothing is mutable at runtime.
 *
 * <pre>
 * healthgate:
 *   health:
 *     service-name: orders-service
 *     service-version: 1.4.0
 *     global-timeout: 2s
 *     per-check-timeout: 1s
 *     merge-policy: strict
 *     check-timeouts:
 *       database: 500ms
 *     http:
 *       billing:
 *         url: http://billing:8080/health
 *         expected-status: 200
 * </pre>
 *
 * @param serviceName Name reported in every health body. Required.
 * @param serviceVersion Version reported in every health body. Optional.
 * @param globalTimeout Budget of one fan-out round (default 10s).
 * @param perCheckTimeout Default budget of one check (default 5s).
 * @param mergePolicy lenient (readiness failure = degraded) or strict (= unhealthy).
 * @param checkTimeouts Per-check overrides of {@code perCheckTimeout}, keyed by check name.
 * @param http Downstream HTTP dependencies, keyed by check name.
 * @param probePoolSize Threads the probe executor keeps alive when idle (default 8).
 * @param probeMaxPoolSize Threads the probe executor may grow to before it rejects (default 256).
 */
@ConfigurationProperties(prefix = "healthgate.health")
@Validated
public record HealthProperties(
        @NotBlank String serviceName,
        String serviceVersion,
        Duration globalTimeout,
        Duration perCheckTimeout,
        MergePolicy mergePolicy,
        Map<String, Duration> checkTimeouts,
        Map<String, @Valid HttpDependency> http,
        int probePoolSize,
        int probeMaxPoolSize) {

    /** Default core size of the probe executor. */
    public static final int DEFAULT_PROBE_POOL_SIZE = 8;

    /** Default maximum size of the probe executor. */
    public static final int DEFAULT_PROBE_MAX_POOL_SIZE = 256;

    /**
     * Compact constructor: applies defaults for optional fields. Runs BEFORE Bean Validation, so
     * defaults satisfy constraints.
     */
    public HealthProperties {
        if (globalTimeout == null) {
            globalTimeout = HealthCheckerConfig.DEFAULT_GLOBAL_TIMEOUT;
        }
        if (perCheckTimeout == null) {
            perCheckTimeout = HealthCheckerConfig.DEFAULT_PER_CHECK_TIMEOUT;
        }
        if (mergePolicy == null) {
            mergePolicy = MergePolicy.LENIENT;
        }
        checkTimeouts = checkTimeouts == null ? Map.of() : Map.copyOf(checkTimeouts);
        http = http == null ? Map.of() : Map.copyOf(http);
        if (probePoolSize <= 0) {
            probePoolSize = DEFAULT_PROBE_POOL_SIZE;
        }
        if (probeMaxPoolSize <= 0) {
            probeMaxPoolSize = DEFAULT_PROBE_MAX_POOL_SIZE;
        }
        probeMaxPoolSize = Math.max(probeMaxPoolSize, probePoolSize);
    }

    /** Returns the checker configuration these properties describe. */
    public HealthCheckerConfig toCheckerConfig() {
        return new HealthCheckerConfig(globalTimeout, perCheckTimeout, mergePolicy);
    }

    /** Returns the per-check timeout override for the named check, or null for the default. */
    public Duration timeoutFor(String checkName) {
        return checkTimeouts.get(checkName);
    }

    /**
     * A downstream service probed over HTTP.
     *
     * @param url Absolute URL to GET. Required.
     * @param expectedStatus Status that counts as healthy (default 200).
     * @param kind Check kind (default readiness).
     */
    public record HttpDependency(@NotBlank String url, int expectedStatus, CheckKind kind) {

        public HttpDependency {
            if (expectedStatus <= 0) {
                expectedStatus = 200;
            }
            if (kind == null) {
                kind = CheckKind.READINESS;
            }
        }
    }
}
