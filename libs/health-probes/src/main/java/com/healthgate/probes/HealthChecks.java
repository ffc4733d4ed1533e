package com.healthgate.probes;

import com.healthgate.health.HealthCheck;
import com.healthgate.health.ProbeResult;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import javax.sql.DataSource;

/**
 * Factory methods for the probes shipped with HealthGate.
 * <pre>{@code
 * HealthChecker checker = HealthChecker.builder()
 *         .liveness("process", HealthChecks.alive())
 *         .readiness("database", HealthChecks.jdbc(dataSource))
 *         .readiness("cache", HealthChecks.redis(redisConnectionFactory))
 *         .build();
 * }</pre>
 */
public final class HealthChecks {

    private HealthChecks() {
        // Utility class
    }

    /** Process self-check; healthy whenever the process can answer. */
    public static HealthCheck alive() {
        return () -> CompletableFuture.completedFuture(ProbeResult.healthy("alive"));
    }

    /** {@code SELECT 1} against the given pool. */
    public static HealthCheck jdbc(DataSource dataSource) {
        return new JdbcHealthCheck(dataSource);
    }

    /** {@code PING} over the given connection factory. */
    public static HealthCheck redis(RedisConnectionFactory connectionFactory) {
        return new RedisHealthCheck(connectionFactory);
    }

    /** {@code GET url}, healthy when the response status equals {@code expectedStatus}. */
    public static HealthCheck http(RestClient restClient, String url, int expectedStatus) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null or blank");
        }
        return new HttpHealthCheck(restClient, URI.create(url), expectedStatus);
    }

    /**
     * Wraps a blocking closure as a probe. Exceptions thrown by the closure become unhealthy
     * results.
     */
    public static HealthCheck custom(Callable<ProbeResult> closure) {
        if (closure == null) {
            throw new IllegalArgumentException("closure must not be null");
        }
        return new BlockingHealthCheck() {
            @Override
            protected ProbeResult probe() throws Exception {
                ProbeResult result = closure.call();
                if (result == null) {
                    throw new IllegalStateException("custom probe returned null");
                }
                return result;
            }
        };
    }

    /** Adapts a non-blocking supplier; the aggregator sandboxes whatever it throws or returns. */
    public static HealthCheck async(Supplier<CompletableFuture<ProbeResult>> supplier) {
        if (supplier == null) {
            throw new IllegalArgumentException("supplier must not be null");
        }
        return supplier::get;
    }
}
