package com.healthgate.probes;

import com.healthgate.health.HealthCheck;
import com.healthgate.health.ProbeResult;

import java.util.concurrent.CompletableFuture;

/**
 * Base class for probes backed by a blocking client (JDBC, a pooled Redis connection, a
 * synchronous HTTP client).
 * <p>
 * {@link #probe()} runs on the calling thread; {@link com.healthgate.health.HealthChecker}
 * calls {@link #check()} from its probe executor, so a slow round-trip only occupies that
 * executor's thread. Anything {@link #probe()} throws becomes an unhealthy result.
 */
public abstract class BlockingHealthCheck implements HealthCheck {

    @Override
    public final CompletableFuture<ProbeResult> check() {
        ProbeResult result;
        try {
            result = probe();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = ProbeResult.unhealthy("probe interrupted");
        } catch (Exception e) {
            result = ProbeResult.unhealthy("probe failed: " + describe(e));
        }
        return CompletableFuture.completedFuture(result);
    }

    /**
     * Performs exactly one round-trip to the backend.
     *
     * @return the probe result, never null
     * @throws Exception on unexpected failures; converted to an unhealthy result
     */
    protected abstract ProbeResult probe() throws Exception;

    /**
     * Formats an exception as {@code "<SimpleClassName>: <message>"}, or just the class name
     * when there is no message. Anonymous classes fall back to the binary class name.
     */
    protected static String describe(Throwable error) {
        String message = error.getMessage();
        String type = error.getClass().getSimpleName();
        if (type.isEmpty()) {
            type = error.getClass().getName();
        }
        return message == null || message.isBlank() ? type : type + ": " + message;
    }
}
