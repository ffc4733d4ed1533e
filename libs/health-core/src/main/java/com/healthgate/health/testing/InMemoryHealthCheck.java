package com.healthgate.health.testing;

import com.healthgate.health.CheckStatus;
import com.healthgate.health.HealthCheck;
import com.healthgate.health.ProbeResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A controllable health check for testing aggregation logic.
 * <p>
 * Allows tests to set the reported status, simulate slow probes and inject failures.
 * Placed in {@code src/main/java} for cross-module test use.
 */
public final class InMemoryHealthCheck implements HealthCheck {

    private final AtomicReference<CheckStatus> status;
    private final AtomicReference<String> message;
    private final AtomicReference<Duration> delay;
    private final AtomicReference<RuntimeException> failure;
    private final AtomicInteger invocations = new AtomicInteger();

    /**
     * Creates an InMemoryHealthCheck that starts as HEALTHY with no delay.
     */
    public InMemoryHealthCheck() {
        this.status = new AtomicReference<>(CheckStatus.HEALTHY);
        this.message = new AtomicReference<>(null);
        this.delay = new AtomicReference<>(Duration.ZERO);
        this.failure = new AtomicReference<>(null);
    }

    @Override
    public CompletableFuture<ProbeResult> check() {
        invocations.incrementAndGet();
        RuntimeException toThrow = failure.get();
        if (toThrow != null) {
            throw toThrow;
        }
        ProbeResult result = new ProbeResult(status.get(), message.get());
        Duration wait = delay.get();
        if (wait.isZero()) {
            return CompletableFuture.completedFuture(result);
        }
        Executor delayed = CompletableFuture.delayedExecutor(wait.toMillis(), TimeUnit.MILLISECONDS);
        return CompletableFuture.supplyAsync(() -> result, delayed);
    }

    /**
     * Sets this check to HEALTHY.
     */
    public InMemoryHealthCheck setHealthy() {
        this.status.set(CheckStatus.HEALTHY);
        this.message.set(null);
        this.failure.set(null);
        return this;
    }

    /**
     * Sets this check to UNHEALTHY with the given reason.
     */
    public InMemoryHealthCheck setUnhealthy(String reason) {
        this.status.set(CheckStatus.UNHEALTHY);
        this.message.set(reason);
        this.failure.set(null);
        return this;
    }

    /**
     * Makes {@link #check()} throw the given exception instead of returning a future.
     */
    public InMemoryHealthCheck setFailing(RuntimeException exception) {
        this.failure.set(exception);
        return this;
    }

    /**
     * Delays completion of the returned future, without blocking the calling thread.
     */
    public InMemoryHealthCheck setDelay(Duration delay) {
        this.delay.set(delay);
        return this;
    }

    /**
     * Returns how often {@link #check()} has been called.
     */
    public int invocations() {
        return invocations.get();
    }
}
