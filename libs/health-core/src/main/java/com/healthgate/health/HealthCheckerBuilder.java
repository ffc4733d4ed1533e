package com.healthgate.health;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Accumulates named checks and freezes them into an immutable {@link HealthChecker}.
 * <p>
 * Registration performs no I/O. Names are unique and case-sensitive; a duplicate fails with
 * {@link DuplicateCheckNameException} and leaves the earlier registration in place.
 * {@link #build(HealthCheckerConfig)} moves an immutable snapshot of the registrations into the
 * checker, which has no mutation API, so later use of this builder cannot affect it.
 * <p>
 * Not thread-safe; build the checker once at startup and share the result.
 */
public final class HealthCheckerBuilder {

    /** Instrumentation scope name used for the default tracer. */
    public static final String INSTRUMENTATION_NAME = "com.healthgate.health";

    private final Map<String, RegisteredCheck> checks = new LinkedHashMap<>();
    private Executor executor = ForkJoinPool.commonPool();
    private MeterRegistry meterRegistry = Metrics.globalRegistry;
    private Tracer tracer = OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME);
    private ReasonRedactor redactor = new ReasonRedactor();

    HealthCheckerBuilder() {
    }

    /**
     * Registers a check that runs under the configured per-check timeout.
     *
     * @throws DuplicateCheckNameException if the name is already registered
     */
    public HealthCheckerBuilder add(String name, CheckKind kind, HealthCheck check) {
        return add(name, kind, null, check);
    }

    /**
     * Registers a check with its own timeout, overriding the configured per-check default.
     *
     * @param timeout per-check budget, or null for the configured default
     * @throws DuplicateCheckNameException if the name is already registered
     */
    public HealthCheckerBuilder add(String name, CheckKind kind, Duration timeout, HealthCheck check) {
        RegisteredCheck registered = new RegisteredCheck(name, kind, timeout, check);
        if (checks.containsKey(name)) {
            throw new DuplicateCheckNameException(name);
        }
        checks.put(name, registered);
        return this;
    }

    public HealthCheckerBuilder liveness(String name, HealthCheck check) {
        return add(name, CheckKind.LIVENESS, check);
    }

    public HealthCheckerBuilder readiness(String name, HealthCheck check) {
        return add(name, CheckKind.READINESS, check);
    }

    /** Sets the shared scheduler probes are launched on. Defaults to the common pool. */
    public HealthCheckerBuilder executor(Executor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        this.executor = executor;
        return this;
    }

    public HealthCheckerBuilder meterRegistry(MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            throw new IllegalArgumentException("meterRegistry must not be null");
        }
        this.meterRegistry = meterRegistry;
        return this;
    }

    public HealthCheckerBuilder tracer(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
        return this;
    }

    public HealthCheckerBuilder redactor(ReasonRedactor redactor) {
        if (redactor == null) {
            throw new IllegalArgumentException("redactor must not be null");
        }
        this.redactor = redactor;
        return this;
    }

    /** Returns the number of checks registered so far. */
    public int size() {
        return checks.size();
    }

    /** Builds a checker with {@link HealthCheckerConfig#defaults()}. */
    public HealthChecker build() {
        return build(HealthCheckerConfig.defaults());
    }

    /**
     * Freezes the registered checks into a new checker. An empty checker is legal and always
     * reports {@link HealthStatus#HEALTHY}.
     */
    public HealthChecker build(HealthCheckerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        return new HealthChecker(
                List.copyOf(checks.values()),
                config,
                executor,
                new HealthCheckMetrics(meterRegistry),
                new SpanHelper(tracer),
                redactor);
    }
}
