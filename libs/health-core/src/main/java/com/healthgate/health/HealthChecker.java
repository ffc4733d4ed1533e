package com.healthgate.health;

import io.opentelemetry.api.trace.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Immutable aggregator that runs registered {@link HealthCheck}s concurrently and merges their
 * outcomes into a {@link HealthReport}.
 * <p>
 * Every selected probe is launched on the shared executor before any result is awaited. Each
 * probe runs under its own timeout ({@link RegisteredCheck#effectiveTimeout}); the whole round
 * runs under {@link HealthCheckerConfig#globalTimeout()}. Probe failures of any shape become
 * {@link CheckStatus#UNHEALTHY} outcomes and expired budgets become
 * {@link CheckStatus#TIMED_OUT}, so a broken dependency never fails the run. Probes still
 * outstanding at the global deadline are abandoned: the aggregator stops waiting and ignores
 * their late results, but does not abort the remote operation.
 * <p>
 * Outcomes are reported in registration order. Instances are created by
 * {@link HealthCheckerBuilder} and are safe for concurrent use without external locking.
 */
public final class HealthChecker {

    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

    /** MDC key holding the name of the check whose probe is running on the current thread. */
    public static final String MDC_CHECK_NAME = "healthCheck";

    /** Span name of one aggregation run. */
    public static final String SPAN_NAME = "health.check";

    private final List<RegisteredCheck> checks;
    private final HealthCheckerConfig config;
    private final Executor executor;
    private final HealthCheckMetrics metrics;
    private final SpanHelper spans;
    private final ReasonRedactor redactor;

    HealthChecker(List<RegisteredCheck> checks, HealthCheckerConfig config, Executor executor,
                  HealthCheckMetrics metrics, SpanHelper spans, ReasonRedactor redactor) {
        this.checks = List.copyOf(checks);
        this.config = config;
        this.executor = executor;
        this.metrics = metrics;
        this.spans = spans;
        this.redactor = redactor;
    }

    /** Starts a new builder. */
    public static HealthCheckerBuilder builder() {
        return new HealthCheckerBuilder();
    }

    /** Runs every registered check. */
    public HealthReport checkAll() {
        return check(KindFilter.ALL);
    }

    /** Runs the liveness-counted checks. */
    public HealthReport checkLiveness() {
        return check(KindFilter.LIVENESS);
    }

    /** Runs the readiness-counted checks. */
    public HealthReport checkReadiness() {
        return check(KindFilter.READINESS);
    }

    /**
     * Runs the checks selected by the filter and merges their outcomes.
     * <p>
     * Returns immediately with {@link HealthStatus#HEALTHY} and no outcomes if nothing matches.
     * Never throws because of a probe; the call returns within the global timeout plus
     * scheduling overhead.
     *
     * @param filter which checks take part
     * @return a fresh report owned by the caller
     */
    public HealthReport check(KindFilter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter must not be null");
        }
        List<RegisteredCheck> selected = checks.stream()
                .filter(c -> filter.matches(c.kind()))
                .toList();
        if (selected.isEmpty()) {
            return HealthReport.empty(Instant.now());
        }
        return spans.inSpan(SPAN_NAME,
                Map.of("health.filter", filter.name(), "health.checks", String.valueOf(selected.size())),
                () -> run(filter, selected));
    }

    /** Returns the registered checks in registration order. */
    public List<RegisteredCheck> checks() {
        return checks;
    }

    public HealthCheckerConfig config() {
        return config;
    }

    public int size() {
        return checks.size();
    }

    private HealthReport run(KindFilter filter, List<RegisteredCheck> selected) {
        long startNanos = System.nanoTime();

        // Fan out: every probe is launched before any result is awaited
        AtomicBoolean finished = new AtomicBoolean();
        List<CompletableFuture<CheckOutcome>> futures = new ArrayList<>(selected.size());
        for (RegisteredCheck check : selected) {
            futures.add(launch(check, finished));
        }

        // Outcome futures never complete exceptionally, so join only returns or times out
        long globalMs = config.globalTimeout().toMillis();
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .completeOnTimeout(null, globalMs, TimeUnit.MILLISECONDS)
                .join();
        // Stragglers completing from here on belong to no report and are not logged
        finished.set(true);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        List<CheckOutcome> outcomes = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            RegisteredCheck check = selected.get(i);
            CheckOutcome outcome = futures.get(i).getNow(null);
            if (outcome == null) {
                outcome = CheckOutcome.timedOut(check.name(), check.kind(),
                        "global timeout of " + globalMs + "ms exceeded", elapsed);
                log.warn("Health check '{}' abandoned after global timeout of {}ms", check.name(), globalMs);
            }
            outcomes.add(outcome);
            metrics.recordCheck(outcome);
        }

        HealthStatus overall = config.mergePolicy().merge(outcomes);
        metrics.recordRun(filter, overall);
        Span.current().setAttribute("health.status", overall.name());
        log.debug("Health check run [{}] finished with {} ({} checks, {}ms)",
                filter, overall, outcomes.size(), elapsed.toMillis());
        return new HealthReport(overall, outcomes, Instant.now());
    }

    private CompletableFuture<CheckOutcome> launch(RegisteredCheck check, AtomicBoolean finished) {
        Duration timeout = check.effectiveTimeout(config);
        long launchedAt = System.nanoTime();
        CompletableFuture<ProbeResult> probe;
        try {
            probe = CompletableFuture
                    .supplyAsync(CorrelationContextHolder.propagate(() -> invoke(check)), executor)
                    .thenCompose(Function.identity());
        } catch (RuntimeException e) {
            // Executor refused the task (saturated or shut down)
            probe = CompletableFuture.failedFuture(e);
        }
        return probe
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) ->
                        toOutcome(check, timeout, result, error, Duration.ofNanos(System.nanoTime() - launchedAt),
                                finished));
    }

    private CompletableFuture<ProbeResult> invoke(RegisteredCheck check) {
        MDC.put(MDC_CHECK_NAME, check.name());
        try {
            CompletableFuture<ProbeResult> result = check.check().check();
            if (result == null) {
                throw new IllegalStateException("probe returned no future");
            }
            return result;
        } finally {
            MDC.remove(MDC_CHECK_NAME);
        }
    }

    private CheckOutcome toOutcome(RegisteredCheck check, Duration timeout, ProbeResult result,
                                   Throwable error, Duration latency, AtomicBoolean finished) {
        boolean observed = !finished.get();
        if (error == null) {
            if (result == null) {
                if (observed) {
                    log.warn("Health check '{}' completed without a result", check.name());
                }
                return CheckOutcome.unhealthy(check.name(), check.kind(), "probe completed without a result", latency);
            }
            if (!result.isHealthy() && observed) {
                log.warn("Health check '{}' is unhealthy: {}", check.name(), redactor.redact(result.message()));
            }
            return new CheckOutcome(check.name(), check.kind(), result.status(),
                    redactor.redact(result.message()), latency);
        }
        // orTimeout completes this stage with a bare TimeoutException; probe failures arrive
        // wrapped in CompletionException by thenCompose
        if (error instanceof TimeoutException) {
            if (observed) {
                log.warn("Health check '{}' timed out after {}ms", check.name(), timeout.toMillis());
            }
            return CheckOutcome.timedOut(check.name(), check.kind(),
                    "timed out after " + timeout.toMillis() + "ms", latency);
        }
        String reason = redactor.redact(describe(unwrap(error)));
        if (observed) {
            log.warn("Health check '{}' failed: {}", check.name(), reason);
        }
        return CheckOutcome.unhealthy(check.name(), check.kind(), reason, latency);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        String type = error.getClass().getSimpleName();
        if (type.isEmpty()) {
            type = error.getClass().getName();
        }
        return message == null || message.isBlank() ? type : type + ": " + message;
    }
}
