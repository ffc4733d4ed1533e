package com.healthgate.health;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;

/**
 * Records Micrometer meters for health check runs.
 * <p>
 * Each outcome feeds the {@value #CHECK_LATENCY} timer, tagged by check name and status; each
 * run increments {@value #AGGREGATE_RUNS}, tagged by filter and overall status.
 */
public final class HealthCheckMetrics {

    /** Timer of per-check latency. */
    public static final String CHECK_LATENCY = "healthgate.check.latency";

    /** Counter of aggregation runs. */
    public static final String AGGREGATE_RUNS = "healthgate.aggregate.runs";

    /** Tag key for the check name. */
    public static final String TAG_CHECK = "check";

    /** Tag key for a check or overall status. */
    public static final String TAG_STATUS = "status";

    /** Tag key for the kind filter of a run. */
    public static final String TAG_FILTER = "filter";

    private final MeterRegistry registry;

    /**
     * Creates metrics bound to the given registry.
     *
     * @param registry the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     */
    public HealthCheckMetrics(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /** Records the latency of one check outcome. */
    public void recordCheck(CheckOutcome outcome) {
        Timer.builder(CHECK_LATENCY)
                .description("Latency of individual health check probes")
                .tags(TAG_CHECK, outcome.name(), TAG_STATUS, tagValue(outcome.status()))
                .register(registry)
                .record(outcome.latency());
    }

    /** Counts one aggregation run. */
    public void recordRun(KindFilter filter, HealthStatus overall) {
        Counter.builder(AGGREGATE_RUNS)
                .description("Number of health check aggregation runs")
                .tags(TAG_FILTER, tagValue(filter), TAG_STATUS, tagValue(overall))
                .register(registry)
                .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    private static String tagValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
