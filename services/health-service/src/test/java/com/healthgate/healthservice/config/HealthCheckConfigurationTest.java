package com.healthgate.healthservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.healthgate.health.CheckStatus;
import com.healthgate.health.HealthChecker;
import com.healthgate.health.HealthReport;
import com.healthgate.health.HealthStatus;
import com.healthgate.health.ProbeResult;
import com.healthgate.probes.HealthChecks;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Unit tests for the {@link HealthCheckConfiguration} executor wiring.
 *
 * <p>WHY: Liveness must stay HEALTHY while readiness dependencies hang. Checks stuck on a hung
 * backend keep their threads after a run gives up on them, so the executor must not let later checks
 * wait in a queue behind them.
 */
@DisplayName("HealthCheckConfiguration")
class HealthCheckConfigurationTest {

    private final CountDownLatch backendRecovered = new CountDownLatch(1);
    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        backendRecovered.countDown();
        if (executor != null) {
            executor.shutdown();
        }
    }

    private ThreadPoolTaskExecutor executor(int poolSize, int maxPoolSize) {
        var properties = new HealthProperties("orders-service", null, Duration.ofMillis(600),
                Duration.ofMillis(300), null, null, null, poolSize, maxPoolSize);
        executor = new HealthCheckConfiguration().healthProbeExecutor(properties);
        executor.initialize();
        return executor;
    }

    private HealthChecker checkerWithHungDependencies(ThreadPoolTaskExecutor executor) {
        var builder = HealthChecker.builder()
                .executor(executor)
                .liveness(HealthCheckRegistrar.PROCESS_CHECK, HealthChecks.alive());
        for (String name : List.of("database", "cache", "billing")) {
            builder.readiness(name, HealthChecks.custom(() -> {
                backendRecovered.await();
                return ProbeResult.healthy("recovered");
            }));
        }
        return builder.build(new HealthProperties("orders-service", null, Duration.ofMillis(600),
                Duration.ofMillis(300), null, null, null, 0, 0).toCheckerConfig());
    }

    @Test
    @DisplayName("keeps liveness healthy when hung readiness checks hold more threads than the core pool")
    void livenessSurvivesHungReadinessChecks() {
        HealthChecker checker = checkerWithHungDependencies(executor(2, 64));

        List<CompletableFuture<HealthReport>> scrapes = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            scrapes.add(CompletableFuture.supplyAsync(checker::checkReadiness));
        }
        scrapes.forEach(scrape -> assertThat(scrape.orTimeout(5, TimeUnit.SECONDS).join().status())
                .isEqualTo(HealthStatus.DEGRADED));
        assertThat(executor.getActiveCount()).isGreaterThanOrEqualTo(9);

        HealthReport liveness = checker.checkLiveness();

        assertThat(liveness.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(liveness.outcomes()).singleElement().satisfies(outcome -> {
            assertThat(outcome.name()).isEqualTo(HealthCheckRegistrar.PROCESS_CHECK);
            assertThat(outcome.status()).isEqualTo(CheckStatus.HEALTHY);
        });
    }

    @Test
    @DisplayName("rejects a check at once instead of queueing it when every thread is busy")
    void rejectsInsteadOfQueueing() {
        HealthChecker checker = checkerWithHungDependencies(executor(1, 3));

        checker.checkReadiness();
        long started = System.nanoTime();
        HealthReport liveness = checker.checkLiveness();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(liveness.outcomes()).singleElement()
                .satisfies(outcome -> assertThat(outcome.status()).isEqualTo(CheckStatus.UNHEALTHY));
        assertThat(elapsed).isLessThan(Duration.ofMillis(300));
    }
}
