package com.healthgate.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.healthgate.health.testing.InMemoryHealthCheck;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HealthEndpoint")
class HealthEndpointTest {

    private HealthEndpoint endpoint(MergePolicy policy) {
        HealthChecker checker = HealthChecker.builder()
                .readiness("db", new InMemoryHealthCheck().setDelay(Duration.ofMillis(5)))
                .readiness("cache", new InMemoryHealthCheck().setUnhealthy("refused").setDelay(Duration.ofMillis(5)))
                .liveness("proc", new InMemoryHealthCheck().setDelay(Duration.ofMillis(1)))
                .build(new HealthCheckerConfig(Duration.ofSeconds(1), null, policy));
        return new HealthEndpoint(checker, new HealthReporter("orders-service", null));
    }

    @Test
    @DisplayName("lenient endpoint answers 200 on every route")
    void lenientAnswersOk() {
        HealthEndpoint endpoint = endpoint(MergePolicy.LENIENT);

        HealthResponse full = endpoint.full();
        assertThat(full.httpStatus()).isEqualTo(200);
        assertThat(full.body().status()).isEqualTo("degraded");
        assertThat(full.body().checks()).extracting(HealthResponseBody.CheckEntry::name)
                .containsExactly("db", "cache", "proc");

        HealthResponse ready = endpoint.readiness();
        assertThat(ready.httpStatus()).isEqualTo(200);
        assertThat(ready.body().checks()).extracting(HealthResponseBody.CheckEntry::name)
                .containsExactly("db", "cache");

        HealthResponse live = endpoint.liveness();
        assertThat(live.httpStatus()).isEqualTo(200);
        assertThat(live.body().status()).isEqualTo("healthy");
        assertThat(live.body().checks()).extracting(HealthResponseBody.CheckEntry::name)
                .containsExactly("proc");
    }

    @Test
    @DisplayName("strict endpoint refuses readiness but stays live")
    void strictRefusesReadiness() {
        HealthEndpoint endpoint = endpoint(MergePolicy.STRICT);

        assertThat(endpoint.readiness().httpStatus()).isEqualTo(503);
        assertThat(endpoint.full().httpStatus()).isEqualTo(503);
        assertThat(endpoint.liveness().httpStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("should reject null collaborators and mode")
    void shouldRejectNulls() {
        var reporter = new HealthReporter("svc", null);
        var checker = HealthChecker.builder().build();

        assertThatThrownBy(() -> new HealthEndpoint(null, reporter)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HealthEndpoint(checker, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HealthEndpoint(checker, reporter).respond(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
