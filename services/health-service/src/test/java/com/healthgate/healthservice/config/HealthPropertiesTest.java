package com.healthgate.healthservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.healthgate.health.CheckKind;
import com.healthgate.health.HealthCheckerConfig;
import com.healthgate.health.MergePolicy;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link HealthProperties} record.
 *
 * <p>WHY: Validates the compact constructor defaults and the Bean Validation constraints without
 * starting a Spring context.
 */
@DisplayName("HealthProperties")
class HealthPropertiesTest {

    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    @Test
    @DisplayName("applies defaults for optional fields")
    void appliesDefaults() {
        var props = new HealthProperties("orders-service", null, null, null, null, null, null, 0, 0);

        assertThat(props.globalTimeout()).isEqualTo(HealthCheckerConfig.DEFAULT_GLOBAL_TIMEOUT);
        assertThat(props.perCheckTimeout()).isEqualTo(HealthCheckerConfig.DEFAULT_PER_CHECK_TIMEOUT);
        assertThat(props.mergePolicy()).isEqualTo(MergePolicy.LENIENT);
        assertThat(props.checkTimeouts()).isEmpty();
        assertThat(props.http()).isEmpty();
        assertThat(props.probePoolSize()).isEqualTo(HealthProperties.DEFAULT_PROBE_POOL_SIZE);
        assertThat(props.probeMaxPoolSize()).isEqualTo(HealthProperties.DEFAULT_PROBE_MAX_POOL_SIZE);
    }

    @Test
    @DisplayName("never lets the maximum pool size fall below the core size")
    void raisesMaxPoolSizeToCoreSize() {
        var props = new HealthProperties("orders-service", null, null, null, null, null, null, 32, 4);

        assertThat(props.probeMaxPoolSize()).isEqualTo(32);
    }

    @Test
    @DisplayName("converts to checker configuration")
    void convertsToCheckerConfig() {
        var props = new HealthProperties("orders-service", "1.0", Duration.ofSeconds(2),
                Duration.ofMillis(750), MergePolicy.STRICT, null, null, 4, 16);

        assertThat(props.toCheckerConfig()).isEqualTo(
                new HealthCheckerConfig(Duration.ofSeconds(2), Duration.ofMillis(750), MergePolicy.STRICT));
    }

    @Test
    @DisplayName("returns per-check timeout overrides by name")
    void returnsTimeoutOverrides() {
        var props = new HealthProperties("orders-service", null, null, null, null,
                Map.of("database", Duration.ofMillis(300)), null, 0, 0);

        assertThat(props.timeoutFor("database")).isEqualTo(Duration.ofMillis(300));
        assertThat(props.timeoutFor("cache")).isNull();
    }

    @Test
    @DisplayName("defaults HTTP dependency status to 200 and kind to readiness")
    void defaultsHttpDependency() {
        var dependency = new HealthProperties.HttpDependency("http://billing:8080/health", 0, null);

        assertThat(dependency.expectedStatus()).isEqualTo(200);
        assertThat(dependency.kind()).isEqualTo(CheckKind.READINESS);
    }

    @Test
    @DisplayName("rejects blank service name")
    void rejectsBlankServiceName() {
        var props = new HealthProperties(" ", null, null, null, null, null, null, 0, 0);

        assertThat(validator.validate(props))
                .isNotEmpty()
                .allSatisfy(v -> assertThat(v.getPropertyPath().toString()).isEqualTo("serviceName"));
    }

    @Test
    @DisplayName("rejects HTTP dependency without URL")
    void rejectsHttpDependencyWithoutUrl() {
        var props = new HealthProperties("orders-service", null, null, null, null, null,
                Map.of("billing", new HealthProperties.HttpDependency("", 200, null)), 0, 0);

        assertThat(validator.validate(props))
                .isNotEmpty()
                .allSatisfy(v -> assertThat(v.getPropertyPath().toString()).contains("billing").endsWith("url"));
    }
}
