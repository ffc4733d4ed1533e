package com.healthgate.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.healthgate.health.testing.InMemoryHealthCheck;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link HealthCheckerConfig} defaults and validation, and for how
 * {@link RegisteredCheck} derives its effective timeout from it.
 */
@DisplayName("HealthCheckerConfig")
class HealthCheckerConfigTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("should fall back to defaults for null values")
        void shouldApplyDefaults() {
            var config = HealthCheckerConfig.defaults();

            assertThat(config.globalTimeout()).isEqualTo(Duration.ofSeconds(10));
            assertThat(config.perCheckTimeout()).isEqualTo(Duration.ofSeconds(5));
            assertThat(config.mergePolicy()).isEqualTo(MergePolicy.LENIENT);
        }

        @Test
        @DisplayName("withers should replace a single field")
        void withersReplaceOneField() {
            var config = HealthCheckerConfig.defaults()
                    .withGlobalTimeout(Duration.ofSeconds(2))
                    .withPerCheckTimeout(Duration.ofMillis(500))
                    .withMergePolicy(MergePolicy.STRICT);

            assertThat(config).isEqualTo(
                    new HealthCheckerConfig(Duration.ofSeconds(2), Duration.ofMillis(500), MergePolicy.STRICT));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should reject zero or negative timeouts")
        void shouldRejectNonPositive() {
            assertThatThrownBy(() -> new HealthCheckerConfig(Duration.ZERO, null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("globalTimeout must be positive");
            assertThatThrownBy(() -> new HealthCheckerConfig(null, Duration.ofMillis(-1), null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("perCheckTimeout must be positive");
        }
    }

    @Nested
    @DisplayName("Effective timeout")
    class EffectiveTimeout {

        private final HealthCheckerConfig config =
                new HealthCheckerConfig(Duration.ofSeconds(2), Duration.ofMillis(500), MergePolicy.LENIENT);

        @Test
        @DisplayName("should use the per-check default without an override")
        void shouldUseDefault() {
            var check = new RegisteredCheck("db", CheckKind.READINESS, null, new InMemoryHealthCheck());

            assertThat(check.effectiveTimeout(config)).isEqualTo(Duration.ofMillis(500));
        }

        @Test
        @DisplayName("should prefer the check's own override")
        void shouldPreferOverride() {
            var check = new RegisteredCheck("db", CheckKind.READINESS, Duration.ofSeconds(1), new InMemoryHealthCheck());

            assertThat(check.effectiveTimeout(config)).isEqualTo(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("should cap at the global timeout")
        void shouldCapAtGlobal() {
            var check = new RegisteredCheck("db", CheckKind.READINESS, Duration.ofSeconds(30), new InMemoryHealthCheck());

            assertThat(check.effectiveTimeout(config)).isEqualTo(Duration.ofSeconds(2));
        }
    }
}
