package io.authflow.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.authflow.core.condition.RegexGuard;
import io.authflow.core.execution.StepGuard;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class AuthFlowConfigTest {

    @Test
    void shouldUseGuardDefaults() {
        AuthFlowConfig config = new AuthFlowConfig();

        assertThat(config.getMaxRequestsPerWindow())
                .isEqualTo(StepGuard.DEFAULT_MAX_REQUESTS_PER_WINDOW);
        assertThat(config.getRateLimitWindow()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getMaxTimestampHistory()).isEqualTo(100);
        assertThat(config.getSessionTimeout()).isEqualTo(Duration.ofMinutes(30));
        assertThat(config.getMaxVisitsPerNode()).isEqualTo(3);
        assertThat(config.getMaxTotalNodes()).isEqualTo(50);
        assertThat(config.getMaxVisitedHistory()).isEqualTo(200);
        assertThat(config.getRegexStepBudget()).isEqualTo(RegexGuard.DEFAULT_STEP_BUDGET);
    }

    @Test
    void shouldBuildFluently() {
        AuthFlowConfig config =
                AuthFlowConfig.builder()
                        .maxRequestsPerWindow(10)
                        .rateLimitWindow(Duration.ofSeconds(30))
                        .sessionTimeout(Duration.ofMinutes(5))
                        .maxVisitsPerNode(2)
                        .maxTotalNodes(20)
                        .maxVisitedHistory(40)
                        .maxTimestampHistory(15)
                        .regexStepBudget(5_000)
                        .build();

        assertThat(config.getMaxRequestsPerWindow()).isEqualTo(10);
        assertThat(config.getRateLimitWindow()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getSessionTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.getMaxVisitsPerNode()).isEqualTo(2);
        assertThat(config.getMaxTotalNodes()).isEqualTo(20);
        assertThat(config.getMaxVisitedHistory()).isEqualTo(40);
        assertThat(config.getMaxTimestampHistory()).isEqualTo(15);
        assertThat(config.getRegexStepBudget()).isEqualTo(5_000);
    }

    @Nested
    class FromProperties {

        @Test
        void shouldReadAllKeys() {
            // Given
            Properties properties = new Properties();
            properties.setProperty("authflow.rate-limit.max-requests", "12");
            properties.setProperty("authflow.rate-limit.window-seconds", "90");
            properties.setProperty("authflow.rate-limit.history-size", "40");
            properties.setProperty("authflow.session.timeout-minutes", "15");
            properties.setProperty("authflow.guard.max-visits-per-node", "4");
            properties.setProperty("authflow.guard.max-total-nodes", "80");
            properties.setProperty("authflow.guard.visited-history-size", "300");
            properties.setProperty("authflow.regex.step-budget", " 250000 ");

            // When
            AuthFlowConfig config = AuthFlowConfig.fromProperties(properties);

            // Then
            assertThat(config.getMaxRequestsPerWindow()).isEqualTo(12);
            assertThat(config.getRateLimitWindow()).isEqualTo(Duration.ofSeconds(90));
            assertThat(config.getMaxTimestampHistory()).isEqualTo(40);
            assertThat(config.getSessionTimeout()).isEqualTo(Duration.ofMinutes(15));
            assertThat(config.getMaxVisitsPerNode()).isEqualTo(4);
            assertThat(config.getMaxTotalNodes()).isEqualTo(80);
            assertThat(config.getMaxVisitedHistory()).isEqualTo(300);
            assertThat(config.getRegexStepBudget()).isEqualTo(250_000);
        }

        @Test
        void shouldKeepDefaultsForMissingOrBlankKeys() {
            Properties properties = new Properties();
            properties.setProperty("authflow.session.timeout-minutes", "  ");
            properties.setProperty("other.key", "1");

            AuthFlowConfig config = AuthFlowConfig.fromProperties(properties);

            assertThat(config.getSessionTimeout()).isEqualTo(Duration.ofMinutes(30));
            assertThat(config.getMaxRequestsPerWindow()).isEqualTo(30);
        }

        @ParameterizedTest
        @ValueSource(strings = {"0", "-3", "ten", "1.5", "2147483648"})
        void shouldRejectInvalidValues(String raw) {
            Properties properties = new Properties();
            properties.setProperty("authflow.guard.max-total-nodes", raw);

            assertThatThrownBy(() -> AuthFlowConfig.fromProperties(properties))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage(
                            "Property authflow.guard.max-total-nodes must be a positive integer: "
                                    + raw);
        }
    }
}
