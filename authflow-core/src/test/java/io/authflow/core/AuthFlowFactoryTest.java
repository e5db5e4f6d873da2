package io.authflow.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.authflow.core.condition.ConditionEvaluator;
import io.authflow.core.condition.SafeConditionEvaluator;
import io.authflow.core.execution.FlowStart;
import io.authflow.core.execution.StepHistory;
import io.authflow.core.execution.StepOutcome;
import io.authflow.core.execution.StepRequest;
import io.authflow.core.plan.InMemoryPlanCache;
import io.authflow.core.plan.PlanCache;
import io.authflow.core.registry.FlowRegistry;
import io.authflow.core.registry.FlowType;
import io.authflow.core.registry.InMemoryFlowRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AuthFlowFactoryTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    @Test
    void shouldCreateDefaultEnvironment() {
        AuthFlowEnvironment env = AuthFlowFactory.createEnvironment();

        assertThat(env.getConditionEvaluator()).isInstanceOf(SafeConditionEvaluator.class);
        assertThat(env.getFlowRegistry()).isInstanceOf(InMemoryFlowRegistry.class);
        assertThat(env.getPlanCache()).isInstanceOf(InMemoryPlanCache.class);
        assertThat(env.getFlowCompiler()).isNotNull();
        assertThat(env.getFlowExecutor()).isNotNull();
        assertThat(env.getStepGuard()).isNotNull();
        assertThat(env.getStepProcessor()).isNotNull();
        assertThat(env.getFlowRegistry().getBuiltinFlowIds()).isEmpty();
    }

    @Test
    void shouldRegisterBuiltinFlowsAndRunThem() throws Exception {
        // Given
        AuthFlowEnvironment env =
                AuthFlowFactory.builder()
                        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                        .builtinFlows(List.of(TestFlows.linearLogin()))
                        .build();

        // When
        FlowStart start =
                env.getStepProcessor().begin(FlowType.LOGIN, "tenant-a", "client-a");
        StepOutcome outcome =
                env.getStepProcessor()
                        .submit(
                                start.session(),
                                StepHistory.empty(),
                                StepRequest.of("tenant-a", "client-a"),
                                Map.of());

        // Then
        assertThat(start.session().createdAt()).isEqualTo(NOW);
        assertThat(start.currentNode().id()).isEqualTo("identifier");
        assertThat(((StepOutcome.Continue) outcome).nextNode().id()).isEqualTo("auth");
        assertThat(env.getPlanCache().get(null, "human-basic-login", "1.0.0")).isPresent();
    }

    @Test
    void shouldApplyConfiguredLimits() throws Exception {
        // Given
        AuthFlowConfig config =
                AuthFlowConfig.builder().sessionTimeout(Duration.ofMinutes(1)).build();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        AuthFlowEnvironment env =
                AuthFlowFactory.builder()
                        .config(config)
                        .clock(clock)
                        .builtinFlows(List.of(TestFlows.linearLogin()))
                        .build();
        FlowStart start =
                env.getStepProcessor().begin(FlowType.LOGIN, "tenant-a", "client-a");
        AuthFlowEnvironment later =
                AuthFlowFactory.builder()
                        .config(config)
                        .clock(Clock.offset(clock, Duration.ofMinutes(2)))
                        .builtinFlows(List.of(TestFlows.linearLogin()))
                        .build();

        // When
        StepOutcome outcome =
                later.getStepProcessor()
                        .submit(start.session(), null, StepRequest.of(null, null), null);

        // Then
        assertThat(((StepOutcome.Failed) outcome).code()).isEqualTo("session_timeout");
    }

    @Test
    void shouldUseProvidedComponents() {
        // Given
        ConditionEvaluator evaluator = mock(ConditionEvaluator.class);
        FlowRegistry registry = mock(FlowRegistry.class);
        PlanCache cache = new InMemoryPlanCache();
        when(registry.getBuiltinFlowIds()).thenReturn(List.of("human-basic-login"));

        // When
        AuthFlowEnvironment env =
                AuthFlowFactory.builder()
                        .conditionEvaluator(evaluator)
                        .flowRegistry(registry)
                        .planCache(cache)
                        .builtinFlows(List.of(TestFlows.linearLogin()))
                        .build();

        // Then
        assertThat(env.getConditionEvaluator()).isSameAs(evaluator);
        assertThat(env.getFlowRegistry()).isSameAs(registry);
        assertThat(env.getPlanCache()).isSameAs(cache);
        verify(registry).registerBuiltin(any());
    }

    @Test
    void shouldRejectNullConfig() {
        assertThatThrownBy(() -> AuthFlowFactory.builder().config(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("config must not be null");
    }
}
