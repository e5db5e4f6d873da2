package io.authflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.authflow.core.AuthFlowEnvironment;
import io.authflow.core.AuthFlowFactory;
import io.authflow.core.condition.SafeConditionEvaluator;
import io.authflow.core.context.FlowContext;
import io.authflow.core.execution.FlowExecutor;
import io.authflow.core.execution.FlowStart;
import io.authflow.core.execution.StepOutcome;
import io.authflow.core.execution.StepRequest;
import io.authflow.core.graph.GraphDefinition;
import io.authflow.core.plan.CompiledPlan;
import io.authflow.core.plan.FlowCompiler;
import io.authflow.core.registry.FlowType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class BuiltinFlowsTest {

    @Test
    void shouldLoadAllShippedFlowsInOrder() {
        List<GraphDefinition> flows = BuiltinFlows.loadAll();

        assertThat(flows)
                .extracting(GraphDefinition::getId)
                .containsExactly("human-basic-login", "risk-based-login");
    }

    @Test
    void shouldCompileEveryShippedFlow() throws Exception {
        FlowCompiler compiler = new FlowCompiler();

        for (GraphDefinition flow : BuiltinFlows.loadAll()) {
            CompiledPlan plan = compiler.compile(flow);
            assertThat(plan.getEntryNodeId()).isEqualTo("start");
            assertThat(plan.getNodes()).containsKeys("complete", "error");
        }
    }

    @Test
    void shouldReadRetryEdgeLabelFromEdgeData() {
        GraphDefinition login = BuiltinFlows.load(BuiltinFlows.HUMAN_BASIC_LOGIN);

        assertThat(login.getEdges())
                .filteredOn(edge -> edge.id().equals("e_error_retry"))
                .singleElement()
                .satisfies(edge -> assertThat(edge.label()).isEqualTo("Retry"));
        assertThat(login.getMetadata().createdBy()).isEqualTo("system");
    }

    @Test
    void shouldFailForUnknownFlow() {
        assertThatThrownBy(() -> BuiltinFlows.load("no-such-flow"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Built-in flow resource not found: flows/no-such-flow.json");
    }

    @Nested
    class RiskBasedLogin {

        private CompiledPlan plan;
        private FlowExecutor executor;

        @BeforeEach
        void setUp() throws Exception {
            plan = new FlowCompiler().compile(BuiltinFlows.load(BuiltinFlows.RISK_BASED_LOGIN));
            executor = new FlowExecutor(new SafeConditionEvaluator());
        }

        private String next(String nodeId, Map<String, Object> raw) {
            return executor.resolveNext(
                    plan.getNode(nodeId).orElseThrow(), plan, FlowContext.fromMap(raw));
        }

        @Test
        void shouldStepUpOnHighScore() {
            assertThat(next("risk_check", Map.of("risk", Map.of("score", 85)))).isEqualTo("step_up");
        }

        @Test
        void shouldStepUpOnImpossibleTravel() {
            Map<String, Object> raw =
                    Map.of("risk", Map.of("score", 10, "flags", List.of("impossible_travel")));

            assertThat(next("risk_check", raw)).isEqualTo("step_up");
        }

        @Test
        void shouldSendUnknownDeviceToEmailCode() {
            assertThat(next("risk_check", Map.of("device", Map.of("known", false))))
                    .isEqualTo("email_otp");
        }

        @Test
        void shouldDefaultToCountrySwitch() {
            assertThat(next("risk_check", Map.of())).isEqualTo("method_by_country");
        }

        @ParameterizedTest
        @CsvSource({"JP, passkey_auth", "US, passkey_auth", "DE, passkey_auth", "BR, email_otp"})
        void shouldPickMethodByCountry(String country, String expected) {
            assertThat(next("method_by_country", Map.of("request", Map.of("country", country))))
                    .isEqualTo(expected);
        }
    }

    @Nested
    class AsTenantFlow {

        private AuthFlowEnvironment env;

        @BeforeEach
        void setUp() {
            env = AuthFlowFactory.createEnvironment();
            env.getFlowRegistry()
                    .registerCustom(
                            "tenant-r",
                            FlowType.LOGIN,
                            BuiltinFlows.load(BuiltinFlows.RISK_BASED_LOGIN));
        }

        @Test
        void shouldWalkFromIdentifierToPasskey() throws Exception {
            // Given
            FlowStart start = env.getStepProcessor().begin(FlowType.LOGIN, "tenant-r", "web");
            StepRequest request = StepRequest.of("tenant-r", "web");
            Map<String, Object> collected = Map.of("request", Map.of("country", "JP"));

            // When
            StepOutcome first =
                    env.getStepProcessor().submit(start.session(), null, request, collected);
            StepOutcome.Continue atRisk = (StepOutcome.Continue) first;
            StepOutcome second =
                    env.getStepProcessor()
                            .submit(atRisk.session(), atRisk.history(), request, collected);
            StepOutcome.Continue atCountry = (StepOutcome.Continue) second;
            StepOutcome third =
                    env.getStepProcessor()
                            .submit(atCountry.session(), atCountry.history(), request, collected);
            StepOutcome.Continue atPasskey = (StepOutcome.Continue) third;
            StepOutcome last =
                    env.getStepProcessor()
                            .submit(atPasskey.session(), atPasskey.history(), request, collected);

            // Then
            assertThat(start.currentNode().id()).isEqualTo("identifier");
            assertThat(atRisk.nextNode().id()).isEqualTo("risk_check");
            assertThat(atCountry.nextNode().id()).isEqualTo("method_by_country");
            assertThat(atPasskey.nextNode().id()).isEqualTo("passkey_auth");
            assertThat(atPasskey.history().visitedNodeIds())
                    .containsExactly("identifier", "risk_check", "method_by_country");
            assertThat(last).isEqualTo(new StepOutcome.Complete("complete"));
        }

        @Test
        void shouldRefuseStepFromAnotherTenant() throws Exception {
            FlowStart start = env.getStepProcessor().begin(FlowType.LOGIN, "tenant-r", "web");

            StepOutcome outcome =
                    env.getStepProcessor()
                            .submit(start.session(), null, StepRequest.of("tenant-x", "web"), null);

            assertThat(outcome)
                    .isEqualTo(new StepOutcome.Failed("invalid_session", "Session tenant mismatch"));
        }
    }
}
