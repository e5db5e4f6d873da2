package io.authflow.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.authflow.core.TestFlows;
import io.authflow.core.condition.SafeConditionEvaluator;
import io.authflow.core.exception.FlowNotFoundException;
import io.authflow.core.exception.InvalidFlowConfigurationException;
import io.authflow.core.graph.GraphDefinition;
import io.authflow.core.graph.GraphEdge;
import io.authflow.core.graph.GraphNode;
import io.authflow.core.plan.CompiledPlan;
import io.authflow.core.plan.FlowCompiler;
import io.authflow.core.plan.InMemoryPlanCache;
import io.authflow.core.plan.PlanCache;
import io.authflow.core.registry.FlowRegistry;
import io.authflow.core.registry.FlowType;
import io.authflow.core.registry.InMemoryFlowRegistry;
import io.authflow.core.registry.RegisteredFlow;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FlowStepProcessorTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    @Mock private FlowRegistry registry;
    @Mock private PlanCache planCache;

    private FlowCompiler compiler;
    private FlowStepProcessor processor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        compiler = new FlowCompiler(clock);
        processor =
                new FlowStepProcessor(
                        registry,
                        planCache,
                        compiler,
                        new FlowExecutor(new SafeConditionEvaluator()),
                        new StepGuard(clock),
                        clock);
    }

    private CompiledPlan serve(GraphDefinition graph) throws Exception {
        CompiledPlan plan = compiler.compile(graph);
        when(registry.resolve(FlowType.LOGIN, "tenant-a"))
                .thenReturn(Optional.of(RegisteredFlow.builtin(graph)));
        when(planCache.getOrCompile(null, graph, compiler)).thenReturn(plan);
        return plan;
    }

    private static FlowSession sessionAt(String nodeId) {
        return new FlowSession(
                "flow_abc",
                "human-basic-login",
                FlowType.LOGIN,
                "tenant-a",
                "client-a",
                nodeId,
                NOW.minus(Duration.ofMinutes(2)));
    }

    private static StepRequest ownRequest() {
        return StepRequest.of("tenant-a", "client-a");
    }

    @Nested
    class Begin {

        @Test
        void shouldSkipStartNode() throws Exception {
            // Given
            serve(TestFlows.linearLogin());

            // When
            FlowStart start = processor.begin(FlowType.LOGIN, "tenant-a", "client-a");

            // Then
            assertThat(start.currentNode().id()).isEqualTo("identifier");
            FlowSession session = start.session();
            assertThat(session.sessionId()).startsWith("flow_");
            assertThat(session.flowId()).isEqualTo("human-basic-login");
            assertThat(session.currentNodeId()).isEqualTo("identifier");
            assertThat(session.tenantId()).isEqualTo("tenant-a");
            assertThat(session.clientId()).isEqualTo("client-a");
            assertThat(session.createdAt()).isEqualTo(NOW);
        }

        @Test
        void shouldStartAtEntryNodeWhenItIsNotStart() throws Exception {
            serve(TestFlows.countrySwitch());

            FlowStart start = processor.begin(FlowType.LOGIN, "tenant-a", "client-a");

            assertThat(start.currentNode().id()).isEqualTo("geo");
        }

        @Test
        void shouldIssueUniqueSessionIds() throws Exception {
            serve(TestFlows.linearLogin());

            FlowStart first = processor.begin(FlowType.LOGIN, "tenant-a", "client-a");
            FlowStart second = processor.begin(FlowType.LOGIN, "tenant-a", "client-a");

            assertThat(first.session().sessionId()).isNotEqualTo(second.session().sessionId());
        }

        @Test
        void shouldRejectBlankIdentifiers() {
            assertThatThrownBy(() -> processor.begin(FlowType.LOGIN, " ", "client-a"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid tenantId");
            assertThatThrownBy(() -> processor.begin(FlowType.LOGIN, "tenant-a", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid clientId");
        }

        @Test
        void shouldFailForUnknownFlow() {
            when(registry.resolve(FlowType.LOGIN, "tenant-a")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> processor.begin(FlowType.LOGIN, "tenant-a", "client-a"))
                    .isInstanceOf(FlowNotFoundException.class)
                    .hasMessage("Flow not found: login");
        }
    }

    @Nested
    class Submit {

        @Test
        void shouldContinueToNextNode() throws Exception {
            // Given
            serve(TestFlows.linearLogin());
            StepRequest request =
                    new StepRequest(
                            "tenant-a", "client-a", "identifier_email", "alice@example.com");

            // When
            StepOutcome outcome =
                    processor.submit(
                            sessionAt("identifier"), null, request, Map.of("user", Map.of()));

            // Then
            assertThat(outcome).isInstanceOf(StepOutcome.Continue.class);
            StepOutcome.Continue next = (StepOutcome.Continue) outcome;
            assertThat(next.nextNode().id()).isEqualTo("auth");
            assertThat(next.session().currentNodeId()).isEqualTo("auth");
            assertThat(next.session().sessionId()).isEqualTo("flow_abc");
            assertThat(next.history().visitedNodeIds()).containsExactly("identifier");
            assertThat(next.collectedData())
                    .containsEntry("identifier_email", "alice@example.com")
                    .containsKey("user");
        }

        @Test
        void shouldCompleteWhenReachingEndNode() throws Exception {
            serve(TestFlows.linearLogin());

            StepOutcome outcome = processor.submit(sessionAt("auth"), null, ownRequest(), null);

            assertThat(outcome).isEqualTo(new StepOutcome.Complete("complete"));
        }

        @Test
        void shouldCompleteWithoutEndNodeWhenNoTransitionRemains() throws Exception {
            serve(TestFlows.linearLogin());

            StepOutcome outcome = processor.submit(sessionAt("complete"), null, ownRequest(), null);

            assertThat(outcome).isEqualTo(new StepOutcome.Complete(null));
        }

        @Test
        void shouldBranchOnCollectedRiskSignals() throws Exception {
            // Given
            serve(TestFlows.riskDecision());
            Map<String, Object> collected = Map.of("risk", Map.of("score", 80));

            // When
            StepOutcome outcome = processor.submit(sessionAt("risk"), null, ownRequest(), collected);

            // Then
            assertThat(((StepOutcome.Continue) outcome).nextNode().id()).isEqualTo("A");
        }

        @Test
        void shouldIgnoreTenantSectionInCollectedData() throws Exception {
            // Given
            Map<String, Object> config =
                    Map.of(
                            "branches",
                            List.of(
                                    TestFlows.branch(
                                            "vip",
                                            1,
                                            TestFlows.condition("tenant.id", "equals", "vip"))),
                            "defaultBranch",
                            "regular");
            GraphDefinition graph =
                    GraphDefinition.builder()
                            .id("tenant-flow")
                            .nodes(
                                    List.of(
                                            TestFlows.node("d", "decision", config),
                                            GraphNode.of("vip_path", "mfa"),
                                            GraphNode.of("regular_path", "mfa")))
                            .edges(
                                    List.of(
                                            GraphEdge.conditional("e1", "d", "vip_path", "vip"),
                                            GraphEdge.conditional(
                                                    "e2", "d", "regular_path", "regular")))
                            .build();
            serve(graph);
            Map<String, Object> forged = Map.of("tenant", Map.of("id", "vip"));

            // When
            StepOutcome outcome = processor.submit(sessionAt("d"), null, ownRequest(), forged);

            // Then
            assertThat(((StepOutcome.Continue) outcome).nextNode().id()).isEqualTo("regular_path");
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldFailForForeignTenantBeforeAnyLookup() {
            StepOutcome outcome =
                    processor.submit(
                            sessionAt("identifier"),
                            null,
                            StepRequest.of("tenant-b", "client-a"),
                            null);

            assertThat(outcome)
                    .isEqualTo(new StepOutcome.Failed("invalid_session", "Session tenant mismatch"));
            verify(registry, never()).resolve(any(), any());
        }

        @Test
        void shouldFailForForeignClient() {
            StepOutcome outcome =
                    processor.submit(
                            sessionAt("identifier"),
                            null,
                            StepRequest.of(null, "client-b"),
                            null);

            assertThat(outcome)
                    .isEqualTo(new StepOutcome.Failed("invalid_session", "Session client mismatch"));
        }

        @Test
        void shouldFailWhenRateLimited() {
            StepHistory history =
                    new StepHistory(List.of(), Collections.nCopies(30, NOW.minusSeconds(5)));

            StepOutcome outcome =
                    processor.submit(sessionAt("identifier"), history, ownRequest(), null);

            assertThat(outcome)
                    .isEqualTo(
                            new StepOutcome.Failed(
                                    "rate_limit_exceeded",
                                    "Too many requests. Please wait a moment and try again."));
        }

        @Test
        void shouldFailWhenSessionExpired() {
            FlowSession expired =
                    new FlowSession(
                            "flow_old",
                            "human-basic-login",
                            FlowType.LOGIN,
                            "tenant-a",
                            "client-a",
                            "identifier",
                            NOW.minus(Duration.ofHours(1)));

            StepOutcome outcome = processor.submit(expired, null, ownRequest(), null);

            assertThat(((StepOutcome.Failed) outcome).code()).isEqualTo("session_timeout");
        }

        @Test
        void shouldFailWhenFlowIsGone() {
            when(registry.resolve(FlowType.LOGIN, "tenant-a")).thenReturn(Optional.empty());

            StepOutcome outcome =
                    processor.submit(sessionAt("identifier"), null, ownRequest(), null);

            assertThat(outcome)
                    .isEqualTo(new StepOutcome.Failed("flow_not_found", "Flow definition not found"));
        }

        @Test
        void shouldFailWhenPlanCannotBeCompiled() throws Exception {
            GraphDefinition graph = TestFlows.linearLogin();
            when(registry.resolve(FlowType.LOGIN, "tenant-a"))
                    .thenReturn(Optional.of(RegisteredFlow.custom("tenant-a", graph)));
            when(planCache.getOrCompile("tenant-a", graph, compiler))
                    .thenThrow(new InvalidFlowConfigurationException("broken"));

            StepOutcome outcome =
                    processor.submit(sessionAt("identifier"), null, ownRequest(), null);

            assertThat(outcome)
                    .isEqualTo(new StepOutcome.Failed("plan_not_found", "Compiled plan not found"));
        }

        @Test
        void shouldFailForUnknownCurrentNode() throws Exception {
            serve(TestFlows.linearLogin());

            StepOutcome outcome = processor.submit(sessionAt("ghost"), null, ownRequest(), null);

            assertThat(outcome)
                    .isEqualTo(new StepOutcome.Failed("node_not_found", "Node not found: ghost"));
        }

        @Test
        void shouldFailForTransitionToUnknownNode() throws Exception {
            // Given
            GraphDefinition graph =
                    GraphDefinition.builder()
                            .id("broken-edge")
                            .nodes(List.of(GraphNode.of("identifier", "identifier")))
                            .edges(List.of(GraphEdge.success("e1", "identifier", "ghost")))
                            .build();
            serve(graph);

            // When
            StepOutcome outcome =
                    processor.submit(sessionAt("identifier"), null, ownRequest(), null);

            // Then
            assertThat(outcome)
                    .isEqualTo(
                            new StepOutcome.Failed(
                                    "next_node_not_found", "Next node not found: ghost"));
        }
    }

    @Nested
    class TenantIsolation {

        private GraphDefinition customLogin(String firstStep) {
            return GraphDefinition.builder()
                    .id("custom-login")
                    .name("Custom login")
                    .flowVersion("1")
                    .nodes(
                            List.of(
                                    GraphNode.of("start", GraphNode.TYPE_START),
                                    GraphNode.of(firstStep, "auth_method"),
                                    GraphNode.of("end", GraphNode.TYPE_END)))
                    .edges(
                            List.of(
                                    GraphEdge.success("e1", "start", firstStep),
                                    GraphEdge.success("e2", firstStep, "end")))
                    .build();
        }

        @Test
        void shouldKeepSameNamedCustomFlowsOfTenantsApart() throws Exception {
            // Given
            InMemoryFlowRegistry flows = new InMemoryFlowRegistry();
            flows.registerCustom("t1", FlowType.LOGIN, customLogin("t1-password"));
            flows.registerCustom("t2", FlowType.LOGIN, customLogin("t2-passkey"));
            Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
            FlowStepProcessor shared =
                    new FlowStepProcessor(
                            flows,
                            new InMemoryPlanCache(),
                            compiler,
                            new FlowExecutor(new SafeConditionEvaluator()),
                            new StepGuard(clock),
                            clock);

            // When
            FlowStart first = shared.begin(FlowType.LOGIN, "t1", "client-a");
            FlowStart second = shared.begin(FlowType.LOGIN, "t2", "client-a");

            // Then
            assertThat(first.currentNode().id()).isEqualTo("t1-password");
            assertThat(second.currentNode().id()).isEqualTo("t2-passkey");
        }
    }
}
