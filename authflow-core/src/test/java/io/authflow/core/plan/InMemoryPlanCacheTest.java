package io.authflow.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.authflow.core.TestFlows;
import io.authflow.core.exception.InvalidFlowConfigurationException;
import io.authflow.core.graph.GraphDefinition;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryPlanCacheTest {

    private InMemoryPlanCache cache;
    private FlowCompiler compiler;

    @BeforeEach
    void setUp() {
        cache = new InMemoryPlanCache();
        compiler = spy(new FlowCompiler());
    }

    @Test
    void shouldReturnPlanForMatchingVersion() throws Exception {
        // Given
        CompiledPlan plan = compiler.compile(TestFlows.riskDecision());
        cache.put(null, plan);

        // When / Then
        assertThat(cache.get(null, "risk-flow", "2.0.0")).containsSame(plan);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void shouldMissOnVersionMismatch() throws Exception {
        cache.put(null, compiler.compile(TestFlows.riskDecision()));

        assertThat(cache.get(null, "risk-flow", "2.0.1")).isEmpty();
        assertThat(cache.get(null, "risk-flow", null)).isEmpty();
        assertThat(cache.get(null, "unknown", "2.0.0")).isEmpty();
    }

    @Test
    void shouldCompileOnceAndReuse() throws Exception {
        // Given
        GraphDefinition graph = TestFlows.riskDecision();

        // When
        CompiledPlan first = cache.getOrCompile(null, graph, compiler);
        CompiledPlan second = cache.getOrCompile(null, graph, compiler);

        // Then
        assertThat(second).isSameAs(first);
        verify(compiler, times(1)).compile(graph);
    }

    @Test
    void shouldRecompileAndReplaceStalePlan() throws Exception {
        // Given
        GraphDefinition v1 = TestFlows.riskDecision();
        cache.getOrCompile(null, v1, compiler);
        GraphDefinition v2 =
                GraphDefinition.builder()
                        .id(v1.getId())
                        .flowVersion("2.1.0")
                        .nodes(v1.getNodes())
                        .edges(v1.getEdges())
                        .build();

        // When
        CompiledPlan plan = cache.getOrCompile(null, v2, compiler);

        // Then
        assertThat(plan.getSourceVersion()).isEqualTo("2.1.0");
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get(null, v1.getId(), "2.0.0")).isEmpty();
    }

    @Test
    void shouldNotCacheFailedCompilation() throws Exception {
        GraphDefinition empty = GraphDefinition.builder().id("broken").build();

        assertThatThrownBy(() -> cache.getOrCompile(null, empty, compiler))
                .isInstanceOf(InvalidFlowConfigurationException.class);
        assertThat(cache.size()).isZero();
    }

    @Test
    void shouldInvalidate() throws Exception {
        cache.put(null, compiler.compile(TestFlows.linearLogin()));

        assertThat(cache.invalidate(null, "human-basic-login")).isTrue();
        assertThat(cache.invalidate(null, "human-basic-login")).isFalse();
        assertThat(cache.get(null, "human-basic-login", "1.0.0")).isEmpty();
    }

    @Test
    void shouldKeepPlansOfDifferentOwnersApart() throws Exception {
        // Given
        GraphDefinition graph = TestFlows.riskDecision();
        CompiledPlan tenantPlan = cache.getOrCompile("tenant-a", graph, compiler);

        // When
        CompiledPlan otherPlan = cache.getOrCompile("tenant-b", graph, compiler);

        // Then
        assertThat(otherPlan).isNotSameAs(tenantPlan);
        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get(null, graph.getId(), "2.0.0")).isEmpty();
        assertThat(cache.invalidate("tenant-a", graph.getId())).isTrue();
        assertThat(cache.get("tenant-b", graph.getId(), "2.0.0")).containsSame(otherPlan);
        verify(compiler, times(2)).compile(graph);
    }

    @Test
    void shouldRejectNullArguments() throws Exception {
        assertThatThrownBy(() -> cache.get(null, null, "1.0.0"))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("flowId must not be null");
        assertThatThrownBy(() -> cache.put(null, null)).isInstanceOf(NullPointerException.class);
        verify(compiler, never()).compile(any());
    }

    @Test
    void shouldServeConcurrentReaders() throws Exception {
        // Given
        cache.put(null, compiler.compile(TestFlows.linearLogin()));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<Boolean>> results = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < 100; i++) {
                results.add(
                        executor.submit(
                                () -> cache.get(null, "human-basic-login", "1.0.0").isPresent()));
            }
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        // Then
        for (Future<Boolean> result : results) {
            assertThat(result.get()).isTrue();
        }
    }
}
