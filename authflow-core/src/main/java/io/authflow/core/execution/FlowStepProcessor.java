package io.authflow.core.execution;

import io.authflow.core.context.ContextSanitizer;
import io.authflow.core.context.FlowContext;
import io.authflow.core.context.FlowContextBuilder;
import io.authflow.core.exception.FlowNotFoundException;
import io.authflow.core.exception.InvalidFlowConfigurationException;
import io.authflow.core.graph.GraphDefinition;
import io.authflow.core.graph.GraphNode;
import io.authflow.core.plan.CompiledNode;
import io.authflow.core.plan.CompiledPlan;
import io.authflow.core.plan.FlowCompiler;
import io.authflow.core.plan.PlanCache;
import io.authflow.core.registry.FlowRegistry;
import io.authflow.core.registry.FlowType;
import io.authflow.core.registry.RegisteredFlow;
import io.authflow.core.util.LogSanitizer;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Drives a flow session one step at a time.
///
/// This is the entry point of the step-submission handler. It owns no state: sessions,
/// histories and collected data are loaded and persisted by the caller and passed in with
/// every call.
///
/// ### Step pipeline
/// 1. Session boundary check ({@link FlowExecutor#validateSession})
/// 2. Admission control ({@link StepGuard#admit})
/// 3. Plan lookup: registry, then plan cache, compiling on a miss
/// 4. Runtime context assembly from collected data and verified session identifiers
/// 5. Next-node resolution ({@link FlowExecutor#resolveNext})
///
/// Every refusal is reported as {@link StepOutcome.Failed} with a stable code; this class does
/// not throw for request-level problems.
///
/// @implNote Thread-safe if its collaborators are.
public final class FlowStepProcessor {

    private static final Logger logger = Logger.getLogger(FlowStepProcessor.class.getName());

    private final FlowRegistry registry;
    private final PlanCache planCache;
    private final FlowCompiler compiler;
    private final FlowExecutor executor;
    private final StepGuard guard;
    private final Clock clock;

    public FlowStepProcessor(
            FlowRegistry registry,
            PlanCache planCache,
            FlowCompiler compiler,
            FlowExecutor executor,
            StepGuard guard,
            Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.planCache = Objects.requireNonNull(planCache, "planCache must not be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.guard = Objects.requireNonNull(guard, "guard must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Starts a new session of a flow type.
    ///
    /// When the entry node is a `start` node with a valid success transition, the session
    /// begins at that transition's target instead.
    ///
    /// @param flowType flow type to start, not null
    /// @param tenantId tenant starting the flow, not blank
    /// @param clientId client starting the flow, not blank
    /// @return the new session and the node to present first, never null
    /// @throws IllegalArgumentException if tenantId or clientId is blank
    /// @throws FlowNotFoundException if no flow serves the type for this tenant
    /// @throws InvalidFlowConfigurationException if the flow fails to compile
    public FlowStart begin(FlowType flowType, String tenantId, String clientId)
            throws FlowNotFoundException, InvalidFlowConfigurationException {
        Objects.requireNonNull(flowType, "flowType must not be null");
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Invalid tenantId");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Invalid clientId");
        }

        RegisteredFlow flow =
                registry.resolve(flowType, tenantId)
                        .orElseThrow(
                                () ->
                                        new FlowNotFoundException(
                                                "Flow not found: " + flowType.wireName()));
        CompiledPlan plan = planCache.getOrCompile(flow.ownerTenantId(), flow.graph(), compiler);

        CompiledNode entry = plan.getNodes().get(plan.getEntryNodeId());
        if (GraphNode.TYPE_START.equals(entry.type()) && plan.hasNode(entry.nextOnSuccess())) {
            entry = plan.getNodes().get(entry.nextOnSuccess());
        }

        FlowSession session =
                new FlowSession(
                        "flow_" + UUID.randomUUID(),
                        plan.getId(),
                        flowType,
                        tenantId,
                        clientId,
                        entry.id(),
                        clock.instant());
        logger.info(
                "Started flow "
                        + LogSanitizer.sanitize(plan.getId())
                        + " for tenant "
                        + LogSanitizer.sanitize(tenantId)
                        + " at node "
                        + LogSanitizer.sanitize(entry.id()));
        return new FlowStart(session, entry);
    }

    /// Processes one step submission.
    ///
    /// @param session verified session state, not null
    /// @param history history persisted with the session, may be null
    /// @param request incoming submission, not null
    /// @param collectedData data collected by earlier steps, may be null
    /// @return outcome of the step, never null
    public StepOutcome submit(
            FlowSession session,
            StepHistory history,
            StepRequest request,
            Map<String, ?> collectedData) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(request, "request must not be null");

        try {
            executor.validateSession(session, request);
        } catch (InvalidSessionException e) {
            return new StepOutcome.Failed(InvalidSessionException.CODE, e.getMessage());
        }

        StepHistory admitted;
        try {
            admitted = guard.admit(session, history);
        } catch (StepRejectedException e) {
            return new StepOutcome.Failed(e.getReason().code(), e.getReason().message());
        }

        Optional<RegisteredFlow> flow = registry.resolve(session.flowType(), session.tenantId());
        if (flow.isEmpty()) {
            return new StepOutcome.Failed("flow_not_found", "Flow definition not found");
        }

        GraphDefinition graph = flow.get().graph();
        CompiledPlan plan;
        try {
            plan = planCache.getOrCompile(flow.get().ownerTenantId(), graph, compiler);
        } catch (InvalidFlowConfigurationException e) {
            logger.log(
                    Level.SEVERE,
                    "Failed to compile flow " + LogSanitizer.sanitize(graph.getId()),
                    e);
            return new StepOutcome.Failed("plan_not_found", "Compiled plan not found");
        }

        Optional<CompiledNode> current = plan.getNode(session.currentNodeId());
        if (current.isEmpty()) {
            return new StepOutcome.Failed(
                    "node_not_found", "Node not found: " + session.currentNodeId());
        }

        FlowContext context =
                FlowContextBuilder.fromCollectedData(
                        collectedData, session.tenantId(), session.clientId());
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(
                    "Resolving next node of "
                            + LogSanitizer.sanitize(current.get().id())
                            + " with context "
                            + ContextSanitizer.sanitize(context));
        }

        String nextNodeId = executor.resolveNext(current.get(), plan, context);
        if (nextNodeId == null) {
            return new StepOutcome.Complete(null);
        }

        Optional<CompiledNode> next = plan.getNode(nextNodeId);
        if (next.isEmpty()) {
            return new StepOutcome.Failed(
                    "next_node_not_found", "Next node not found: " + nextNodeId);
        }
        if (next.get().isEnd()) {
            return new StepOutcome.Complete(nextNodeId);
        }

        Map<String, Object> updated = new LinkedHashMap<>();
        if (collectedData != null) {
            updated.putAll(collectedData);
        }
        if (request.capabilityId() != null) {
            updated.put(request.capabilityId(), request.response());
        }

        return new StepOutcome.Continue(
                next.get(), session.withCurrentNodeId(nextNodeId), admitted, updated);
    }
}
