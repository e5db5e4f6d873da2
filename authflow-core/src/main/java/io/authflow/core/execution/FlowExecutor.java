package io.authflow.core.execution;

import io.authflow.core.condition.ConditionEvaluator;
import io.authflow.core.context.ContextPath;
import io.authflow.core.context.ContextValues;
import io.authflow.core.context.FlowContext;
import io.authflow.core.plan.BranchingConfig;
import io.authflow.core.plan.CompiledNode;
import io.authflow.core.plan.CompiledPlan;
import io.authflow.core.plan.DecisionBranch;
import io.authflow.core.plan.DecisionConfig;
import io.authflow.core.plan.SwitchCase;
import io.authflow.core.plan.SwitchConfig;
import io.authflow.core.plan.Transition;
import io.authflow.core.util.LogSanitizer;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Selects the next node of a compiled plan and guards the session boundary.
///
/// ### Next-node resolution
/// - **Decision**: branches are tried in priority order. The first branch whose condition holds
///   and that has a transition with a matching source handle wins. A matching branch without
///   such a transition is skipped. Otherwise the `defaultBranch` transition is taken if present.
/// - **Switch**: the `switchKey` is resolved against the context through {@link ContextPath}.
///   Cases are tried in declaration order; a case matches when its values contain the resolved
///   value. Otherwise the `defaultCase` transition is taken if present.
/// - **Plain**: `nextOnSuccess`.
///
/// `null` means no eligible transition. The executor never guesses a destination: the caller
/// decides whether that ends the flow or is an error. A selected transition that points at a
/// node missing from the plan is a security event and also resolves to `null`.
///
/// @implNote Stateless. One instance serves any number of plans and threads concurrently.
/// @see io.authflow.core.plan.FlowCompiler for how plans are built
public class FlowExecutor {

    private static final Logger logger = Logger.getLogger(FlowExecutor.class.getName());

    private final ConditionEvaluator evaluator;

    public FlowExecutor(ConditionEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    /// Resolves the node that follows a successful step at the given node.
    ///
    /// @param node current node, not null
    /// @param plan plan the node belongs to, not null
    /// @param context runtime context, may be null (treated as empty)
    /// @return id of the next node, or null if no transition is eligible
    public String resolveNext(CompiledNode node, CompiledPlan plan, FlowContext context) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(plan, "plan must not be null");
        FlowContext ctx = context != null ? context : FlowContext.empty();

        BranchingConfig config = node.decisionConfig();
        if (config instanceof DecisionConfig decision) {
            return resolveDecision(node, decision, plan, ctx);
        }
        if (config instanceof SwitchConfig switchConfig) {
            return resolveSwitch(node, switchConfig, plan, ctx);
        }
        return node.nextOnSuccess();
    }

    /// Resolves the node that follows a failed step at the given node.
    ///
    /// @param node current node, not null
    /// @return id of the error node, or null if the node has no error transition
    public String resolveOnError(CompiledNode node) {
        Objects.requireNonNull(node, "node must not be null");
        return node.nextOnError();
    }

    /// Checks that a step submission belongs to the tenant and client of the session.
    ///
    /// Each check applies only when the request carries the corresponding identifier; an absent
    /// or empty identifier skips it. The tenant is checked before the client.
    ///
    /// @param session verified session state, not null
    /// @param request incoming step submission, not null
    /// @throws InvalidSessionException if the request names another tenant or client
    public void validateSession(FlowSession session, StepRequest request)
            throws InvalidSessionException {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(request, "request must not be null");

        if (isPresent(request.tenantId()) && !request.tenantId().equals(session.tenantId())) {
            logger.warning(
                    "[Security] Session tenant mismatch: session="
                            + LogSanitizer.sanitize(session.sessionId())
                            + ", request tenant="
                            + LogSanitizer.sanitize(request.tenantId()));
            throw new InvalidSessionException(InvalidSessionException.Reason.TENANT_MISMATCH);
        }
        if (isPresent(request.clientId()) && !request.clientId().equals(session.clientId())) {
            logger.warning(
                    "[Security] Session client mismatch: session="
                            + LogSanitizer.sanitize(session.sessionId())
                            + ", request client="
                            + LogSanitizer.sanitize(request.clientId()));
            throw new InvalidSessionException(InvalidSessionException.Reason.CLIENT_MISMATCH);
        }
    }

    private String resolveDecision(
            CompiledNode node, DecisionConfig config, CompiledPlan plan, FlowContext context) {
        List<Transition> transitions = plan.getTransitionsFrom(node.id());

        for (DecisionBranch branch : config.branches()) {
            if (!evaluator.evaluate(branch.condition(), context)) {
                continue;
            }
            Optional<Transition> transition = findByHandle(transitions, branch.id());
            if (transition.isPresent()) {
                return checkedTarget(node, transition.get(), plan);
            }
        }

        if (config.defaultBranch() != null) {
            Optional<Transition> fallback = findByHandle(transitions, config.defaultBranch());
            if (fallback.isPresent()) {
                return checkedTarget(node, fallback.get(), plan);
            }
        }
        return null;
    }

    private String resolveSwitch(
            CompiledNode node, SwitchConfig config, CompiledPlan plan, FlowContext context) {
        Optional<String> reserved = ContextPath.findReservedSegment(config.switchKey());
        Optional<Object> value;
        if (reserved.isPresent()) {
            logger.warning(
                    "[Security] Dangerous key detected in switchKey: "
                            + LogSanitizer.sanitize(reserved.get())
                            + " (node "
                            + LogSanitizer.sanitize(node.id())
                            + ")");
            value = Optional.empty();
        } else {
            value = ContextPath.resolve(config.switchKey(), context);
        }

        List<Transition> transitions = plan.getTransitionsFrom(node.id());
        if (value.isPresent()) {
            for (SwitchCase switchCase : config.cases()) {
                if (!ContextValues.containsSameValue(switchCase.values(), value.get())) {
                    continue;
                }
                Optional<Transition> transition = findByHandle(transitions, switchCase.id());
                if (transition.isPresent()) {
                    return checkedTarget(node, transition.get(), plan);
                }
            }
        }

        if (config.defaultCase() != null) {
            Optional<Transition> fallback = findByHandle(transitions, config.defaultCase());
            if (fallback.isPresent()) {
                return checkedTarget(node, fallback.get(), plan);
            }
        }
        return null;
    }

    private static Optional<Transition> findByHandle(List<Transition> transitions, String handle) {
        for (Transition transition : transitions) {
            if (handle.equals(transition.sourceHandle())) {
                return Optional.of(transition);
            }
        }
        return Optional.empty();
    }

    private static String checkedTarget(
            CompiledNode node, Transition transition, CompiledPlan plan) {
        if (!plan.hasNode(transition.targetNodeId())) {
            logger.warning(
                    "[Security] Invalid transition from "
                            + LogSanitizer.sanitize(node.id())
                            + ": target node "
                            + LogSanitizer.sanitize(transition.targetNodeId())
                            + " does not exist in plan "
                            + LogSanitizer.sanitize(plan.getId()));
            return null;
        }
        return transition.targetNodeId();
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }
}
