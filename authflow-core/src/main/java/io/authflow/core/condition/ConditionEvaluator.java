package io.authflow.core.condition;

import io.authflow.core.context.FlowContext;

/// Evaluates condition trees against a runtime context.
///
/// Evaluation is a total function: implementations must never throw for malformed conditions,
/// unsafe paths, oversized inputs or type mismatches. Any such case evaluates to a fail-closed
/// boolean, so a caller always gets a deterministic answer.
///
/// @see SafeConditionEvaluator for the default implementation
public interface ConditionEvaluator {

    /// Evaluates a predicate or group.
    ///
    /// @param node condition tree to evaluate, may be null (evaluates to false)
    /// @param context runtime context, may be null (treated as empty)
    /// @return whether the condition holds
    boolean evaluate(ConditionNode node, FlowContext context);
}
