package io.authflow.core.condition;

/// Sealed interface for nodes of a condition tree.
///
/// A condition tree is either a single predicate tested against the runtime context, or a group
/// combining nested nodes with AND/OR logic.
///
/// ### Permitted Implementations
/// - {@link FlowCondition} - One comparison of a context value against an expected value
/// - {@link ConditionGroup} - AND/OR combination of nested conditions
///
/// @implNote Implementations are immutable. The same tree may be evaluated concurrently against
/// many contexts.
///
/// @see ConditionEvaluator for evaluation semantics
public sealed interface ConditionNode permits FlowCondition, ConditionGroup {}
