package io.authflow.core.plan;

/// Validated configuration of a branching node.
///
/// ### Permitted Implementations
/// - {@link DecisionConfig} - ordered condition branches with an optional default
/// - {@link SwitchConfig} - a context value matched against case value lists
///
/// @see FlowCompiler for how raw node configuration is validated into these types
public sealed interface BranchingConfig permits DecisionConfig, SwitchConfig {}
