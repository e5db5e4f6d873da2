package io.authflow.core.execution;

import io.authflow.core.plan.CompiledNode;

/// A freshly started flow session and the node to present first.
///
/// @param session new session state to persist, not null
/// @param currentNode first node to present, not null
public record FlowStart(FlowSession session, CompiledNode currentNode) {}
