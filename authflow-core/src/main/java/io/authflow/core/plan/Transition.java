package io.authflow.core.plan;

import io.authflow.core.graph.EdgeType;
import java.util.Objects;

/// Compiled outgoing transition of a node.
///
/// @param targetNodeId node this transition leads to, not null
/// @param type transition kind, not null
/// @param sourceHandle decision branch or switch case id, may be null
/// @param priority effective priority, may be null (ordered after prioritized transitions)
public record Transition(
        String targetNodeId, EdgeType type, String sourceHandle, Integer priority) {

    public Transition {
        Objects.requireNonNull(targetNodeId, "targetNodeId must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
