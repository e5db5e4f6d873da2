package io.authflow.core.plan;

import io.authflow.core.graph.GraphNode;
import java.util.List;
import java.util.Objects;

/// Node of a compiled plan.
///
/// `decisionConfig` is present only for `decision` and `switch` nodes. Nodes of any other type,
/// including unknown ones, are plain and move along `nextOnSuccess` / `nextOnError`.
///
/// @param id node id, not null
/// @param type node type as authored, not null
/// @param intent node intent, may be null
/// @param capabilities resolved capabilities, never null after construction
/// @param nextOnSuccess target of the first success transition, null if none
/// @param nextOnError target of the first error transition, null if none
/// @param decisionConfig branching configuration, null for plain nodes
public record CompiledNode(
        String id,
        String type,
        String intent,
        List<ResolvedCapability> capabilities,
        String nextOnSuccess,
        String nextOnError,
        BranchingConfig decisionConfig) {

    public CompiledNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
    }

    /// Returns whether this node selects its successor by branching.
    ///
    /// @return true for decision and switch nodes
    public boolean isBranching() {
        return decisionConfig != null;
    }

    /// Returns whether this node ends the flow.
    ///
    /// @return true for nodes of type `end`
    public boolean isEnd() {
        return GraphNode.TYPE_END.equals(type);
    }
}
