package io.authflow.core.graph;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// One step of a graph definition.
///
/// The node type is an open string. `decision` and `switch` are the branching kinds; every
/// other type, including ones this version does not know, is plain.
///
/// @param id node identifier, unique within the graph, not null
/// @param type node type, not null
/// @param data node payload, never null after construction
public record GraphNode(String id, String type, GraphNodeData data) {

    public static final String TYPE_START = "start";
    public static final String TYPE_END = "end";
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_DECISION = "decision";
    public static final String TYPE_SWITCH = "switch";

    public GraphNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (data == null) {
            data = new GraphNodeData(null, null, List.of(), Map.of());
        }
    }

    /// Creates a node without capabilities or configuration.
    public static GraphNode of(String id, String type) {
        return new GraphNode(id, type, null);
    }
}
