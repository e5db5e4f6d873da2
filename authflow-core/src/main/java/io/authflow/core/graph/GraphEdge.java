package io.authflow.core.graph;

import java.util.Objects;

/// Directed edge between two nodes of a graph definition.
///
/// @param id edge identifier, not null
/// @param source source node id, not null
/// @param target target node id, not null
/// @param type edge kind, not null
/// @param sourceHandle decision branch or switch case id this edge belongs to, may be null
/// @param priority ordering among edges of the same source, may be null
/// @param label display label, may be null
public record GraphEdge(
        String id,
        String source,
        String target,
        EdgeType type,
        String sourceHandle,
        Integer priority,
        String label) {

    public GraphEdge {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    /// Creates a success edge.
    public static GraphEdge success(String id, String source, String target) {
        return new GraphEdge(id, source, target, EdgeType.SUCCESS, null, null, null);
    }

    /// Creates an error edge.
    public static GraphEdge error(String id, String source, String target) {
        return new GraphEdge(id, source, target, EdgeType.ERROR, null, null, null);
    }

    /// Creates a conditional edge leaving through a branch or case handle.
    public static GraphEdge conditional(
            String id, String source, String target, String sourceHandle) {
        return new GraphEdge(id, source, target, EdgeType.CONDITIONAL, sourceHandle, null, null);
    }
}
