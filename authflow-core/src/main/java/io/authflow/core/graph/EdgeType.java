package io.authflow.core.graph;

import java.util.Optional;

/// Kind of a graph edge.
public enum EdgeType {
    /// Followed when a plain node completes successfully.
    SUCCESS("success"),
    /// Followed when a plain node fails.
    ERROR("error"),
    /// Selected by a decision branch or switch case through its source handle.
    CONDITIONAL("conditional");

    private final String wireName;

    EdgeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Parses a wire name.
    ///
    /// @param name wire name such as `success`, may be null
    /// @return the edge type, or empty if the name is unknown
    public static Optional<EdgeType> fromWireName(String name) {
        for (EdgeType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
