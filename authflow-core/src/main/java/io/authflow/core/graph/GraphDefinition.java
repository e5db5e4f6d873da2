package io.authflow.core.graph;

import java.util.List;
import java.util.Objects;

/// Authoring-time form of an authentication flow: a set of nodes joined by edges.
///
/// A graph definition is what administrators edit and what is stored. It is not executable:
/// {@link io.authflow.core.plan.FlowCompiler} validates it and produces an indexed, immutable
/// {@link io.authflow.core.plan.CompiledPlan}. The definition itself is only a carrier and does
/// no validation beyond requiring an id; structural checks belong to the compiler.
///
/// ### Structure
/// - **Nodes**: steps of the flow, plain or branching (`decision`, `switch`)
/// - **Edges**: success, error and conditional transitions between nodes
/// - **Flow version**: author-controlled version string, passed through unexamined
/// - **Metadata**: creation and update timestamps, author
///
/// @implNote Immutable and thread-safe after construction.
/// @see io.authflow.core.plan.FlowCompiler for compilation rules
public final class GraphDefinition {

    private final String id;
    private final String flowVersion;
    private final String name;
    private final String description;
    private final String profileId;
    private final List<GraphNode> nodes;
    private final List<GraphEdge> edges;
    private final GraphMetadata metadata;

    private GraphDefinition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Flow ID required");
        this.flowVersion = builder.flowVersion;
        this.name = builder.name;
        this.description = builder.description;
        this.profileId = builder.profileId;
        this.nodes = List.copyOf(builder.nodes);
        this.edges = List.copyOf(builder.edges);
        this.metadata = builder.metadata;
    }

    /// Returns the flow identifier.
    ///
    /// @return flow ID, never null
    public String getId() {
        return id;
    }

    /// Returns the author-controlled version string.
    ///
    /// @return flow version (default "1.0.0"), may be null if explicitly cleared
    public String getFlowVersion() {
        return flowVersion;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /// Returns the profile this flow targets, such as `human-basic`.
    ///
    /// @return profile ID, may be null
    public String getProfileId() {
        return profileId;
    }

    /// Returns the nodes in authoring order.
    ///
    /// @return unmodifiable node list, never null
    public List<GraphNode> getNodes() {
        return nodes;
    }

    /// Returns the edges in authoring order.
    ///
    /// @return unmodifiable edge list, never null
    public List<GraphEdge> getEdges() {
        return edges;
    }

    /// Returns the authoring metadata.
    ///
    /// @return metadata, or null if not set
    public GraphMetadata getMetadata() {
        return metadata;
    }

    /// Creates a new graph definition builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable GraphDefinition instances.
    ///
    /// Required fields: `id`
    public static final class Builder {
        private String id;
        private String flowVersion = "1.0.0";
        private String name;
        private String description;
        private String profileId;
        private List<GraphNode> nodes = List.of();
        private List<GraphEdge> edges = List.of();
        private GraphMetadata metadata;

        private Builder() {}

        /// Sets the flow identifier (required).
        ///
        /// @param id unique flow ID, not null
        /// @return this builder for chaining
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /// Sets the author-controlled version.
        ///
        /// @param flowVersion version string (default "1.0.0")
        /// @return this builder for chaining
        public Builder flowVersion(String flowVersion) {
            this.flowVersion = flowVersion;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder profileId(String profileId) {
            this.profileId = profileId;
            return this;
        }

        /// Sets the nodes.
        ///
        /// @param nodes node list, not null
        /// @return this builder for chaining
        public Builder nodes(List<GraphNode> nodes) {
            this.nodes = List.copyOf(nodes);
            return this;
        }

        /// Sets the edges.
        ///
        /// @param edges edge list, not null
        /// @return this builder for chaining
        public Builder edges(List<GraphEdge> edges) {
            this.edges = List.copyOf(edges);
            return this;
        }

        public Builder metadata(GraphMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        /// Builds the immutable graph definition.
        ///
        /// @return new graph definition, never null
        /// @throws NullPointerException if id is not set
        public GraphDefinition build() {
            return new GraphDefinition(this);
        }
    }

    @Override
    public String toString() {
        return "GraphDefinition{id='"
                + id
                + "', flowVersion='"
                + flowVersion
                + "', nodes="
                + nodes.size()
                + ", edges="
                + edges.size()
                + "}";
    }
}
