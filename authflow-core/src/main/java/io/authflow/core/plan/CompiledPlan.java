package io.authflow.core.plan;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable, validated and indexed form of a flow, ready for execution.
///
/// A plan indexes nodes by id and outgoing transitions by source node id. Transition lists are
/// sorted by ascending priority, edge order among equal priorities, unprioritized transitions
/// last. Plans carry no mutable state and are shared freely across sessions and threads.
///
/// ### Versions
/// - `version` is the plan format version
/// - `sourceVersion` is the `flowVersion` of the graph definition this plan was compiled from;
///   caches use it to detect stale plans
///
/// @implNote Immutable and thread-safe after construction.
/// @see FlowCompiler for how plans are produced
public final class CompiledPlan {

    private final String id;
    private final String version;
    private final String sourceVersion;
    private final String profileId;
    private final String entryNodeId;
    private final Map<String, CompiledNode> nodes;
    private final Map<String, List<Transition>> transitions;
    private final Instant compiledAt;

    private CompiledPlan(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Plan ID required");
        this.version = builder.version;
        this.sourceVersion = builder.sourceVersion;
        this.profileId = builder.profileId;
        this.entryNodeId = Objects.requireNonNull(builder.entryNodeId, "Entry node required");
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
        Map<String, List<Transition>> index = new LinkedHashMap<>();
        builder.transitions.forEach((source, list) -> index.put(source, List.copyOf(list)));
        this.transitions = Collections.unmodifiableMap(index);
        this.compiledAt = builder.compiledAt;

        if (!nodes.containsKey(entryNodeId)) {
            throw new IllegalStateException(
                    "Entry node '" + entryNodeId + "' not found in plan nodes");
        }
    }

    /// Returns the plan identifier, equal to the id of the source flow.
    ///
    /// @return plan ID, never null
    public String getId() {
        return id;
    }

    /// Returns the plan format version.
    ///
    /// @return format version, may be null
    public String getVersion() {
        return version;
    }

    /// Returns the `flowVersion` of the source graph definition.
    ///
    /// @return source version, may be null
    public String getSourceVersion() {
        return sourceVersion;
    }

    public String getProfileId() {
        return profileId;
    }

    /// Returns the id of the node execution starts at.
    ///
    /// @return entry node ID, never null, always a key of {@link #getNodes()}
    public String getEntryNodeId() {
        return entryNodeId;
    }

    /// Returns all nodes by id, in authoring order.
    ///
    /// @return unmodifiable node index, never null
    public Map<String, CompiledNode> getNodes() {
        return nodes;
    }

    /// Returns all transition lists by source node id.
    ///
    /// @return unmodifiable transition index, never null
    public Map<String, List<Transition>> getTransitions() {
        return transitions;
    }

    public Instant getCompiledAt() {
        return compiledAt;
    }

    /// Looks up a node.
    ///
    /// @param nodeId node id, may be null
    /// @return the node, or empty if the plan has no such node
    public Optional<CompiledNode> getNode(String nodeId) {
        return nodeId == null ? Optional.empty() : Optional.ofNullable(nodes.get(nodeId));
    }

    /// Returns whether the plan contains a node.
    ///
    /// @param nodeId node id, may be null
    /// @return true if the node exists
    public boolean hasNode(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    /// Returns the ordered outgoing transitions of a node.
    ///
    /// @param nodeId source node id, may be null
    /// @return unmodifiable transition list, empty if the node has none
    public List<Transition> getTransitionsFrom(String nodeId) {
        List<Transition> list = nodeId == null ? null : transitions.get(nodeId);
        return list != null ? list : List.of();
    }

    /// Creates a new plan builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable CompiledPlan instances.
    ///
    /// Required fields: `id`, `entryNodeId`. The entry node must exist in the node index.
    public static final class Builder {
        private String id;
        private String version = FlowCompiler.PLAN_FORMAT_VERSION;
        private String sourceVersion;
        private String profileId;
        private String entryNodeId;
        private Map<String, CompiledNode> nodes = new LinkedHashMap<>();
        private Map<String, List<Transition>> transitions = new LinkedHashMap<>();
        private Instant compiledAt;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder sourceVersion(String sourceVersion) {
            this.sourceVersion = sourceVersion;
            return this;
        }

        public Builder profileId(String profileId) {
            this.profileId = profileId;
            return this;
        }

        public Builder entryNodeId(String entryNodeId) {
            this.entryNodeId = entryNodeId;
            return this;
        }

        /// Sets the node index.
        ///
        /// @param nodes node id to node, not null
        /// @return this builder for chaining
        public Builder nodes(Map<String, CompiledNode> nodes) {
            this.nodes = new LinkedHashMap<>(nodes);
            return this;
        }

        /// Sets the transition index. Lists are copied as given; callers supply them sorted.
        ///
        /// @param transitions source node id to ordered transitions, not null
        /// @return this builder for chaining
        public Builder transitions(Map<String, List<Transition>> transitions) {
            this.transitions = new LinkedHashMap<>(transitions);
            return this;
        }

        public Builder compiledAt(Instant compiledAt) {
            this.compiledAt = compiledAt;
            return this;
        }

        /// Builds the immutable plan.
        ///
        /// @return new plan, never null
        /// @throws NullPointerException if id or entryNodeId is not set
        /// @throws IllegalStateException if the entry node is not in the node index
        public CompiledPlan build() {
            return new CompiledPlan(this);
        }
    }

    @Override
    public String toString() {
        return "CompiledPlan{id='"
                + id
                + "', sourceVersion='"
                + sourceVersion
                + "', entryNodeId='"
                + entryNodeId
                + "', nodes="
                + nodes.size()
                + "}";
    }
}
