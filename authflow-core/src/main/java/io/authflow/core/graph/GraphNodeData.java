package io.authflow.core.graph;

import io.authflow.core.context.ContextValues;
import java.util.List;
import java.util.Map;

/// Payload of a graph node.
///
/// `config` is the node-specific configuration as authored. For `decision` and `switch` nodes
/// it holds the branches or cases and is validated by the compiler; for other node types it is
/// passed through untouched.
///
/// @param label display label, may be null
/// @param intent what the node is meant to achieve, such as `identify_user`, may be null
/// @param capabilities capability templates, never null after construction
/// @param config node-specific configuration, never null after construction
public record GraphNodeData(
        String label,
        String intent,
        List<CapabilityTemplate> capabilities,
        Map<String, Object> config) {

    public GraphNodeData {
        capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
        config = ContextValues.freezeMap(config);
    }
}
