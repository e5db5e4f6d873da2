package io.authflow.core.registry;

import io.authflow.core.graph.GraphDefinition;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory flow registry (default implementation).
///
/// Thread-safe, no external dependencies. Built-in flows are indexed by flow id; custom flows by
/// tenant id and flow type.
///
/// ### Storage Structure
/// - builtins: flowId -> flow
/// - custom: tenantId -> flowType -> flow
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
public final class InMemoryFlowRegistry implements FlowRegistry {

    private final Map<String, GraphDefinition> builtins = new ConcurrentHashMap<>();
    private final Map<String, Map<FlowType, GraphDefinition>> custom = new ConcurrentHashMap<>();

    public InMemoryFlowRegistry() {}

    /// Creates a registry preloaded with built-in flows.
    ///
    /// @param builtinFlows built-in flows, not null
    public InMemoryFlowRegistry(List<GraphDefinition> builtinFlows) {
        builtinFlows.forEach(this::registerBuiltin);
    }

    @Override
    public Optional<RegisteredFlow> resolve(FlowType flowType, String tenantId) {
        Objects.requireNonNull(flowType, "flowType must not be null");

        GraphDefinition builtin = builtins.get(flowType.builtinFlowId());
        if (builtin != null) {
            return Optional.of(RegisteredFlow.builtin(builtin));
        }
        if (tenantId == null || tenantId.isEmpty()) {
            return Optional.empty();
        }
        Map<FlowType, GraphDefinition> tenantFlows = custom.get(tenantId);
        if (tenantFlows == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tenantFlows.get(flowType))
                .map(flow -> RegisteredFlow.custom(tenantId, flow));
    }

    @Override
    public void registerBuiltin(GraphDefinition flow) {
        Objects.requireNonNull(flow, "flow must not be null");
        builtins.put(flow.getId(), flow);
    }

    @Override
    public void registerCustom(String tenantId, FlowType flowType, GraphDefinition flow) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(flowType, "flowType must not be null");
        Objects.requireNonNull(flow, "flow must not be null");
        if (flow.getName() == null || flow.getFlowVersion() == null) {
            throw new IllegalArgumentException(
                    "Custom flow '" + flow.getId() + "' must declare a name and a flow version");
        }

        custom.computeIfAbsent(tenantId, t -> new ConcurrentHashMap<>()).put(flowType, flow);
    }

    @Override
    public List<String> getBuiltinFlowIds() {
        return List.copyOf(builtins.keySet());
    }
}
