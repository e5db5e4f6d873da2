package io.authflow.core.registry;

import io.authflow.core.graph.GraphDefinition;
import java.util.List;
import java.util.Optional;

/// Source of graph definitions for flow types.
///
/// Lookup order is fixed: the built-in flow for the type first, then a custom flow registered
/// by the tenant. Built-in flows therefore work without any tenant configuration.
///
/// @see InMemoryFlowRegistry for the default implementation
public interface FlowRegistry {

    /// Finds the flow serving a type for a tenant, with its owner.
    ///
    /// @param flowType requested flow type, not null
    /// @param tenantId tenant identifier, may be null (built-in flows only)
    /// @return the flow and its owner, or empty if none is available
    Optional<RegisteredFlow> resolve(FlowType flowType, String tenantId);

    /// Finds the flow serving a type for a tenant.
    ///
    /// @param flowType requested flow type, not null
    /// @param tenantId tenant identifier, may be null (built-in flows only)
    /// @return the graph definition, or empty if none is available
    default Optional<GraphDefinition> getFlow(FlowType flowType, String tenantId) {
        return resolve(flowType, tenantId).map(RegisteredFlow::graph);
    }

    /// Registers a built-in flow under its own id.
    ///
    /// @param flow built-in flow, not null
    void registerBuiltin(GraphDefinition flow);

    /// Registers a tenant-specific flow for a flow type, replacing any previous one.
    ///
    /// @param tenantId tenant identifier, not null
    /// @param flowType flow type served, not null
    /// @param flow graph definition, not null
    /// @throws IllegalArgumentException if the definition lacks a name or flow version
    void registerCustom(String tenantId, FlowType flowType, GraphDefinition flow);

    /// Returns the ids of all registered built-in flows.
    ///
    /// @return unmodifiable list of flow ids, never null
    List<String> getBuiltinFlowIds();
}
