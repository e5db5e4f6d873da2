package io.authflow.core.plan;

import io.authflow.core.exception.InvalidFlowConfigurationException;
import io.authflow.core.graph.GraphDefinition;
import java.util.Optional;

/// Cache of compiled plans keyed by flow owner and flow id.
///
/// The owner is the tenant that registered a custom flow, or null for a built-in flow. Flow ids
/// are not unique across tenants, so a plan cached for one owner is never returned to another.
///
/// A cached plan is only valid for the flow version it was compiled from. Looking up a flow
/// with a different version is a miss, and the next {@link #put} replaces the stale plan.
///
/// @see InMemoryPlanCache for the default implementation
public interface PlanCache {

    /// Returns the cached plan of a flow if it was compiled from the given version.
    ///
    /// @param ownerTenantId owning tenant, null for built-in flows
    /// @param flowId flow identifier, not null
    /// @param flowVersion expected source version, may be null
    /// @return the cached plan, or empty on a miss or version mismatch
    Optional<CompiledPlan> get(String ownerTenantId, String flowId, String flowVersion);

    /// Stores a plan under its owner and id, replacing any previous plan of the same flow.
    ///
    /// @param ownerTenantId owning tenant, null for built-in flows
    /// @param plan plan to cache, not null
    void put(String ownerTenantId, CompiledPlan plan);

    /// Removes the cached plan of a flow.
    ///
    /// @param ownerTenantId owning tenant, null for built-in flows
    /// @param flowId flow identifier, not null
    /// @return true if a plan was removed
    boolean invalidate(String ownerTenantId, String flowId);

    /// Returns the cached plan for a graph, compiling and caching it on a miss.
    ///
    /// @param ownerTenantId owning tenant, null for built-in flows
    /// @param graph graph definition, not null
    /// @param compiler compiler used on a miss, not null
    /// @return plan compiled from the graph's current version, never null
    /// @throws InvalidFlowConfigurationException if compilation fails; nothing is cached then
    default CompiledPlan getOrCompile(
            String ownerTenantId, GraphDefinition graph, FlowCompiler compiler)
            throws InvalidFlowConfigurationException {
        Optional<CompiledPlan> cached = get(ownerTenantId, graph.getId(), graph.getFlowVersion());
        if (cached.isPresent()) {
            return cached.get();
        }
        CompiledPlan plan = compiler.compile(graph);
        put(ownerTenantId, plan);
        return plan;
    }
}
