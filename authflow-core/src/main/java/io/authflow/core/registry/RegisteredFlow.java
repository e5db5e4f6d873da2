package io.authflow.core.registry;

import io.authflow.core.graph.GraphDefinition;
import java.util.Objects;

/// A flow definition together with the tenant that owns it.
///
/// Flow ids are only unique per owner: two tenants may register custom flows with the same id
/// and version. Anything keyed by flow id, such as the plan cache, must key by owner as well.
///
/// @param graph the flow definition, not null
/// @param ownerTenantId tenant that registered the flow, or null for a built-in flow
public record RegisteredFlow(GraphDefinition graph, String ownerTenantId) {

    public RegisteredFlow {
        Objects.requireNonNull(graph, "graph must not be null");
    }

    public static RegisteredFlow builtin(GraphDefinition graph) {
        return new RegisteredFlow(graph, null);
    }

    public static RegisteredFlow custom(String tenantId, GraphDefinition graph) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        return new RegisteredFlow(graph, tenantId);
    }

    public boolean isBuiltin() {
        return ownerTenantId == null;
    }
}
