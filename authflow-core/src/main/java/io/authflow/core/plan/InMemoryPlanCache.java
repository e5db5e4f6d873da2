package io.authflow.core.plan;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory plan cache (default implementation).
///
/// Thread-safe, unbounded. Holds at most one plan per owner and flow id, so memory grows with
/// the number of distinct flows, not with versions.
///
/// ### Storage Structure
/// - plans: (ownerTenantId, flowId) -> plan, with a null owner for built-in flows
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
public final class InMemoryPlanCache implements PlanCache {

    private final Map<PlanKey, CompiledPlan> plans = new ConcurrentHashMap<>();

    @Override
    public Optional<CompiledPlan> get(String ownerTenantId, String flowId, String flowVersion) {
        Objects.requireNonNull(flowId, "flowId must not be null");

        CompiledPlan plan = plans.get(new PlanKey(ownerTenantId, flowId));
        if (plan == null || !Objects.equals(plan.getSourceVersion(), flowVersion)) {
            return Optional.empty();
        }
        return Optional.of(plan);
    }

    @Override
    public void put(String ownerTenantId, CompiledPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        plans.put(new PlanKey(ownerTenantId, plan.getId()), plan);
    }

    @Override
    public boolean invalidate(String ownerTenantId, String flowId) {
        Objects.requireNonNull(flowId, "flowId must not be null");
        return plans.remove(new PlanKey(ownerTenantId, flowId)) != null;
    }

    /// Returns the number of cached plans.
    ///
    /// @return cache size
    public int size() {
        return plans.size();
    }

    private record PlanKey(String ownerTenantId, String flowId) {}
}
