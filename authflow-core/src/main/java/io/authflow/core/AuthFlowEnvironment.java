package io.authflow.core;

import io.authflow.core.condition.ConditionEvaluator;
import io.authflow.core.execution.FlowExecutor;
import io.authflow.core.execution.FlowStepProcessor;
import io.authflow.core.execution.StepGuard;
import io.authflow.core.plan.FlowCompiler;
import io.authflow.core.plan.PlanCache;
import io.authflow.core.registry.FlowRegistry;

/// Container holding all core components required to run authentication flows.
///
/// ### Contracts
/// - **Precondition**: All constructor parameters must be non-null
/// - **Postcondition**: All getters return the same instances passed to constructor
/// - **Invariant**: Component references are immutable after construction
///
/// @implNote Safe for concurrent reads. All fields are final and set at construction time.
///
/// @apiNote Create instances via {@link AuthFlowFactory#createEnvironment()} or
/// {@link AuthFlowFactory.Builder} rather than direct construction.
///
/// @see AuthFlowFactory.Builder
public final class AuthFlowEnvironment {

    private final ConditionEvaluator conditionEvaluator;
    private final FlowCompiler flowCompiler;
    private final FlowExecutor flowExecutor;
    private final StepGuard stepGuard;
    private final PlanCache planCache;
    private final FlowRegistry flowRegistry;
    private final FlowStepProcessor stepProcessor;

    /// Creates a new environment with the specified components.
    ///
    /// @param conditionEvaluator evaluator for branch conditions, not null
    /// @param flowCompiler compiler turning graph definitions into plans, not null
    /// @param flowExecutor next-node resolver, not null
    /// @param stepGuard per-session admission control, not null
    /// @param planCache cache of compiled plans, not null
    /// @param flowRegistry built-in and tenant flow lookup, not null
    /// @param stepProcessor step-submission pipeline wired from the components above, not null
    public AuthFlowEnvironment(
            ConditionEvaluator conditionEvaluator,
            FlowCompiler flowCompiler,
            FlowExecutor flowExecutor,
            StepGuard stepGuard,
            PlanCache planCache,
            FlowRegistry flowRegistry,
            FlowStepProcessor stepProcessor) {
        this.conditionEvaluator = conditionEvaluator;
        this.flowCompiler = flowCompiler;
        this.flowExecutor = flowExecutor;
        this.stepGuard = stepGuard;
        this.planCache = planCache;
        this.flowRegistry = flowRegistry;
        this.stepProcessor = stepProcessor;
    }

    public ConditionEvaluator getConditionEvaluator() {
        return conditionEvaluator;
    }

    public FlowCompiler getFlowCompiler() {
        return flowCompiler;
    }

    public FlowExecutor getFlowExecutor() {
        return flowExecutor;
    }

    public StepGuard getStepGuard() {
        return stepGuard;
    }

    /// Returns the cache of compiled plans.
    ///
    /// Invalidate a flow here after replacing its definition in the registry with the same
    /// version string.
    ///
    /// @return the plan cache, never null
    public PlanCache getPlanCache() {
        return planCache;
    }

    /// Returns the registry of built-in and tenant-registered flows.
    ///
    /// @return the flow registry, never null
    public FlowRegistry getFlowRegistry() {
        return flowRegistry;
    }

    /// Returns the step-submission pipeline.
    ///
    /// @return the step processor, never null
    public FlowStepProcessor getStepProcessor() {
        return stepProcessor;
    }
}
