package io.authflow.core;

import io.authflow.core.condition.ConditionEvaluator;
import io.authflow.core.condition.RegexGuard;
import io.authflow.core.condition.SafeConditionEvaluator;
import io.authflow.core.execution.FlowExecutor;
import io.authflow.core.execution.FlowStepProcessor;
import io.authflow.core.execution.StepGuard;
import io.authflow.core.graph.GraphDefinition;
import io.authflow.core.plan.FlowCompiler;
import io.authflow.core.plan.InMemoryPlanCache;
import io.authflow.core.plan.PlanCache;
import io.authflow.core.registry.FlowRegistry;
import io.authflow.core.registry.InMemoryFlowRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Factory for creating and wiring authentication flow environments.
///
/// ### Usage Patterns
///
/// **Builder with built-in flows** (typical start-up):
/// {@snippet :
/// var env = AuthFlowFactory.builder()
///     .config(AuthFlowConfig.fromProperties(properties))
///     .builtinFlows(BuiltinFlows.loadAll())
///     .build();
/// }
///
/// **Quick start with defaults** (tests):
/// {@snippet :
/// var env = AuthFlowFactory.createEnvironment();
/// }
///
/// @implNote This is a utility class with only static methods. All dependencies
/// are wired explicitly via constructor injection in created components.
///
/// @see AuthFlowEnvironment
/// @see AuthFlowConfig
public final class AuthFlowFactory {

    private static final Logger logger = Logger.getLogger(AuthFlowFactory.class.getName());

    private AuthFlowFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with default configuration, the system clock and an empty
    /// registry.
    ///
    /// @return a fully-configured environment, never null
    public static AuthFlowEnvironment createEnvironment() {
        return createEnvironment(new AuthFlowConfig());
    }

    /// Creates an environment with custom configuration, the system clock and an empty
    /// registry.
    ///
    /// @param config configuration options for limits, not null
    /// @return a fully-configured environment, never null
    public static AuthFlowEnvironment createEnvironment(AuthFlowConfig config) {
        return builder().config(config).build();
    }

    /// Creates a new builder.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link AuthFlowEnvironment} instances.
    ///
    /// Components that are not set explicitly are created from the configuration:
    /// {@link SafeConditionEvaluator}, {@link InMemoryPlanCache} and
    /// {@link InMemoryFlowRegistry}.
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration
    /// before calling {@link #build()}.
    public static class Builder {
        private AuthFlowConfig config = new AuthFlowConfig();
        private Clock clock = Clock.systemUTC();
        private final List<GraphDefinition> builtinFlows = new ArrayList<>();
        private ConditionEvaluator conditionEvaluator;
        private FlowRegistry flowRegistry;
        private PlanCache planCache;

        /// Sets the configuration options.
        ///
        /// @param config the configuration, not null
        /// @return this builder for chaining, never null
        public Builder config(AuthFlowConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /// Sets the clock used for session timestamps, rate limiting and plan compile times.
        ///
        /// @param clock the clock, not null
        /// @return this builder for chaining, never null
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /// Adds built-in flows to register on build.
        ///
        /// @param flows flow definitions, not null
        /// @return this builder for chaining, never null
        public Builder builtinFlows(List<GraphDefinition> flows) {
            this.builtinFlows.addAll(flows);
            return this;
        }

        /// Replaces the default condition evaluator.
        ///
        /// @param conditionEvaluator the evaluator, may be null for the default
        /// @return this builder for chaining, never null
        public Builder conditionEvaluator(ConditionEvaluator conditionEvaluator) {
            this.conditionEvaluator = conditionEvaluator;
            return this;
        }

        /// Replaces the default in-memory registry. Built-in flows added through
        /// {@link #builtinFlows(List)} are registered into it as well.
        ///
        /// @param flowRegistry the registry, may be null for the default
        /// @return this builder for chaining, never null
        public Builder flowRegistry(FlowRegistry flowRegistry) {
            this.flowRegistry = flowRegistry;
            return this;
        }

        /// Replaces the default in-memory plan cache.
        ///
        /// @param planCache the cache, may be null for the default
        /// @return this builder for chaining, never null
        public Builder planCache(PlanCache planCache) {
            this.planCache = planCache;
            return this;
        }

        /// Builds the environment.
        ///
        /// @return a fully-configured environment, never null
        public AuthFlowEnvironment build() {
            ConditionEvaluator evaluator = conditionEvaluator;
            if (evaluator == null) {
                evaluator =
                        new SafeConditionEvaluator(
                                new RegexGuard(
                                        SafeConditionEvaluator.MAX_REGEX_LENGTH,
                                        config.getRegexStepBudget()));
            }

            FlowRegistry registry =
                    flowRegistry != null ? flowRegistry : new InMemoryFlowRegistry();
            builtinFlows.forEach(registry::registerBuiltin);

            PlanCache cache = planCache != null ? planCache : new InMemoryPlanCache();
            FlowCompiler compiler = new FlowCompiler(clock);
            FlowExecutor executor = new FlowExecutor(evaluator);
            StepGuard guard =
                    new StepGuard(
                            clock,
                            config.getMaxRequestsPerWindow(),
                            config.getRateLimitWindow(),
                            config.getMaxTimestampHistory(),
                            config.getSessionTimeout(),
                            config.getMaxVisitsPerNode(),
                            config.getMaxTotalNodes(),
                            config.getMaxVisitedHistory());
            FlowStepProcessor stepProcessor =
                    new FlowStepProcessor(registry, cache, compiler, executor, guard, clock);

            logger.info(
                    "AuthFlow environment created: builtinFlows="
                            + registry.getBuiltinFlowIds().size()
                            + ", sessionTimeout="
                            + config.getSessionTimeout());

            return new AuthFlowEnvironment(
                    evaluator, compiler, executor, guard, cache, registry, stepProcessor);
        }
    }
}
