package io.authflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.authflow.core.condition.ConditionNode;
import io.authflow.core.context.FlowContext;
import io.authflow.core.graph.CapabilityTemplate;
import io.authflow.core.graph.GraphDefinition;
import io.authflow.core.graph.GraphEdge;
import io.authflow.core.graph.GraphNode;
import io.authflow.core.plan.CompiledPlan;
import io.authflow.serialization.mixin.CapabilityTemplateMixin;
import io.authflow.serialization.mixin.GraphDefinitionBuilderMixin;
import io.authflow.serialization.mixin.GraphDefinitionMixin;
import io.authflow.serialization.mixin.GraphNodeMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all flow serialization configuration in one place.
///
/// **Custom serializer/deserializer pairs** (wire names and sealed hierarchies):
/// - `ConditionNode` - `ConditionNodeSerializer` / `ConditionNodeDeserializer`; a map holding
///   `conditions` or `logic` is a group, anything else a single predicate
/// - `GraphEdge` - `GraphEdgeSerializer` / `GraphEdgeDeserializer`, lower-case edge types
/// - `CompiledPlan` - `CompiledPlanSerializer` / `CompiledPlanDeserializer`, branching
///   configs discriminated by `"kind"`
/// - `FlowContext` - `FlowContextSerializer` / `FlowContextDeserializer`, a plain object keyed
///   by section names
///
/// **Mixins** (immutable domain types read through builders or canonical constructors):
/// - `GraphDefinition` + `GraphDefinition.Builder`
/// - `GraphNode`, `CapabilityTemplate`
///
/// @implNote All registrations are explicit. No classpath scanning.
/// @see FlowSerializer for the convenience factory API
public class AuthFlowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3518862016250779411L;

    public AuthFlowJacksonModule() {
        super("AuthFlowJacksonModule");

        addSerializer(ConditionNode.class, new ConditionNodeSerializer());
        addDeserializer(ConditionNode.class, new ConditionNodeDeserializer());

        addSerializer(GraphEdge.class, new GraphEdgeSerializer());
        addDeserializer(GraphEdge.class, new GraphEdgeDeserializer());

        addSerializer(CompiledPlan.class, new CompiledPlanSerializer());
        addDeserializer(CompiledPlan.class, new CompiledPlanDeserializer());

        addSerializer(FlowContext.class, new FlowContextSerializer());
        addDeserializer(FlowContext.class, new FlowContextDeserializer());
    }

    /// Applies mixin annotations to graph definition types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(GraphDefinition.class, GraphDefinitionMixin.class);
        context.setMixInAnnotations(
                GraphDefinition.Builder.class, GraphDefinitionBuilderMixin.class);

        context.setMixInAnnotations(GraphNode.class, GraphNodeMixin.class);
        context.setMixInAnnotations(CapabilityTemplate.class, CapabilityTemplateMixin.class);
    }
}
