package io.authflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.authflow.core.plan.BranchingConfig;
import io.authflow.core.plan.CompiledNode;
import io.authflow.core.plan.CompiledPlan;
import io.authflow.core.plan.DecisionBranch;
import io.authflow.core.plan.DecisionConfig;
import io.authflow.core.plan.ResolvedCapability;
import io.authflow.core.plan.SwitchCase;
import io.authflow.core.plan.SwitchConfig;
import io.authflow.core.plan.Transition;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Map;

/// Serializes a `CompiledPlan` so it can be cached outside the process.
///
/// Nodes and transitions are written as objects keyed by node id, in plan order. The
/// `BranchingConfig` hierarchy is written with a `"kind"` discriminator:
/// - **`DecisionConfig`**: `{"kind":"decision","branches":[...],"defaultBranch":"..."}`
/// - **`SwitchConfig`**: `{"kind":"switch","switchKey":"...","cases":[...],"defaultCase":"..."}`
///
/// @implNote Package-private. Registered by {@link AuthFlowJacksonModule}.
/// @see CompiledPlanDeserializer for the inverse operation
class CompiledPlanSerializer extends StdSerializer<CompiledPlan> {

    @Serial private static final long serialVersionUID = -3931476309857206014L;

    CompiledPlanSerializer() {
        super(CompiledPlan.class);
    }

    @Override
    public void serialize(CompiledPlan plan, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", plan.getId());
        gen.writeStringField("version", plan.getVersion());
        gen.writeStringField("sourceVersion", plan.getSourceVersion());
        if (plan.getProfileId() != null) {
            gen.writeStringField("profileId", plan.getProfileId());
        }
        gen.writeStringField("entryNodeId", plan.getEntryNodeId());
        if (plan.getCompiledAt() != null) {
            gen.writeStringField("compiledAt", plan.getCompiledAt().toString());
        }

        gen.writeObjectFieldStart("nodes");
        for (CompiledNode node : plan.getNodes().values()) {
            gen.writeFieldName(node.id());
            writeNode(node, gen, provider);
        }
        gen.writeEndObject();

        gen.writeObjectFieldStart("transitions");
        for (Map.Entry<String, List<Transition>> entry : plan.getTransitions().entrySet()) {
            gen.writeArrayFieldStart(entry.getKey());
            for (Transition transition : entry.getValue()) {
                writeTransition(transition, gen);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();

        gen.writeEndObject();
    }

    private void writeNode(CompiledNode node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.id());
        gen.writeStringField("type", node.type());
        if (node.intent() != null) {
            gen.writeStringField("intent", node.intent());
        }
        gen.writeArrayFieldStart("capabilities");
        for (ResolvedCapability capability : node.capabilities()) {
            gen.writeStartObject();
            gen.writeStringField("type", capability.type());
            gen.writeStringField("id", capability.id());
            gen.writeBooleanField("required", capability.required());
            gen.writeFieldName("hints");
            provider.defaultSerializeValue(capability.hints(), gen);
            gen.writeFieldName("validationRules");
            provider.defaultSerializeValue(capability.validationRules(), gen);
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeStringField("nextOnSuccess", node.nextOnSuccess());
        gen.writeStringField("nextOnError", node.nextOnError());
        if (node.decisionConfig() != null) {
            gen.writeFieldName("decisionConfig");
            writeBranching(node.decisionConfig(), gen, provider);
        }
        gen.writeEndObject();
    }

    private void writeBranching(
            BranchingConfig config, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (config instanceof DecisionConfig decision) {
            gen.writeStringField("kind", "decision");
            gen.writeArrayFieldStart("branches");
            for (DecisionBranch branch : decision.branches()) {
                gen.writeStartObject();
                gen.writeStringField("id", branch.id());
                if (branch.label() != null) {
                    gen.writeStringField("label", branch.label());
                }
                gen.writeFieldName("condition");
                provider.defaultSerializeValue(branch.condition(), gen);
                if (branch.priority() != null) {
                    gen.writeNumberField("priority", branch.priority());
                }
                gen.writeEndObject();
            }
            gen.writeEndArray();
            gen.writeStringField("defaultBranch", decision.defaultBranch());
        } else if (config instanceof SwitchConfig switchConfig) {
            gen.writeStringField("kind", "switch");
            gen.writeStringField("switchKey", switchConfig.switchKey());
            gen.writeArrayFieldStart("cases");
            for (SwitchCase switchCase : switchConfig.cases()) {
                gen.writeStartObject();
                gen.writeStringField("id", switchCase.id());
                if (switchCase.label() != null) {
                    gen.writeStringField("label", switchCase.label());
                }
                gen.writeFieldName("values");
                provider.defaultSerializeValue(switchCase.values(), gen);
                gen.writeEndObject();
            }
            gen.writeEndArray();
            gen.writeStringField("defaultCase", switchConfig.defaultCase());
        }
        gen.writeEndObject();
    }

    private void writeTransition(Transition transition, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("targetNodeId", transition.targetNodeId());
        gen.writeStringField("type", transition.type().wireName());
        if (transition.sourceHandle() != null) {
            gen.writeStringField("sourceHandle", transition.sourceHandle());
        }
        if (transition.priority() != null) {
            gen.writeNumberField("priority", transition.priority());
        }
        gen.writeEndObject();
    }
}
