package io.authflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.authflow.core.condition.ConditionNode;
import io.authflow.core.graph.EdgeType;
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
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Deserializes a `CompiledPlan` written by {@link CompiledPlanSerializer}.
///
/// Conditions are read back through the registered `ConditionNode` deserializer. A plan whose
/// entry node is missing from its nodes is rejected.
class CompiledPlanDeserializer extends StdDeserializer<CompiledPlan> {

    @Serial private static final long serialVersionUID = 4417603580392213657L;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> RULES_TYPE =
            new TypeReference<>() {};
    private static final TypeReference<List<Object>> VALUES_TYPE = new TypeReference<>() {};

    CompiledPlanDeserializer() {
        super(CompiledPlan.class);
    }

    @Override
    public CompiledPlan deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        Map<String, CompiledNode> nodes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> nodeFields = root.path("nodes").fields();
        while (nodeFields.hasNext()) {
            Map.Entry<String, JsonNode> field = nodeFields.next();
            nodes.put(field.getKey(), readNode(field.getValue(), mapper));
        }

        Map<String, List<Transition>> transitions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> transitionFields =
                root.path("transitions").fields();
        while (transitionFields.hasNext()) {
            Map.Entry<String, JsonNode> field = transitionFields.next();
            List<Transition> list = new ArrayList<>();
            for (JsonNode t : field.getValue()) {
                list.add(readTransition(t));
            }
            transitions.put(field.getKey(), list);
        }

        CompiledPlan.Builder builder =
                CompiledPlan.builder()
                        .id(JsonNodes.requiredText(root, "id", "plan"))
                        .sourceVersion(JsonNodes.text(root, "sourceVersion"))
                        .profileId(JsonNodes.text(root, "profileId"))
                        .entryNodeId(JsonNodes.requiredText(root, "entryNodeId", "plan"))
                        .nodes(nodes)
                        .transitions(transitions)
                        .compiledAt(readInstant(root, "compiledAt"));
        String version = JsonNodes.text(root, "version");
        if (version != null) {
            builder.version(version);
        }

        try {
            return builder.build();
        } catch (IllegalStateException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }

    private CompiledNode readNode(JsonNode node, ObjectMapper mapper) throws IOException {
        List<ResolvedCapability> capabilities = new ArrayList<>();
        for (JsonNode c : node.path("capabilities")) {
            capabilities.add(
                    new ResolvedCapability(
                            JsonNodes.text(c, "type"),
                            JsonNodes.text(c, "id"),
                            JsonNodes.bool(c, "required", false),
                            c.hasNonNull("hints")
                                    ? mapper.convertValue(c.get("hints"), MAP_TYPE)
                                    : null,
                            c.hasNonNull("validationRules")
                                    ? mapper.convertValue(c.get("validationRules"), RULES_TYPE)
                                    : null));
        }

        BranchingConfig branching = null;
        if (node.hasNonNull("decisionConfig")) {
            branching = readBranching(node.get("decisionConfig"), mapper);
        }

        return new CompiledNode(
                JsonNodes.requiredText(node, "id", "node"),
                JsonNodes.requiredText(node, "type", "node"),
                JsonNodes.text(node, "intent"),
                capabilities,
                JsonNodes.text(node, "nextOnSuccess"),
                JsonNodes.text(node, "nextOnError"),
                branching);
    }

    private BranchingConfig readBranching(JsonNode config, ObjectMapper mapper)
            throws IOException {
        String kind = JsonNodes.requiredText(config, "kind", "branching config");
        return switch (kind) {
            case "decision" -> {
                List<DecisionBranch> branches = new ArrayList<>();
                for (JsonNode b : config.path("branches")) {
                    if (!b.hasNonNull("condition")) {
                        throw new IOException("Missing branch field: condition");
                    }
                    branches.add(
                            new DecisionBranch(
                                    JsonNodes.requiredText(b, "id", "branch"),
                                    JsonNodes.text(b, "label"),
                                    mapper.treeToValue(b.get("condition"), ConditionNode.class),
                                    JsonNodes.integer(b, "priority")));
                }
                yield new DecisionConfig(branches, JsonNodes.text(config, "defaultBranch"));
            }
            case "switch" -> {
                List<SwitchCase> cases = new ArrayList<>();
                for (JsonNode c : config.path("cases")) {
                    cases.add(
                            new SwitchCase(
                                    JsonNodes.requiredText(c, "id", "case"),
                                    JsonNodes.text(c, "label"),
                                    c.hasNonNull("values")
                                            ? mapper.convertValue(c.get("values"), VALUES_TYPE)
                                            : null));
                }
                yield new SwitchConfig(
                        JsonNodes.requiredText(config, "switchKey", "switch config"),
                        cases,
                        JsonNodes.text(config, "defaultCase"));
            }
            default -> throw new IOException("Unknown branching config kind: " + kind);
        };
    }

    private Transition readTransition(JsonNode node) throws IOException {
        String typeName = JsonNodes.text(node, "type");
        EdgeType type =
                EdgeType.fromWireName(typeName)
                        .orElseThrow(
                                () -> new IOException("Unknown transition type: " + typeName));
        return new Transition(
                JsonNodes.requiredText(node, "targetNodeId", "transition"),
                type,
                JsonNodes.text(node, "sourceHandle"),
                JsonNodes.integer(node, "priority"));
    }

    private static Instant readInstant(JsonNode node, String field) throws IOException {
        String text = JsonNodes.text(node, field);
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new IOException("Invalid " + field + ": " + text, e);
        }
    }
}
