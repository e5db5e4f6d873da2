package io.authflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.authflow.core.condition.ConditionGroup;
import io.authflow.core.condition.ConditionNode;
import io.authflow.core.condition.FlowCondition;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `ConditionNode` sealed hierarchy.
///
/// Emitted JSON shape per subtype:
/// - **`FlowCondition`**: `{"key":"risk.score","operator":"greaterThan","value":70}`, `value`
///   omitted when absent
/// - **`ConditionGroup`**: `{"logic":"and","conditions":[...]}`
///
/// An operator or logic the parser did not recognise is written as `null`.
///
/// @implNote Package-private. Registered by {@link AuthFlowJacksonModule}.
/// @see ConditionNodeDeserializer for the inverse operation
class ConditionNodeSerializer extends StdSerializer<ConditionNode> {

    @Serial private static final long serialVersionUID = 2294750146305624816L;

    ConditionNodeSerializer() {
        super(ConditionNode.class);
    }

    @Override
    public void serialize(ConditionNode node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (node instanceof FlowCondition condition) {
            gen.writeStringField("key", condition.key());
            gen.writeStringField(
                    "operator",
                    condition.operator() != null ? condition.operator().wireName() : null);
            if (condition.value() != null) {
                gen.writeFieldName("value");
                provider.defaultSerializeValue(condition.value(), gen);
            }
        } else if (node instanceof ConditionGroup group) {
            gen.writeStringField(
                    "logic", group.logic() != null ? group.logic().wireName() : null);
            gen.writeArrayFieldStart("conditions");
            for (ConditionNode child : group.conditions()) {
                serialize(child, gen, provider);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }
}
