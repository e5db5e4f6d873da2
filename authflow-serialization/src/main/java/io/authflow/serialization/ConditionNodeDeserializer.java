package io.authflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.authflow.core.condition.ConditionNode;
import io.authflow.core.condition.ConditionParser;
import io.authflow.core.exception.InvalidFlowConfigurationException;
import java.io.IOException;
import java.io.Serial;

/// Deserializes a `ConditionNode` tree.
///
/// The JSON tree is converted to plain maps and lists and handed to {@link ConditionParser}, so
/// JSON input follows exactly the same leniency and depth rules as conditions embedded in a
/// decision node's config.
///
/// @see ConditionNodeSerializer for the inverse operation
class ConditionNodeDeserializer extends StdDeserializer<ConditionNode> {

    @Serial private static final long serialVersionUID = -5316229418034791962L;

    ConditionNodeDeserializer() {
        super(ConditionNode.class);
    }

    @Override
    public ConditionNode deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        Object raw = mapper.convertValue(root, new TypeReference<Object>() {});
        try {
            return ConditionParser.parse(raw);
        } catch (InvalidFlowConfigurationException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
