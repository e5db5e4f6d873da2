package io.authflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.authflow.core.context.FlowContext;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Deserializes a `FlowContext` from an object keyed by section names.
///
/// Unknown top-level keys and non-object section values are dropped by
/// {@link FlowContext#fromMap(Map)}.
class FlowContextDeserializer extends StdDeserializer<FlowContext> {

    @Serial private static final long serialVersionUID = 8830165479283365812L;

    FlowContextDeserializer() {
        super(FlowContext.class);
    }

    @Override
    public FlowContext deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isObject()) {
            return FlowContext.empty();
        }
        Map<String, Object> raw = mapper.convertValue(root, new TypeReference<>() {});
        return FlowContext.fromMap(raw);
    }
}
