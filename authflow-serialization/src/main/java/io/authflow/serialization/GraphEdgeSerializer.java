package io.authflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.authflow.core.graph.GraphEdge;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `GraphEdge` with its lower-case edge type.
///
/// Emitted JSON shape:
/// `{"id":"...","source":"...","target":"...","type":"success|error|conditional"}` plus
/// `sourceHandle`, `priority` and `label` when present.
///
/// @implNote Package-private. Registered by {@link AuthFlowJacksonModule}.
/// @see GraphEdgeDeserializer for the inverse operation
class GraphEdgeSerializer extends StdSerializer<GraphEdge> {

    @Serial private static final long serialVersionUID = 6046128857102734175L;

    GraphEdgeSerializer() {
        super(GraphEdge.class);
    }

    @Override
    public void serialize(GraphEdge edge, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", edge.id());
        gen.writeStringField("source", edge.source());
        gen.writeStringField("target", edge.target());
        gen.writeStringField("type", edge.type().wireName());
        if (edge.sourceHandle() != null) {
            gen.writeStringField("sourceHandle", edge.sourceHandle());
        }
        if (edge.priority() != null) {
            gen.writeNumberField("priority", edge.priority());
        }
        if (edge.label() != null) {
            gen.writeStringField("label", edge.label());
        }
        gen.writeEndObject();
    }
}
