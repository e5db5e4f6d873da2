package io.authflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.authflow.core.graph.EdgeType;
import io.authflow.core.graph.GraphEdge;
import java.io.IOException;
import java.io.Serial;

/// Deserializes a `GraphEdge` from the editor's edge shape.
///
/// Editors may keep the display label under `data.label`; a top-level `label` wins when both
/// are present. A non-integral or out-of-range `priority` is dropped.
///
/// @see GraphEdgeSerializer for the inverse operation
class GraphEdgeDeserializer extends StdDeserializer<GraphEdge> {

    @Serial private static final long serialVersionUID = -2470683015539260861L;

    GraphEdgeDeserializer() {
        super(GraphEdge.class);
    }

    @Override
    public GraphEdge deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String typeName = JsonNodes.text(root, "type");
        EdgeType type =
                EdgeType.fromWireName(typeName)
                        .orElseThrow(() -> new IOException("Unknown edge type: " + typeName));

        String label = JsonNodes.text(root, "label");
        if (label == null && root.path("data").isObject()) {
            label = JsonNodes.text(root.get("data"), "label");
        }

        return new GraphEdge(
                JsonNodes.requiredText(root, "id", "edge"),
                JsonNodes.requiredText(root, "source", "edge"),
                JsonNodes.requiredText(root, "target", "edge"),
                type,
                JsonNodes.text(root, "sourceHandle"),
                JsonNodes.integer(root, "priority"),
                label);
    }
}
