package io.authflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.authflow.core.context.FlowContext;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `FlowContext` as a plain object keyed by section names.
///
/// @implNote Package-private. Registered by {@link AuthFlowJacksonModule}. Values are written
/// as-is; pass the output through `ContextSanitizer` first when it is headed for a log.
class FlowContextSerializer extends StdSerializer<FlowContext> {

    @Serial private static final long serialVersionUID = -7406095843611190523L;

    FlowContextSerializer() {
        super(FlowContext.class);
    }

    @Override
    public void serialize(FlowContext context, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        provider.defaultSerializeValue(context.toMap(), gen);
    }
}
