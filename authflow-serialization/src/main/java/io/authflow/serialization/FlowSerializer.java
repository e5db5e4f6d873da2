package io.authflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.authflow.core.condition.ConditionNode;
import io.authflow.core.context.FlowContext;
import io.authflow.core.graph.GraphDefinition;
import io.authflow.core.plan.CompiledPlan;

/// Utility class for reading and writing flows, plans, conditions and contexts as JSON.
///
/// ### Usage
/// {@snippet :
/// // Graph definitions as stored by the flow editor
/// GraphDefinition flow = FlowSerializer.fromJson(json);
/// String stored = FlowSerializer.toJson(flow);
///
/// // Compiled plans for an external cache
/// String planJson = FlowSerializer.planToJson(plan);
/// CompiledPlan restored = FlowSerializer.planFromJson(planJson);
/// }
///
/// @implNote Thread-safe. The ObjectMapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see AuthFlowJacksonModule for the registered type handlers
public final class FlowSerializer {

    private FlowSerializer() {}

    /// Serializes a graph definition to pretty-printed JSON.
    ///
    /// @param flow the flow to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(GraphDefinition flow) {
        return write(flow, "flow");
    }

    /// Deserializes a graph definition from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized flow, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static GraphDefinition fromJson(String json) {
        return read(json, GraphDefinition.class, "flow");
    }

    /// Serializes a compiled plan to JSON.
    ///
    /// @param plan the plan to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String planToJson(CompiledPlan plan) {
        return write(plan, "plan");
    }

    /// Deserializes a compiled plan from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized plan, never null
    /// @throws IllegalArgumentException if deserialization fails or the plan is inconsistent
    public static CompiledPlan planFromJson(String json) {
        return read(json, CompiledPlan.class, "plan");
    }

    public static String conditionToJson(ConditionNode condition) {
        return write(condition, "condition");
    }

    /// Deserializes a condition tree from JSON.
    ///
    /// @param json JSON string, not null
    /// @return parsed condition tree, never null
    /// @throws IllegalArgumentException if the JSON is malformed or the tree too deep
    public static ConditionNode conditionFromJson(String json) {
        return read(json, ConditionNode.class, "condition");
    }

    public static String contextToJson(FlowContext context) {
        return write(context, "context");
    }

    public static FlowContext contextFromJson(String json) {
        return read(json, FlowContext.class, "context");
    }

    /// Creates an ObjectMapper configured for flow serialization.
    ///
    /// Registers:
    /// - `AuthFlowJacksonModule` for the flow, plan, condition and context types
    /// - `JavaTimeModule` for the `Instant` fields of graph metadata
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new AuthFlowJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static String write(Object value, String what) {
        try {
            return createMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }

    private static <T> T read(String json, Class<T> type, String what) {
        try {
            return createMapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize " + what + ": " + e.getMessage(), e);
        }
    }
}
