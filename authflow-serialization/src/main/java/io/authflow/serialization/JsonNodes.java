package io.authflow.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;

/// Field readers shared by the tree-based deserializers.
final class JsonNodes {

    private JsonNodes() {}

    /// Returns a textual field, or null when absent, null or not a string.
    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    /// Returns a textual field, failing when it is missing.
    static String requiredText(JsonNode node, String field, String owner) throws IOException {
        String value = text(node, field);
        if (value == null) {
            throw new IOException("Missing " + owner + " field: " + field);
        }
        return value;
    }

    /// Returns an integral field that fits an `int`, or null.
    static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber() || !value.canConvertToInt()) {
            return null;
        }
        double number = value.doubleValue();
        if (value.isFloatingPointNumber() && number != Math.rint(number)) {
            return null;
        }
        return value.intValue();
    }

    /// Returns a boolean field, or the fallback when absent or not a boolean.
    static boolean bool(JsonNode node, String field, boolean fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isBoolean() ? value.booleanValue() : fallback;
    }
}
