package io.authflow.core.context;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Produces log-safe copies of context and session data.
///
/// - Values under keys that look sensitive (passwords, secrets, tokens, session ids, card
///   numbers, private keys...) are replaced by `[REDACTED]`
/// - Nesting deeper than {@value #MAX_DEPTH} levels is replaced by a marker
/// - Lists and maps larger than {@value #MAX_ITEMS} entries are replaced by a summary
/// - Reference cycles are replaced by a marker instead of recursing forever
///
/// ### Usage
/// {@snippet :
/// logger.fine("Context: " + ContextSanitizer.sanitize(context));
/// }
public final class ContextSanitizer {

    public static final int MAX_DEPTH = 10;
    public static final int MAX_ITEMS = 100;

    static final String REDACTED = "[REDACTED]";
    static final String MAX_DEPTH_EXCEEDED = "[MAX_DEPTH_EXCEEDED]";
    static final String CIRCULAR_REFERENCE = "[CIRCULAR_REFERENCE]";

    private static final List<String> SENSITIVE_KEYS =
            List.of(
                    "password",
                    "secret",
                    "token",
                    "authorization",
                    "api_key",
                    "apikey",
                    "sessionid",
                    "session_id",
                    "credit_card",
                    "creditcard",
                    "ssn",
                    "privatekey",
                    "private_key");

    private ContextSanitizer() {}

    /// Returns a sanitized copy of a context.
    ///
    /// @param context context to sanitize, may be null
    /// @return sanitized nested map keyed by section names, or null for null input
    public static Object sanitize(FlowContext context) {
        return context == null ? null : sanitize(context.toMap());
    }

    /// Returns a sanitized copy of arbitrary JSON-like data.
    ///
    /// @param value data to sanitize, may be null
    /// @return sanitized copy; scalars are returned unchanged
    public static Object sanitize(Object value) {
        return sanitize(value, Collections.newSetFromMap(new IdentityHashMap<>()), 0);
    }

    /// Returns whether a key names sensitive data.
    ///
    /// @param key map key, may be null
    /// @return true if the lower-cased key contains a sensitive word
    public static boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String sensitive : SENSITIVE_KEYS) {
            if (lower.contains(sensitive)) {
                return true;
            }
        }
        return false;
    }

    private static Object sanitize(Object value, Set<Object> ancestors, int depth) {
        if (depth > MAX_DEPTH) {
            return MAX_DEPTH_EXCEEDED;
        }
        if (!(value instanceof Map<?, ?>) && !(value instanceof Collection<?>)) {
            return value;
        }
        if (!ancestors.add(value)) {
            return CIRCULAR_REFERENCE;
        }
        try {
            if (value instanceof Collection<?> collection) {
                if (collection.size() > MAX_ITEMS) {
                    return "[Array("
                            + collection.size()
                            + ") - truncated to first "
                            + MAX_ITEMS
                            + " items]";
                }
                List<Object> copy = new ArrayList<>(collection.size());
                for (Object item : collection) {
                    copy.add(sanitize(item, ancestors, depth + 1));
                }
                return copy;
            }

            Map<?, ?> map = (Map<?, ?>) value;
            if (map.size() > MAX_ITEMS) {
                return "[Object with " + map.size() + " properties - truncated]";
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                copy.put(
                        key,
                        isSensitiveKey(key)
                                ? REDACTED
                                : sanitize(entry.getValue(), ancestors, depth + 1));
            }
            return copy;
        } finally {
            ancestors.remove(value);
        }
    }
}
