package io.authflow.core.context;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Value helpers shared by the context model, the condition evaluator and the executor.
///
/// Context values mirror JSON: strings, numbers, booleans, lists and string-keyed maps.
/// Comparison helpers follow JSON-scalar semantics, so an `Integer` 30 equals a `Double` 30.0
/// and `NaN` never equals anything under strict equality.
public final class ContextValues {

    /// Maximum nesting kept when freezing external data. Deeper values are dropped.
    public static final int MAX_FREEZE_DEPTH = 32;

    private ContextValues() {}

    /// Produces a deeply unmodifiable copy of a JSON-like value.
    ///
    /// Maps become insertion-ordered unmodifiable maps with string keys and without null
    /// entries, collections and arrays become unmodifiable lists, characters and enums become
    /// strings. Anything else that is not a string, number or boolean is converted with
    /// `String.valueOf`.
    ///
    /// @param value value to freeze, may be null
    /// @return frozen value, or null if the input was null or nested too deeply
    public static Object freeze(Object value) {
        return freeze(value, 0);
    }

    private static Object freeze(Object value, int depth) {
        if (value == null || depth > MAX_FREEZE_DEPTH) {
            return null;
        }
        if (value instanceof String || value instanceof Boolean || value instanceof Number) {
            return value;
        }
        if (value instanceof Character || value instanceof Enum<?>) {
            return value.toString();
        }
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map, depth);
        }
        if (value instanceof Collection<?> collection) {
            return freezeList(collection, depth);
        }
        if (value instanceof Object[] array) {
            return freezeList(Arrays.asList(array), depth);
        }
        return String.valueOf(value);
    }

    /// Freezes a map into an unmodifiable, string-keyed map.
    ///
    /// @param map source map, may be null
    /// @return frozen map, never null (empty for null input)
    public static Map<String, Object> freezeMap(Map<?, ?> map) {
        return map == null ? Map.of() : freezeMap(map, 0);
    }

    private static Map<String, Object> freezeMap(Map<?, ?> map, int depth) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            Object frozen = freeze(entry.getValue(), depth + 1);
            if (frozen != null) {
                copy.put(entry.getKey().toString(), frozen);
            }
        }
        return Collections.unmodifiableMap(copy);
    }

    private static List<Object> freezeList(Collection<?> collection, int depth) {
        List<Object> copy = new ArrayList<>(collection.size());
        for (Object item : collection) {
            copy.add(freeze(item, depth + 1));
        }
        return Collections.unmodifiableList(copy);
    }

    /// Returns whether the value is a number with a finite double representation.
    ///
    /// @param value candidate, may be null
    /// @return false for null, non-numbers, `NaN` and both infinities
    public static boolean isFiniteNumber(Object value) {
        return value instanceof Number number && Double.isFinite(number.doubleValue());
    }

    /// Strict equality on JSON scalars.
    ///
    /// Numbers compare by numeric value with `NaN` unequal to itself; strings and booleans by
    /// value; two nulls are equal; lists and maps are equal only when they are the same instance.
    ///
    /// @param left first value, may be null
    /// @param right second value, may be null
    /// @return whether the values are strictly equal
    public static boolean strictEquals(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return a.doubleValue() == b.doubleValue();
        }
        if (left instanceof String || left instanceof Boolean) {
            return left.equals(right);
        }
        return left == right;
    }

    /// Membership equality: like {@link #strictEquals} except that `NaN` matches `NaN`.
    ///
    /// @param left first value, may be null
    /// @param right second value, may be null
    /// @return whether the values are the same value
    public static boolean sameValueZero(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            double x = a.doubleValue();
            double y = b.doubleValue();
            return x == y || (Double.isNaN(x) && Double.isNaN(y));
        }
        return strictEquals(left, right);
    }

    /// Returns whether the list contains the value under {@link #sameValueZero} equality.
    ///
    /// @param values list to search, not null
    /// @param value value to look for, may be null
    /// @return true if any element is the same value
    public static boolean containsSameValue(List<?> values, Object value) {
        for (Object candidate : values) {
            if (sameValueZero(candidate, value)) {
                return true;
            }
        }
        return false;
    }
}
