package io.authflow.core.context;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Safe traversal of dotted paths through a {@link FlowContext}.
///
/// Resolution walks one segment at a time:
/// 1. The first segment must name a {@link ContextSection}.
/// 2. A segment equal to a reserved key (`__proto__`, `constructor`, `prototype`) aborts.
/// 3. Maps are entered only through keys they actually contain.
/// 4. Lists are entered only through an in-range, non-negative decimal index.
/// 5. Any other value in the middle of a path aborts.
///
/// An aborted or missing path resolves to `Optional.empty()`, which the evaluator treats as
/// "absent". Resolution never throws.
///
/// @implNote Stateless and thread-safe.
public final class ContextPath {

    /// Segments rejected anywhere in a path.
    public static final Set<String> RESERVED_SEGMENTS =
            Set.of("__proto__", "constructor", "prototype");

    private ContextPath() {}

    /// Resolves a dotted path against a context.
    ///
    /// A single-segment path returns the whole section map.
    ///
    /// @param path dotted path, may be null
    /// @param context context to read, may be null
    /// @return resolved value, or empty if absent, unsafe or malformed
    public static Optional<Object> resolve(String path, FlowContext context) {
        if (path == null || path.isEmpty() || context == null) {
            return Optional.empty();
        }

        String[] segments = path.split("\\.", -1);
        if (findReservedSegment(segments).isPresent()) {
            return Optional.empty();
        }

        Optional<ContextSection> section = ContextSection.fromKey(segments[0]);
        if (section.isEmpty()) {
            return Optional.empty();
        }

        Object current = context.section(section.get()).orElse(null);
        for (int i = 1; i < segments.length && current != null; i++) {
            current = step(current, segments[i]);
        }
        return Optional.ofNullable(current);
    }

    /// Returns the first reserved segment of a path, if any.
    ///
    /// Callers use this to report an unsafe path as a security event before resolving it.
    ///
    /// @param path dotted path, may be null
    /// @return the offending segment, or empty if the path contains none
    public static Optional<String> findReservedSegment(String path) {
        if (path == null) {
            return Optional.empty();
        }
        return findReservedSegment(path.split("\\.", -1));
    }

    private static Optional<String> findReservedSegment(String[] segments) {
        for (String segment : segments) {
            if (RESERVED_SEGMENTS.contains(segment)) {
                return Optional.of(segment);
            }
        }
        return Optional.empty();
    }

    private static Object step(Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            return map.containsKey(segment) ? map.get(segment) : null;
        }
        if (current instanceof List<?> list) {
            int index = parseIndex(segment);
            return index >= 0 && index < list.size() ? list.get(index) : null;
        }
        return null;
    }

    private static int parseIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        if (segment.length() > 1 && segment.charAt(0) == '0') {
            return -1;
        }
        return Integer.parseInt(segment);
    }
}
