package io.authflow.core.context;

import java.util.Optional;

/// Closed set of top-level sections of a {@link FlowContext}.
///
/// The first segment of every context path must name one of these sections. Because the set is
/// closed, a reserved key such as `__proto__` can never address a section; the reserved-key check
/// in {@link ContextPath} only has to guard the free-form maps below the section level.
///
/// @see ContextPath#resolve(String, FlowContext)
public enum ContextSection {
    USER("user"),
    DEVICE("device"),
    REQUEST("request"),
    RISK("risk"),
    FORM("form"),
    PREV_NODE("prevNode"),
    VARIABLES("variables"),
    TENANT("tenant"),
    CLIENT("client"),
    EXTENSIONS("extensions");

    private final String key;

    ContextSection(String key) {
        this.key = key;
    }

    /// Returns the path segment that addresses this section.
    ///
    /// @return section key as used in condition paths, never null
    public String key() {
        return key;
    }

    /// Looks up a section by its path segment.
    ///
    /// Matching is exact and case-sensitive.
    ///
    /// @param key path segment, may be null
    /// @return the section, or empty if the segment names no known section
    public static Optional<ContextSection> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (ContextSection section : values()) {
            if (section.key.equals(key)) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }
}
