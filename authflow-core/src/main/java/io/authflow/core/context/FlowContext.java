package io.authflow.core.context;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable snapshot of the signals a flow's conditions are evaluated against.
///
/// A context maps each {@link ContextSection} to a free-form, string-keyed map (user attributes,
/// device fingerprint, request metadata, risk signals, submitted form fields, the previous node's
/// output, flow variables, verified tenant/client identifiers and an open extension section).
/// All values are deep-frozen on construction, so a context can be handed to any number of
/// concurrent evaluations without copying.
///
/// The core treats every value as untrusted. Reads go through {@link ContextPath}, which never
/// follows anything but keys actually present in the maps.
///
/// ### Usage
/// {@snippet :
/// FlowContext context = FlowContext.builder()
///     .put(ContextSection.RISK, "score", 80)
///     .put(ContextSection.REQUEST, "country", "DE")
///     .build();
///
/// Optional<Object> score = context.resolve("risk.score");
/// }
///
/// @implNote Immutable and thread-safe after construction.
/// @see ContextPath for path traversal rules
/// @see FlowContextBuilder for assembling contexts from collected step data
public final class FlowContext {

    private static final FlowContext EMPTY = new FlowContext(new EnumMap<>(ContextSection.class));

    private final Map<ContextSection, Map<String, Object>> sections;

    private FlowContext(EnumMap<ContextSection, Map<String, Object>> sections) {
        this.sections = Collections.unmodifiableMap(sections);
    }

    /// Returns a context with no sections.
    ///
    /// @return shared empty context, never null
    public static FlowContext empty() {
        return EMPTY;
    }

    /// Creates a context from a raw nested map keyed by section names.
    ///
    /// Top-level keys that name no {@link ContextSection}, and sections whose value is not a
    /// map, are ignored.
    ///
    /// @param raw raw context data, may be null
    /// @return frozen context, never null
    public static FlowContext fromMap(Map<String, ?> raw) {
        Builder builder = builder();
        if (raw != null) {
            for (Map.Entry<String, ?> entry : raw.entrySet()) {
                Optional<ContextSection> section = ContextSection.fromKey(entry.getKey());
                if (section.isPresent() && entry.getValue() instanceof Map<?, ?> map) {
                    builder.section(section.get(), map);
                }
            }
        }
        return builder.build();
    }

    /// Returns the data held under a section.
    ///
    /// @param section the section to read, not null
    /// @return unmodifiable section data, or empty if the section is not populated
    public Optional<Map<String, Object>> section(ContextSection section) {
        return Optional.ofNullable(sections.get(section));
    }

    /// Returns all populated sections.
    ///
    /// @return unmodifiable map of section to data, never null
    public Map<ContextSection, Map<String, Object>> sections() {
        return sections;
    }

    /// Resolves a dotted path against this context.
    ///
    /// @param path dotted path such as `user.customAttributes.role`, may be null
    /// @return resolved value, or empty if the path is absent or unsafe
    /// @see ContextPath#resolve(String, FlowContext)
    public Optional<Object> resolve(String path) {
        return ContextPath.resolve(path, this);
    }

    /// Converts this context back to a plain nested map keyed by section names.
    ///
    /// @return unmodifiable map, never null
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        sections.forEach((section, data) -> map.put(section.key(), data));
        return Collections.unmodifiableMap(map);
    }

    /// Creates a new context builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link FlowContext}. Values are frozen when {@link #build()} is called.
    public static final class Builder {
        private final Map<ContextSection, Map<String, Object>> sections =
                new EnumMap<>(ContextSection.class);

        private Builder() {}

        /// Replaces the data of a section.
        ///
        /// @param section target section, not null
        /// @param data section data, null clears the section
        /// @return this builder for chaining
        public Builder section(ContextSection section, Map<?, ?> data) {
            Objects.requireNonNull(section, "section must not be null");
            if (data == null) {
                sections.remove(section);
            } else {
                Map<String, Object> copy = new LinkedHashMap<>();
                data.forEach((key, value) -> copy.put(String.valueOf(key), value));
                sections.put(section, copy);
            }
            return this;
        }

        /// Adds a single entry to a section, creating the section if needed.
        ///
        /// @param section target section, not null
        /// @param key entry key, not null
        /// @param value entry value, null entries are dropped on build
        /// @return this builder for chaining
        public Builder put(ContextSection section, String key, Object value) {
            Objects.requireNonNull(section, "section must not be null");
            Objects.requireNonNull(key, "key must not be null");
            sections.computeIfAbsent(section, s -> new LinkedHashMap<>()).put(key, value);
            return this;
        }

        /// Builds the immutable context.
        ///
        /// @return new context, never null
        public FlowContext build() {
            EnumMap<ContextSection, Map<String, Object>> frozen =
                    new EnumMap<>(ContextSection.class);
            sections.forEach(
                    (section, data) -> frozen.put(section, ContextValues.freezeMap(data)));
            return new FlowContext(frozen);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlowContext that)) return false;
        return sections.equals(that.sections);
    }

    @Override
    public int hashCode() {
        return sections.hashCode();
    }

    @Override
    public String toString() {
        return "FlowContext{sections=" + sections.keySet() + "}";
    }
}
