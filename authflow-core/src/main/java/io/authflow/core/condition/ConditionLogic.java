package io.authflow.core.condition;

import java.util.Locale;
import java.util.Optional;

/// Combination logic of a {@link ConditionGroup}.
public enum ConditionLogic {
    AND("and"),
    OR("or");

    private final String wireName;

    ConditionLogic(String wireName) {
        this.wireName = wireName;
    }

    /// Returns the name used in serialized flow definitions.
    ///
    /// @return lower-case wire name, never null
    public String wireName() {
        return wireName;
    }

    /// Parses a wire name, ignoring case.
    ///
    /// @param name wire name such as `and` or `OR`, may be null
    /// @return the logic, or empty if the name is unknown
    public static Optional<ConditionLogic> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (ConditionLogic logic : values()) {
            if (logic.wireName.equals(lower)) {
                return Optional.of(logic);
            }
        }
        return Optional.empty();
    }
}
