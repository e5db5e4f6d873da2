package io.authflow.core.condition;

import java.util.Optional;

/// Comparison operators of the condition DSL.
///
/// | Operator | Subject | Matches when |
/// |---|---|---|
/// | `equals` / `notEquals` | any | strict equality / inequality |
/// | `contains` / `notContains` | string or list | substring or element membership |
/// | `startsWith` / `endsWith` | string | prefix / suffix |
/// | `matches` | string | regular expression found in subject |
/// | `greaterThan` ... `lessOrEqual` | finite number | numeric comparison |
/// | `in` / `notIn` | any | subject is (not) an element of the expected list |
/// | `exists` / `notExists` | any | path is present / absent |
/// | `isTrue` / `isFalse` | boolean | subject is exactly `true` / `false` |
///
/// @see SafeConditionEvaluator for limits and failure behavior
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("notEquals"),
    CONTAINS("contains"),
    NOT_CONTAINS("notContains"),
    STARTS_WITH("startsWith"),
    ENDS_WITH("endsWith"),
    MATCHES("matches"),
    GREATER_THAN("greaterThan"),
    LESS_THAN("lessThan"),
    GREATER_OR_EQUAL("greaterOrEqual"),
    LESS_OR_EQUAL("lessOrEqual"),
    IN("in"),
    NOT_IN("notIn"),
    EXISTS("exists"),
    NOT_EXISTS("notExists"),
    IS_TRUE("isTrue"),
    IS_FALSE("isFalse");

    private final String wireName;

    ConditionOperator(String wireName) {
        this.wireName = wireName;
    }

    /// Returns the name used in serialized flow definitions.
    ///
    /// @return camel-case wire name, never null
    public String wireName() {
        return wireName;
    }

    /// Parses a wire name. Matching is exact.
    ///
    /// @param name wire name such as `greaterOrEqual`, may be null
    /// @return the operator, or empty if the name is unknown
    public static Optional<ConditionOperator> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ConditionOperator operator : values()) {
            if (operator.wireName.equals(name)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
