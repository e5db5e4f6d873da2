package io.authflow.core.condition;

import io.authflow.core.context.ContextValues;

/// Single predicate tested against the runtime context.
///
/// The `key` is a dotted context path such as `risk.score` or `user.customAttributes.role`.
/// The `value` is a JSON scalar or a list of scalars and is frozen on construction. A null
/// `key` or `operator` is tolerated: such a predicate is malformed and always evaluates to
/// `false`.
///
/// @param key dotted context path, may be null (malformed)
/// @param operator comparison operator, may be null (malformed or unknown operator)
/// @param value expected value, may be null for operators that take none
/// @see ConditionOperator for the operator table
public record FlowCondition(String key, ConditionOperator operator, Object value)
        implements ConditionNode {

    public FlowCondition {
        value = ContextValues.freeze(value);
    }

    /// Creates a predicate with an expected value.
    ///
    /// @param key dotted context path, not null
    /// @param operator comparison operator, not null
    /// @param value expected value, may be null
    /// @return new predicate, never null
    public static FlowCondition of(String key, ConditionOperator operator, Object value) {
        return new FlowCondition(key, operator, value);
    }

    /// Creates a predicate for operators that take no expected value (`exists`, `isTrue`, ...).
    ///
    /// @param key dotted context path, not null
    /// @param operator comparison operator, not null
    /// @return new predicate, never null
    public static FlowCondition of(String key, ConditionOperator operator) {
        return new FlowCondition(key, operator, null);
    }
}
