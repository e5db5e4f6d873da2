package io.authflow.core.condition;

import java.util.List;

/// AND/OR combination of nested conditions.
///
/// An empty group is valid but never matches, whichever its logic.
///
/// @param logic how member results are combined, may be null (malformed, never matches)
/// @param conditions ordered members, null is treated as empty
public record ConditionGroup(ConditionLogic logic, List<ConditionNode> conditions)
        implements ConditionNode {

    public ConditionGroup {
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    /// Creates a group that matches when every member matches.
    ///
    /// @param conditions members, not null
    /// @return new AND group, never null
    public static ConditionGroup and(ConditionNode... conditions) {
        return new ConditionGroup(ConditionLogic.AND, List.of(conditions));
    }

    /// Creates a group that matches when at least one member matches.
    ///
    /// @param conditions members, not null
    /// @return new OR group, never null
    public static ConditionGroup or(ConditionNode... conditions) {
        return new ConditionGroup(ConditionLogic.OR, List.of(conditions));
    }
}
