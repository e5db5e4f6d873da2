package io.authflow.core.plan;

import io.authflow.core.condition.ConditionNode;
import java.util.Objects;

/// One branch of a decision node.
///
/// @param id branch id, matched against transition source handles, not null
/// @param label display label, may be null
/// @param condition condition selecting this branch, not null
/// @param priority evaluation priority, lower first; may be null (evaluated last)
public record DecisionBranch(String id, String label, ConditionNode condition, Integer priority) {

    public DecisionBranch {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
    }
}
