package io.authflow.core.plan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/// Configuration of a decision node.
///
/// Branches are kept in evaluation order: ascending priority, authoring order among equal
/// priorities, unprioritized branches last.
///
/// @param branches branches in evaluation order, never null after construction
/// @param defaultBranch id of the branch taken when no condition matches, may be null
public record DecisionConfig(List<DecisionBranch> branches, String defaultBranch)
        implements BranchingConfig {

    static final Comparator<Integer> PRIORITY_ORDER =
            Comparator.nullsLast(Comparator.naturalOrder());

    public DecisionConfig {
        List<DecisionBranch> sorted = new ArrayList<>(branches != null ? branches : List.of());
        sorted.sort(Comparator.comparing(DecisionBranch::priority, PRIORITY_ORDER));
        branches = List.copyOf(sorted);
    }
}
