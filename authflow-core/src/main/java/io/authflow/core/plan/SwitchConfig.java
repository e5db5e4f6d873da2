package io.authflow.core.plan;

import java.util.List;
import java.util.Objects;

/// Configuration of a switch node.
///
/// @param switchKey dotted context path whose value selects the case, not null
/// @param cases cases in declaration order, never null after construction
/// @param defaultCase id of the case taken when no case matches, may be null
public record SwitchConfig(String switchKey, List<SwitchCase> cases, String defaultCase)
        implements BranchingConfig {

    public SwitchConfig {
        Objects.requireNonNull(switchKey, "switchKey must not be null");
        cases = cases != null ? List.copyOf(cases) : List.of();
    }
}
