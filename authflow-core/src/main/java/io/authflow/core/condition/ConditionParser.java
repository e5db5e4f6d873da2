package io.authflow.core.condition;

import io.authflow.core.exception.InvalidFlowConfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Converts the open map/list representation of a condition into a typed {@link ConditionNode}.
///
/// A map holding a `conditions` or `logic` entry is read as a {@link ConditionGroup}; any other
/// map is read as a {@link FlowCondition} with `key`, `operator` and optional `value`.
///
/// Parsing is lenient about content: an unknown operator or logic name yields a node that
/// simply never matches, so definitions written for newer operators still compile. Structure
/// is checked strictly: a missing condition, a non-map condition, a non-list `conditions` entry
/// or nesting beyond {@link #MAX_PARSE_DEPTH} is rejected.
public final class ConditionParser {

    /// Hard cap on nesting while parsing. Deeper trees would never match at evaluation anyway.
    ///
    /// A condition at parse depth `d` inside a node config sits at depth `3 + 2d` of the frozen
    /// config, so this cap stays reachable under
    /// {@link io.authflow.core.context.ContextValues#MAX_FREEZE_DEPTH}.
    public static final int MAX_PARSE_DEPTH = 12;

    private ConditionParser() {}

    /// Parses a condition tree.
    ///
    /// @param raw map representation, may be null
    /// @return typed condition tree, never null
    /// @throws InvalidFlowConfigurationException if the structure is malformed or too deep
    public static ConditionNode parse(Object raw) throws InvalidFlowConfigurationException {
        return parse(raw, 0);
    }

    private static ConditionNode parse(Object raw, int depth)
            throws InvalidFlowConfigurationException {
        if (depth > MAX_PARSE_DEPTH) {
            throw new InvalidFlowConfigurationException(
                    "condition nested deeper than " + MAX_PARSE_DEPTH + " levels");
        }
        if (raw == null) {
            throw new InvalidFlowConfigurationException("condition is missing");
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new InvalidFlowConfigurationException("condition must be an object");
        }

        if (map.containsKey("conditions") || map.containsKey("logic")) {
            Object members = map.get("conditions");
            if (members != null && !(members instanceof List<?>)) {
                throw new InvalidFlowConfigurationException("group conditions must be a list");
            }
            List<ConditionNode> conditions = new ArrayList<>();
            if (members != null) {
                for (Object member : (List<?>) members) {
                    conditions.add(parse(member, depth + 1));
                }
            }
            ConditionLogic logic =
                    map.get("logic") instanceof String name
                            ? ConditionLogic.fromWireName(name).orElse(null)
                            : null;
            return new ConditionGroup(logic, conditions);
        }

        String key = map.get("key") instanceof String k ? k : null;
        ConditionOperator operator =
                map.get("operator") instanceof String name
                        ? ConditionOperator.fromWireName(name).orElse(null)
                        : null;
        return new FlowCondition(key, operator, map.get("value"));
    }
}
