package io.authflow.core.plan;

import io.authflow.core.condition.ConditionNode;
import io.authflow.core.condition.ConditionParser;
import io.authflow.core.exception.InvalidFlowConfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Reads the raw `config` map of decision and switch nodes into typed configurations, enforcing
/// the structural rules and size limits of {@link FlowCompiler}.
final class NodeConfigReader {

    private final int maxDecisionBranches;
    private final int maxSwitchCases;
    private final int maxValuesPerCase;

    NodeConfigReader(int maxDecisionBranches, int maxSwitchCases, int maxValuesPerCase) {
        this.maxDecisionBranches = maxDecisionBranches;
        this.maxSwitchCases = maxSwitchCases;
        this.maxValuesPerCase = maxValuesPerCase;
    }

    DecisionConfig readDecision(String nodeId, Map<String, Object> config)
            throws InvalidFlowConfigurationException {
        List<?> rawBranches = optionalList(config.get("branches"), nodeId, "branches");
        if (rawBranches.size() > maxDecisionBranches) {
            throw new InvalidFlowConfigurationException(
                    "decision node '"
                            + nodeId
                            + "' has "
                            + rawBranches.size()
                            + " branches (max "
                            + maxDecisionBranches
                            + ")");
        }

        List<DecisionBranch> branches = new ArrayList<>(rawBranches.size());
        for (Object raw : rawBranches) {
            Map<?, ?> branch = requireMap(raw, nodeId, "branch");
            String branchId = requireId(branch, nodeId, "branch");
            if (branch.get("condition") == null) {
                throw new InvalidFlowConfigurationException(
                        "decision node '"
                                + nodeId
                                + "' branch '"
                                + branchId
                                + "' has no condition");
            }
            ConditionNode condition;
            try {
                condition = ConditionParser.parse(branch.get("condition"));
            } catch (InvalidFlowConfigurationException e) {
                throw new InvalidFlowConfigurationException(
                        "decision node '"
                                + nodeId
                                + "' branch '"
                                + branchId
                                + "': "
                                + e.getReason(),
                        e);
            }
            branches.add(
                    new DecisionBranch(
                            branchId,
                            optionalString(branch.get("label")),
                            condition,
                            optionalInteger(branch.get("priority"))));
        }

        return new DecisionConfig(branches, optionalString(config.get("defaultBranch")));
    }

    SwitchConfig readSwitch(String nodeId, Map<String, Object> config)
            throws InvalidFlowConfigurationException {
        if (!(config.get("switchKey") instanceof String switchKey) || switchKey.isEmpty()) {
            throw new InvalidFlowConfigurationException(
                    "switch node '" + nodeId + "' has no switchKey");
        }

        List<?> rawCases = optionalList(config.get("cases"), nodeId, "cases");
        if (rawCases.size() > maxSwitchCases) {
            throw new InvalidFlowConfigurationException(
                    "switch node '"
                            + nodeId
                            + "' has "
                            + rawCases.size()
                            + " cases (max "
                            + maxSwitchCases
                            + ")");
        }

        List<SwitchCase> cases = new ArrayList<>(rawCases.size());
        for (Object raw : rawCases) {
            Map<?, ?> switchCase = requireMap(raw, nodeId, "case");
            String caseId = requireId(switchCase, nodeId, "case");
            if (!(switchCase.get("values") instanceof List<?> values)) {
                throw new InvalidFlowConfigurationException(
                        "switch node '" + nodeId + "' case '" + caseId + "' values must be a list");
            }
            if (values.size() > maxValuesPerCase) {
                throw new InvalidFlowConfigurationException(
                        "switch node '"
                                + nodeId
                                + "' case '"
                                + caseId
                                + "' has "
                                + values.size()
                                + " values (max "
                                + maxValuesPerCase
                                + ")");
            }
            cases.add(
                    new SwitchCase(
                            caseId,
                            optionalString(switchCase.get("label")),
                            new ArrayList<>(values)));
        }

        return new SwitchConfig(switchKey, cases, optionalString(config.get("defaultCase")));
    }

    private static List<?> optionalList(Object value, String nodeId, String field)
            throws InvalidFlowConfigurationException {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new InvalidFlowConfigurationException(
                    "node '" + nodeId + "' " + field + " must be a list");
        }
        return list;
    }

    private static Map<?, ?> requireMap(Object value, String nodeId, String what)
            throws InvalidFlowConfigurationException {
        if (!(value instanceof Map<?, ?> map)) {
            throw new InvalidFlowConfigurationException(
                    "node '" + nodeId + "' has a " + what + " that is not an object");
        }
        return map;
    }

    private static String requireId(Map<?, ?> map, String nodeId, String what)
            throws InvalidFlowConfigurationException {
        if (!(map.get("id") instanceof String id) || id.isEmpty()) {
            throw new InvalidFlowConfigurationException(
                    "node '" + nodeId + "' has a " + what + " without id");
        }
        return id;
    }

    private static String optionalString(Object value) {
        return value instanceof String s && !s.isEmpty() ? s : null;
    }

    /// Integral numbers within `int` range; anything else, `1.5` included, counts as absent.
    private static Integer optionalInteger(Object value) {
        if (!(value instanceof Number number)) {
            return null;
        }
        double d = number.doubleValue();
        if (!Double.isFinite(d)
                || d != Math.rint(d)
                || d < Integer.MIN_VALUE
                || d > Integer.MAX_VALUE) {
            return null;
        }
        return number.intValue();
    }
}
