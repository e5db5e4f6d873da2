package io.authflow.core.condition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.authflow.core.exception.InvalidFlowConfigurationException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConditionParserTest {

    @Nested
    @DisplayName("predicates")
    class Predicates {

        @Test
        void shouldParseKeyOperatorAndValue() throws Exception {
            ConditionNode node =
                    ConditionParser.parse(
                            Map.of("key", "risk.score", "operator", "greaterOrEqual", "value", 70));

            assertThat(node)
                    .isEqualTo(
                            FlowCondition.of(
                                    "risk.score", ConditionOperator.GREATER_OR_EQUAL, 70));
        }

        @Test
        void shouldAllowMissingValue() throws Exception {
            ConditionNode node =
                    ConditionParser.parse(Map.of("key", "device.known", "operator", "isFalse"));

            assertThat(node)
                    .isEqualTo(FlowCondition.of("device.known", ConditionOperator.IS_FALSE));
        }

        @Test
        void shouldKeepUnknownOperatorAsNeverMatchingPredicate() throws Exception {
            ConditionNode node =
                    ConditionParser.parse(Map.of("key", "risk.score", "operator", "between"));

            assertThat(node).isInstanceOf(FlowCondition.class);
            assertThat(((FlowCondition) node).operator()).isNull();
            assertThat(new SafeConditionEvaluator().evaluate(node, null)).isFalse();
        }

        @Test
        void shouldIgnoreNonStringKey() throws Exception {
            ConditionNode node = ConditionParser.parse(Map.of("key", 42, "operator", "exists"));

            assertThat(((FlowCondition) node).key()).isNull();
        }

        @Test
        @SuppressWarnings("unchecked")
        void shouldFreezeListValues() throws Exception {
            ConditionNode node =
                    ConditionParser.parse(
                            Map.of(
                                    "key", "request.country",
                                    "operator", "in",
                                    "value", new ArrayList<>(List.of("DE", "FR"))));

            Object value = ((FlowCondition) node).value();
            assertThat(value).isEqualTo(List.of("DE", "FR"));
            assertThatThrownBy(() -> ((List<Object>) value).add("US"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("groups")
    class Groups {

        @Test
        void shouldParseNestedGroups() throws Exception {
            Map<String, Object> raw =
                    Map.of(
                            "logic", "or",
                            "conditions",
                                    List.of(
                                            Map.of("key", "user.verified", "operator", "isTrue"),
                                            Map.of(
                                                    "logic", "AND",
                                                    "conditions",
                                                            List.of(
                                                                    Map.of(
                                                                            "key", "risk.score",
                                                                            "operator", "lessThan",
                                                                            "value", 30)))));

            ConditionNode node = ConditionParser.parse(raw);

            assertThat(node)
                    .isEqualTo(
                            ConditionGroup.or(
                                    FlowCondition.of("user.verified", ConditionOperator.IS_TRUE),
                                    ConditionGroup.and(
                                            FlowCondition.of(
                                                    "risk.score",
                                                    ConditionOperator.LESS_THAN,
                                                    30))));
        }

        @Test
        void shouldTreatLogicWithoutConditionsAsEmptyGroup() throws Exception {
            ConditionNode node = ConditionParser.parse(Map.of("logic", "and"));

            assertThat(node).isEqualTo(ConditionGroup.and());
        }

        @Test
        void shouldKeepUnknownLogicAsNull() throws Exception {
            ConditionNode node =
                    ConditionParser.parse(Map.of("logic", "xor", "conditions", List.of()));

            assertThat(((ConditionGroup) node).logic()).isNull();
        }

        @Test
        void shouldRejectNonListConditions() {
            assertThatThrownBy(
                            () -> ConditionParser.parse(Map.of("logic", "and", "conditions", "x")))
                    .isInstanceOf(InvalidFlowConfigurationException.class)
                    .hasMessage("Invalid flow configuration: group conditions must be a list");
        }

        @Test
        void shouldRejectNonObjectMember() {
            assertThatThrownBy(
                            () ->
                                    ConditionParser.parse(
                                            Map.of("logic", "and", "conditions", List.of("x"))))
                    .isInstanceOf(InvalidFlowConfigurationException.class)
                    .hasMessageContaining("condition must be an object");
        }
    }

    @Test
    void shouldRejectMissingCondition() {
        assertThatThrownBy(() -> ConditionParser.parse(null))
                .isInstanceOf(InvalidFlowConfigurationException.class)
                .hasMessageContaining("condition is missing");
    }

    @Test
    void shouldAcceptNestingUpToParseLimit() throws Exception {
        ConditionNode node = ConditionParser.parse(nested(ConditionParser.MAX_PARSE_DEPTH));

        assertThat(node).isInstanceOf(ConditionGroup.class);
    }

    @Test
    void shouldRejectNestingBeyondParseLimit() {
        Map<String, Object> raw = nested(ConditionParser.MAX_PARSE_DEPTH + 1);

        assertThatThrownBy(() -> ConditionParser.parse(raw))
                .isInstanceOf(InvalidFlowConfigurationException.class)
                .hasMessageContaining("nested deeper than 12");
    }

    /// Builds a tree whose innermost predicate sits at the given depth.
    private static Map<String, Object> nested(int depth) {
        Map<String, Object> current = new HashMap<>();
        current.put("key", "user.id");
        current.put("operator", "exists");
        for (int i = 0; i < depth; i++) {
            Map<String, Object> group = new HashMap<>();
            group.put("logic", "and");
            group.put("conditions", List.of(current));
            current = group;
        }
        return current;
    }
}
