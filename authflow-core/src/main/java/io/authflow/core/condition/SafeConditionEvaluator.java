package io.authflow.core.condition;

import io.authflow.core.context.ContextPath;
import io.authflow.core.context.ContextValues;
import io.authflow.core.context.FlowContext;
import io.authflow.core.util.LogSanitizer;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Condition evaluator hardened against attacker-influenced context data.
///
/// Conditions run on every authentication step of every user, so each predicate is bounded:
///
/// | Limit | Value | Applies to |
/// |---|---|---|
/// | {@link #MAX_RECURSION_DEPTH} | 10 | group nesting |
/// | {@link #MAX_STRING_LENGTH} | 10,000 | string subjects of string operators |
/// | {@link #MAX_ARRAY_LENGTH} | 1,000 | list subjects and `in`/`notIn` value lists |
/// | {@link #MAX_REGEX_LENGTH} | 100 | `matches` patterns |
///
/// Exceeding a limit, a type mismatch, an unsafe path or pattern, or any internal error makes
/// the predicate evaluate to `false`. The one exception is `notIn` against a value that is not a
/// list, which evaluates to `true`. Numeric operators reject `NaN` and both infinities on either
/// side.
///
/// Empty groups never match. Groups nested deeper than {@link #MAX_RECURSION_DEPTH} never match.
///
/// ### Usage
/// {@snippet :
/// ConditionEvaluator evaluator = new SafeConditionEvaluator();
/// boolean highRisk = evaluator.evaluate(
///     FlowCondition.of("risk.score", ConditionOperator.GREATER_THAN, 70), context);
/// }
///
/// @implNote Stateless and thread-safe.
public final class SafeConditionEvaluator implements ConditionEvaluator {

    private static final Logger logger = Logger.getLogger(SafeConditionEvaluator.class.getName());

    public static final int MAX_RECURSION_DEPTH = 10;
    public static final int MAX_STRING_LENGTH = 10_000;
    public static final int MAX_ARRAY_LENGTH = 1_000;
    public static final int MAX_REGEX_LENGTH = 100;

    private final RegexGuard regexGuard;

    public SafeConditionEvaluator() {
        this(new RegexGuard(MAX_REGEX_LENGTH, RegexGuard.DEFAULT_STEP_BUDGET));
    }

    public SafeConditionEvaluator(RegexGuard regexGuard) {
        this.regexGuard = regexGuard;
    }

    @Override
    public boolean evaluate(ConditionNode node, FlowContext context) {
        if (node instanceof ConditionGroup group) {
            return evaluateGroup(group, context, 0);
        }
        if (node instanceof FlowCondition condition) {
            return evaluateSingle(condition, context);
        }
        return false;
    }

    /// Evaluates a group at the given nesting depth.
    ///
    /// @param group group to evaluate, may be null
    /// @param context runtime context, may be null
    /// @param depth nesting depth of this group, 0 for a root group
    /// @return false if the depth limit is exceeded, the group is empty or malformed
    public boolean evaluateGroup(ConditionGroup group, FlowContext context, int depth) {
        if (depth > MAX_RECURSION_DEPTH) {
            logger.warning(
                    "[Security] Condition nesting exceeds max depth " + MAX_RECURSION_DEPTH);
            return false;
        }
        if (group == null || group.logic() == null || group.conditions().isEmpty()) {
            return false;
        }

        boolean and = group.logic() == ConditionLogic.AND;
        for (ConditionNode member : group.conditions()) {
            boolean result =
                    member instanceof ConditionGroup nested
                            ? evaluateGroup(nested, context, depth + 1)
                            : member instanceof FlowCondition condition
                                    && evaluateSingle(condition, context);
            if (and && !result) {
                return false;
            }
            if (!and && result) {
                return true;
            }
        }
        return and;
    }

    /// Evaluates one predicate. Never throws.
    ///
    /// @param condition predicate to evaluate, may be null
    /// @param context runtime context, may be null
    /// @return whether the predicate holds, false on any failure
    public boolean evaluateSingle(FlowCondition condition, FlowContext context) {
        if (condition == null || condition.key() == null || condition.operator() == null) {
            return false;
        }
        try {
            Optional<String> reserved = ContextPath.findReservedSegment(condition.key());
            if (reserved.isPresent()) {
                logger.warning(
                        "[Security] Rejected condition key with reserved segment: "
                                + LogSanitizer.sanitize(condition.key()));
                return false;
            }
            Object actual = ContextPath.resolve(condition.key(), context).orElse(null);
            return apply(condition.operator(), actual, condition.value());
        } catch (RuntimeException e) {
            logger.log(
                    Level.WARNING,
                    "Condition evaluation failed for key " + LogSanitizer.sanitize(condition.key()),
                    e);
            return false;
        }
    }

    private boolean apply(ConditionOperator operator, Object actual, Object expected) {
        return switch (operator) {
            case EQUALS -> ContextValues.strictEquals(actual, expected);
            case NOT_EQUALS -> !ContextValues.strictEquals(actual, expected);
            case CONTAINS -> contains(actual, expected);
            case NOT_CONTAINS -> notContains(actual, expected);
            case STARTS_WITH ->
                    boundedString(actual)
                            && expected instanceof String prefix
                            && ((String) actual).startsWith(prefix);
            case ENDS_WITH ->
                    boundedString(actual)
                            && expected instanceof String suffix
                            && ((String) actual).endsWith(suffix);
            case MATCHES -> matches(actual, expected);
            case GREATER_THAN, LESS_THAN, GREATER_OR_EQUAL, LESS_OR_EQUAL ->
                    compare(actual, expected, operator);
            case IN -> in(actual, expected);
            case NOT_IN -> notIn(actual, expected);
            case EXISTS -> actual != null;
            case NOT_EXISTS -> actual == null;
            case IS_TRUE -> Boolean.TRUE.equals(actual);
            case IS_FALSE -> Boolean.FALSE.equals(actual);
        };
    }

    private boolean contains(Object actual, Object expected) {
        if (actual instanceof String text) {
            return text.length() <= MAX_STRING_LENGTH
                    && expected instanceof String part
                    && text.contains(part);
        }
        if (actual instanceof List<?> list) {
            return list.size() <= MAX_ARRAY_LENGTH
                    && ContextValues.containsSameValue(list, expected);
        }
        return false;
    }

    private boolean notContains(Object actual, Object expected) {
        if (actual instanceof String text) {
            return text.length() <= MAX_STRING_LENGTH
                    && expected instanceof String part
                    && !text.contains(part);
        }
        if (actual instanceof List<?> list) {
            return list.size() <= MAX_ARRAY_LENGTH
                    && !ContextValues.containsSameValue(list, expected);
        }
        return false;
    }

    private boolean matches(Object actual, Object expected) {
        if (!boundedString(actual) || !(expected instanceof String pattern)) {
            return false;
        }
        Optional<Pattern> compiled = regexGuard.compile(pattern);
        if (compiled.isEmpty()) {
            logger.warning(
                    "[Security] Rejected unsafe or invalid regex pattern: "
                            + LogSanitizer.sanitize(pattern));
            return false;
        }
        return regexGuard.find(compiled.get(), (String) actual);
    }

    private boolean compare(Object actual, Object expected, ConditionOperator operator) {
        if (!ContextValues.isFiniteNumber(actual) || !ContextValues.isFiniteNumber(expected)) {
            return false;
        }
        double left = ((Number) actual).doubleValue();
        double right = ((Number) expected).doubleValue();
        return switch (operator) {
            case GREATER_THAN -> left > right;
            case LESS_THAN -> left < right;
            case GREATER_OR_EQUAL -> left >= right;
            case LESS_OR_EQUAL -> left <= right;
            default -> false;
        };
    }

    private boolean in(Object actual, Object expected) {
        if (!(expected instanceof List<?> values)) {
            logger.warning("'in' operator expects a list value");
            return false;
        }
        return values.size() <= MAX_ARRAY_LENGTH
                && ContextValues.containsSameValue(values, actual);
    }

    private boolean notIn(Object actual, Object expected) {
        if (!(expected instanceof List<?> values)) {
            logger.warning("'notIn' operator expects a list value");
            return true;
        }
        return values.size() <= MAX_ARRAY_LENGTH
                && !ContextValues.containsSameValue(values, actual);
    }

    private static boolean boundedString(Object value) {
        return value instanceof String text && text.length() <= MAX_STRING_LENGTH;
    }
}
