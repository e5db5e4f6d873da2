package io.authflow.core.condition;

import java.io.Serial;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Best-effort protection for the `matches` operator against catastrophic backtracking.
///
/// A pattern is accepted only when it is at most `maxPatternLength` characters, matches none of
/// the denylisted shapes below and compiles:
///
/// - nested quantifiers: `(a+)+`, `(.*)*`, `(\w\W?)*`
/// - quantified alternation: `(a|ab)*`
/// - quantified lookaround: `(?=test)*`
///
/// The denylist is a heuristic. To bound patterns it misses, matching runs over a
/// {@link CharSequence} that counts character reads and aborts once `stepBudget` is spent.
/// Deep recursion in the backtracking engine ends the match the same way. An aborted match is
/// reported as no match.
///
/// @implNote Stateless apart from its limits. Thread-safe.
public final class RegexGuard {

    private static final Logger logger = Logger.getLogger(RegexGuard.class.getName());

    /// Default number of character reads allowed for one match attempt.
    public static final long DEFAULT_STEP_BUDGET = 1_000_000L;

    private static final List<Pattern> UNSAFE_SHAPES =
            List.of(
                    // group containing a quantifier, itself quantified; `(?` opens a group
                    Pattern.compile(
                            "\\((?:[^()\\\\]|\\\\.)*(?<!\\()[+*?}]"
                                    + "(?:[^()\\\\]|\\\\.)*\\)\\s*[+*{]"),
                    // group containing alternation, quantified
                    Pattern.compile("\\((?:[^()\\\\]|\\\\.)*\\|(?:[^()\\\\]|\\\\.)*\\)\\s*[+*{]"),
                    // lookahead or lookbehind, quantified
                    Pattern.compile("\\(\\?<?[=!](?:[^()\\\\]|\\\\.)*\\)\\s*[+*{?]"));

    private final int maxPatternLength;
    private final long stepBudget;

    public RegexGuard(int maxPatternLength, long stepBudget) {
        if (maxPatternLength <= 0) {
            throw new IllegalArgumentException("maxPatternLength must be positive");
        }
        if (stepBudget <= 0) {
            throw new IllegalArgumentException("stepBudget must be positive");
        }
        this.maxPatternLength = maxPatternLength;
        this.stepBudget = stepBudget;
    }

    /// Returns whether a pattern passes the length cap and the shape denylist.
    ///
    /// @param pattern candidate pattern, may be null
    /// @return false for null, overlong or denylisted patterns
    public boolean isSafe(String pattern) {
        if (pattern == null || pattern.length() > maxPatternLength) {
            return false;
        }
        for (Pattern shape : UNSAFE_SHAPES) {
            if (shape.matcher(pattern).find()) {
                return false;
            }
        }
        return true;
    }

    /// Compiles a pattern if it is safe.
    ///
    /// @param pattern candidate pattern, may be null
    /// @return compiled pattern, or empty if unsafe or syntactically invalid
    public Optional<Pattern> compile(String pattern) {
        if (!isSafe(pattern)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Pattern.compile(pattern));
        } catch (PatternSyntaxException e) {
            return Optional.empty();
        }
    }

    /// Searches the subject for the pattern within the step budget.
    ///
    /// @param pattern compiled pattern, not null
    /// @param subject text to search, not null
    /// @return true if the pattern was found before the budget ran out
    public boolean find(Pattern pattern, String subject) {
        Matcher matcher =
                pattern.matcher(new BudgetedCharSequence(subject, new long[] {stepBudget}));
        try {
            return matcher.find();
        } catch (StepBudgetExceededException e) {
            logger.warning(
                    "[Security] Regex match aborted after "
                            + stepBudget
                            + " steps, pattern length="
                            + pattern.pattern().length());
            return false;
        } catch (StackOverflowError e) {
            logger.warning(
                    "[Security] Regex match aborted on recursion depth, pattern length="
                            + pattern.pattern().length()
                            + ", subject length="
                            + subject.length());
            return false;
        }
    }

    private static final class StepBudgetExceededException extends RuntimeException {
        @Serial private static final long serialVersionUID = 1L;

        StepBudgetExceededException() {
            super(null, null, false, false);
        }
    }

    /// Read-only view over a string that charges one step per character read. Sub-sequences
    /// share the remaining budget with their parent.
    private static final class BudgetedCharSequence implements CharSequence {
        private final String text;
        private final long[] remaining;

        BudgetedCharSequence(String text, long[] remaining) {
            this.text = text;
            this.remaining = remaining;
        }

        @Override
        public char charAt(int index) {
            if (--remaining[0] < 0) {
                throw new StepBudgetExceededException();
            }
            return text.charAt(index);
        }

        @Override
        public int length() {
            return text.length();
        }

        @Override
        public CharSequence subSequence(int start, int end) {
            return new BudgetedCharSequence(text.substring(start, end), remaining);
        }

        @Override
        public String toString() {
            return text;
        }
    }
}
