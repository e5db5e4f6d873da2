package io.authflow.core.util;

/// Strips control characters from strings to prevent log injection.
///
/// Flow definitions, switch keys, tenant and client identifiers all reach the log from
/// attacker-influenced input. A value containing `\r` or `\n` could otherwise forge extra
/// log records.
///
/// Apply to any externally supplied value before passing it to a logger:
/// ```
/// logger.warning("[Security] Session tenant mismatch: got=" + LogSanitizer.sanitize(tenantId));
/// ```
public final class LogSanitizer {

    private static final int MAX_LENGTH = 256;

    private LogSanitizer() {}

    /// Removes carriage-return, newline and other ISO control characters and caps the length.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or `"null"` if input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder(Math.min(value.length(), MAX_LENGTH));
        for (int i = 0; i < value.length() && sb.length() < MAX_LENGTH; i++) {
            char c = value.charAt(i);
            if (!Character.isISOControl(c)) {
                sb.append(c);
            }
        }
        if (value.length() > MAX_LENGTH && sb.length() == MAX_LENGTH) {
            sb.append("...");
        }
        return sb.toString();
    }
}
