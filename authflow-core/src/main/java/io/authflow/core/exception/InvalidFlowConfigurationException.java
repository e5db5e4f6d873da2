package io.authflow.core.exception;

import java.io.Serial;

/// Thrown when a graph definition cannot be compiled into a plan.
///
/// Compilation is all-or-nothing: when this is thrown no partial plan exists. Common causes:
/// - Empty node set or duplicate node ids
/// - Size limits exceeded (capabilities, decision branches, switch cases, case values)
/// - Malformed decision or switch configuration
///
/// The message always starts with `Invalid flow configuration:` and names the offending node
/// where there is one. It is meant for logs and administrators, not for end users.
public class InvalidFlowConfigurationException extends Exception {

    @Serial private static final long serialVersionUID = 4417264503098160815L;

    static final String PREFIX = "Invalid flow configuration: ";

    private final String reason;

    /// Creates exception with a reason.
    ///
    /// @param reason what is wrong with the definition, without the common prefix
    public InvalidFlowConfigurationException(String reason) {
        super(PREFIX + reason);
        this.reason = reason;
    }

    /// Creates exception with a reason and cause.
    ///
    /// @param reason what is wrong with the definition, without the common prefix
    /// @param cause the underlying exception
    public InvalidFlowConfigurationException(String reason, Throwable cause) {
        super(PREFIX + reason, cause);
        this.reason = reason;
    }

    /// Returns the reason without the common prefix.
    ///
    /// @return reason text, never null
    public String getReason() {
        return reason;
    }
}
