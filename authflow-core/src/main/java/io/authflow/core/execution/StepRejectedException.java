package io.authflow.core.execution;

import java.io.Serial;

/// Thrown by {@link StepGuard} when a step submission exceeds a session limit.
public class StepRejectedException extends Exception {

    @Serial private static final long serialVersionUID = 6120488392231905764L;

    /// Limit that was exceeded, with its error code and user-facing message.
    public enum Reason {
        RATE_LIMIT_EXCEEDED(
                "rate_limit_exceeded", "Too many requests. Please wait a moment and try again."),
        SESSION_TIMEOUT("session_timeout", "Session has expired. Please start over."),
        CIRCULAR_REFERENCE(
                "circular_reference",
                "Flow contains a circular reference. Please contact support."),
        FLOW_TOO_LONG("flow_too_long", "Flow execution limit exceeded. Please contact support.");

        private final String code;
        private final String message;

        Reason(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String code() {
            return code;
        }

        public String message() {
            return message;
        }
    }

    private final Reason reason;

    public StepRejectedException(Reason reason) {
        super(reason.message());
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
