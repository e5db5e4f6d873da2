package io.authflow.core.execution;

import java.io.Serial;

/// Thrown when a step submission targets a session of another tenant or client.
///
/// Callers map this to a generic authentication error. The {@link Reason} is machine-checkable;
/// the message is safe to show but carries no identifiers.
public class InvalidSessionException extends Exception {

    @Serial private static final long serialVersionUID = -2893017765418526017L;

    /// Error code shared by all session-boundary failures.
    public static final String CODE = "invalid_session";

    /// Which boundary was crossed.
    public enum Reason {
        TENANT_MISMATCH("tenant_mismatch", "Session tenant mismatch"),
        CLIENT_MISMATCH("client_mismatch", "Session client mismatch");

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

    public InvalidSessionException(Reason reason) {
        super(reason.message());
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
