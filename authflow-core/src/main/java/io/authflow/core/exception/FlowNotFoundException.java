package io.authflow.core.exception;

import java.io.Serial;

public class FlowNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = 7301154402690126583L;

    public FlowNotFoundException(String message) {
        super(message);
    }
}
