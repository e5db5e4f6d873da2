package io.authflow.core.registry;

import java.util.Optional;

/// Kinds of authentication flows a client can start.
///
/// Each type maps to the id of the built-in flow that serves it when no tenant-specific flow
/// is registered.
public enum FlowType {
    LOGIN("login", "human-basic-login"),
    AUTHORIZATION("authorization", "human-basic-authorization"),
    CONSENT("consent", "human-basic-consent"),
    LOGOUT("logout", "human-basic-logout");

    private final String wireName;
    private final String builtinFlowId;

    FlowType(String wireName, String builtinFlowId) {
        this.wireName = wireName;
        this.builtinFlowId = builtinFlowId;
    }

    public String wireName() {
        return wireName;
    }

    /// Returns the id of the built-in flow for this type.
    ///
    /// @return built-in flow id, never null
    public String builtinFlowId() {
        return builtinFlowId;
    }

    /// Parses a wire name.
    ///
    /// @param name wire name such as `login`, may be null
    /// @return the flow type, or empty if the name is unknown
    public static Optional<FlowType> fromWireName(String name) {
        for (FlowType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
