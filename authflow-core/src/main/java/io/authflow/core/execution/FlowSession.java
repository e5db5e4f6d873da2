package io.authflow.core.execution;

import io.authflow.core.registry.FlowType;
import java.time.Instant;
import java.util.Objects;

/// Verified state of an in-progress authentication attempt, as recorded by the session store.
///
/// `tenantId` and `clientId` are the identifiers the session was started for. They are trusted,
/// unlike anything a step submission carries.
///
/// @param sessionId session identifier, not null
/// @param flowId id of the flow being executed, not null
/// @param flowType flow type the session was started for, not null
/// @param tenantId tenant the session belongs to, may be null
/// @param clientId client the session belongs to, may be null
/// @param currentNodeId node awaiting submission, not null
/// @param createdAt session start time, may be null (treated as expired)
public record FlowSession(
        String sessionId,
        String flowId,
        FlowType flowType,
        String tenantId,
        String clientId,
        String currentNodeId,
        Instant createdAt) {

    public FlowSession {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(flowId, "flowId must not be null");
        Objects.requireNonNull(flowType, "flowType must not be null");
        Objects.requireNonNull(currentNodeId, "currentNodeId must not be null");
    }

    /// Returns a copy positioned at another node.
    ///
    /// @param nodeId new current node, not null
    /// @return updated session, never null
    public FlowSession withCurrentNodeId(String nodeId) {
        return new FlowSession(sessionId, flowId, flowType, tenantId, clientId, nodeId, createdAt);
    }
}
