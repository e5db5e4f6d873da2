package io.authflow.core.execution;

/// A step submission as received from the transport layer.
///
/// `tenantId` and `clientId` come from the request context and are only used to check the
/// session boundary. Either may be absent.
///
/// @param tenantId tenant claimed by the request, may be null
/// @param clientId client claimed by the request, may be null
/// @param capabilityId capability the response answers, may be null
/// @param response capability response, may be null
public record StepRequest(String tenantId, String clientId, String capabilityId, Object response) {

    /// Creates a request that only carries boundary identifiers.
    public static StepRequest of(String tenantId, String clientId) {
        return new StepRequest(tenantId, clientId, null, null);
    }
}
