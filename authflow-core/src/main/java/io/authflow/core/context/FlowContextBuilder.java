package io.authflow.core.context;

import java.util.Map;

/// Assembles a {@link FlowContext} from the data collected during a flow session.
///
/// Collected data is untrusted: it is whatever earlier steps (and ultimately the end user or a
/// third-party identity provider) submitted. Only an allow-list of sections is taken from it:
///
/// - `user`, `device`, `request`, `risk`, `form`, `variables` when their value is an object
/// - `prevNode` only when it is an object carrying a boolean `success`
///
/// The `tenant` and `client` sections are never read from collected data. They are filled
/// exclusively from the identifiers recorded on the verified session.
///
/// @implNote Stateless and thread-safe.
public final class FlowContextBuilder {

    private static final ContextSection[] COLLECTED_SECTIONS = {
        ContextSection.USER,
        ContextSection.DEVICE,
        ContextSection.REQUEST,
        ContextSection.RISK,
        ContextSection.FORM,
        ContextSection.VARIABLES
    };

    private FlowContextBuilder() {}

    /// Builds a runtime context from collected data and verified session identifiers.
    ///
    /// @param collectedData data collected by earlier steps, may be null
    /// @param verifiedTenantId tenant recorded on the session, may be null
    /// @param verifiedClientId client recorded on the session, may be null
    /// @return frozen context, never null
    public static FlowContext fromCollectedData(
            Map<String, ?> collectedData, String verifiedTenantId, String verifiedClientId) {
        FlowContext.Builder builder = FlowContext.builder();

        if (verifiedTenantId != null && !verifiedTenantId.isEmpty()) {
            builder.put(ContextSection.TENANT, "id", verifiedTenantId);
        }
        if (verifiedClientId != null && !verifiedClientId.isEmpty()) {
            builder.put(ContextSection.CLIENT, "id", verifiedClientId);
        }
        if (collectedData == null) {
            return builder.build();
        }

        for (ContextSection section : COLLECTED_SECTIONS) {
            if (collectedData.get(section.key()) instanceof Map<?, ?> data) {
                builder.section(section, data);
            }
        }

        if (collectedData.get(ContextSection.PREV_NODE.key()) instanceof Map<?, ?> prevNode
                && prevNode.get("success") instanceof Boolean) {
            builder.section(ContextSection.PREV_NODE, prevNode);
        }

        return builder.build();
    }
}
