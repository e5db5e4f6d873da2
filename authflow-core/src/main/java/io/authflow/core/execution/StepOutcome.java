package io.authflow.core.execution;

import io.authflow.core.plan.CompiledNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Result of processing one step submission.
///
/// ### Permitted Implementations
/// - {@link Continue} - the flow moves on to another node
/// - {@link Complete} - the flow finished and the caller should redirect back to the client
/// - {@link Failed} - the submission was refused; `code` is machine-checkable
public sealed interface StepOutcome
        permits StepOutcome.Continue, StepOutcome.Complete, StepOutcome.Failed {

    /// The flow continues at `nextNode`. The caller persists `session`, `history` and
    /// `collectedData`.
    ///
    /// @param nextNode node to present next, not null
    /// @param session session positioned at the next node, not null
    /// @param history history with this step recorded, not null
    /// @param collectedData collected data including this step's response, not null
    record Continue(
            CompiledNode nextNode,
            FlowSession session,
            StepHistory history,
            Map<String, Object> collectedData)
            implements StepOutcome {
        public Continue {
            Objects.requireNonNull(nextNode, "nextNode must not be null");
            Objects.requireNonNull(session, "session must not be null");
            Objects.requireNonNull(history, "history must not be null");
            collectedData = Collections.unmodifiableMap(new LinkedHashMap<>(collectedData));
        }
    }

    /// The flow is complete.
    ///
    /// @param endNodeId the `end` node reached, or null if the flow ran out of transitions
    record Complete(String endNodeId) implements StepOutcome {}

    /// The submission was refused.
    ///
    /// @param code error code such as `invalid_session` or `node_not_found`, not null
    /// @param message user-presentable message without internal details, not null
    record Failed(String code, String message) implements StepOutcome {
        public Failed {
            Objects.requireNonNull(code, "code must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }
    }
}
