package io.authflow.core.execution;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/// Per-session record of visited nodes and request times, used by {@link StepGuard}.
///
/// Histories are immutable values. The session store persists the history returned with each
/// accepted step and hands it back with the next one.
///
/// @param visitedNodeIds node ids in visit order, never null after construction
/// @param requestTimestamps accepted request times in arrival order, never null after
///     construction
public record StepHistory(List<String> visitedNodeIds, List<Instant> requestTimestamps) {

    private static final StepHistory EMPTY = new StepHistory(List.of(), List.of());

    public StepHistory {
        visitedNodeIds = visitedNodeIds != null ? List.copyOf(visitedNodeIds) : List.of();
        requestTimestamps = requestTimestamps != null ? List.copyOf(requestTimestamps) : List.of();
    }

    public static StepHistory empty() {
        return EMPTY;
    }

    /// Returns a copy with one more visit and request time appended.
    ///
    /// @param nodeId visited node, not null
    /// @param at request time, not null
    /// @return new history, never null
    public StepHistory record(String nodeId, Instant at) {
        List<String> visited = new ArrayList<>(visitedNodeIds);
        visited.add(nodeId);
        List<Instant> timestamps = new ArrayList<>(requestTimestamps);
        timestamps.add(at);
        return new StepHistory(visited, timestamps);
    }

    /// Counts how often a node was visited.
    ///
    /// @param nodeId node id, may be null
    /// @return number of visits
    public int visitCount(String nodeId) {
        int count = 0;
        for (String visited : visitedNodeIds) {
            if (visited.equals(nodeId)) {
                count++;
            }
        }
        return count;
    }
}
