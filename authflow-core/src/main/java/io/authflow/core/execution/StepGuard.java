package io.authflow.core.execution;

import io.authflow.core.util.LogSanitizer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Admission control for step submissions of one session.
///
/// Checks run in this order, the first violation wins:
/// 1. **Rate limit**: at most `maxRequestsPerWindow` accepted requests within `rateLimitWindow`
/// 2. **Session timeout**: the session must be younger than `sessionTimeout`; a session with
///    unknown creation time counts as expired
/// 3. **Circular reference**: the current node may have been visited at most
///    `maxVisitsPerNode - 1` times before
/// 4. **Flow length**: fewer than `maxTotalNodes` visits in total
///
/// Histories are trimmed before checking (timestamps to `maxTimestampHistory`, visits to
/// `maxVisitedHistory`, oldest first) so a tampered or oversized history cannot exhaust memory.
///
/// @implNote Stateless apart from its limits and clock. Thread-safe.
public class StepGuard {

    private static final Logger logger = Logger.getLogger(StepGuard.class.getName());

    public static final int DEFAULT_MAX_REQUESTS_PER_WINDOW = 30;
    public static final Duration DEFAULT_RATE_LIMIT_WINDOW = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_TIMESTAMP_HISTORY = 100;
    public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofMinutes(30);
    public static final int DEFAULT_MAX_VISITS_PER_NODE = 3;
    public static final int DEFAULT_MAX_TOTAL_NODES = 50;
    public static final int DEFAULT_MAX_VISITED_HISTORY = 200;

    private final Clock clock;
    private final int maxRequestsPerWindow;
    private final Duration rateLimitWindow;
    private final int maxTimestampHistory;
    private final Duration sessionTimeout;
    private final int maxVisitsPerNode;
    private final int maxTotalNodes;
    private final int maxVisitedHistory;

    /// Creates a guard with default limits.
    ///
    /// @param clock time source, not null
    public StepGuard(Clock clock) {
        this(
                clock,
                DEFAULT_MAX_REQUESTS_PER_WINDOW,
                DEFAULT_RATE_LIMIT_WINDOW,
                DEFAULT_MAX_TIMESTAMP_HISTORY,
                DEFAULT_SESSION_TIMEOUT,
                DEFAULT_MAX_VISITS_PER_NODE,
                DEFAULT_MAX_TOTAL_NODES,
                DEFAULT_MAX_VISITED_HISTORY);
    }

    public StepGuard(
            Clock clock,
            int maxRequestsPerWindow,
            Duration rateLimitWindow,
            int maxTimestampHistory,
            Duration sessionTimeout,
            int maxVisitsPerNode,
            int maxTotalNodes,
            int maxVisitedHistory) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.maxRequestsPerWindow = maxRequestsPerWindow;
        this.rateLimitWindow = Objects.requireNonNull(rateLimitWindow, "rateLimitWindow");
        this.maxTimestampHistory = maxTimestampHistory;
        this.sessionTimeout = Objects.requireNonNull(sessionTimeout, "sessionTimeout");
        this.maxVisitsPerNode = maxVisitsPerNode;
        this.maxTotalNodes = maxTotalNodes;
        this.maxVisitedHistory = maxVisitedHistory;
    }

    /// Admits a step submission at the session's current node.
    ///
    /// @param session verified session state, not null
    /// @param history history persisted with the session, may be null (treated as empty)
    /// @return trimmed history with this request recorded, to persist if the step is accepted
    /// @throws StepRejectedException if a limit is exceeded
    public StepHistory admit(FlowSession session, StepHistory history)
            throws StepRejectedException {
        Objects.requireNonNull(session, "session must not be null");
        StepHistory current = history != null ? history : StepHistory.empty();
        Instant now = clock.instant();

        List<Instant> recent = new ArrayList<>();
        Instant windowStart = now.minus(rateLimitWindow);
        for (Instant timestamp : tail(current.requestTimestamps(), maxTimestampHistory)) {
            if (timestamp.isAfter(windowStart)) {
                recent.add(timestamp);
            }
        }
        if (recent.size() >= maxRequestsPerWindow) {
            logger.warning(
                    "[Security] Rate limit exceeded: "
                            + recent.size()
                            + " requests in "
                            + rateLimitWindow.toMillis()
                            + "ms (max: "
                            + maxRequestsPerWindow
                            + "), session="
                            + LogSanitizer.sanitize(session.sessionId()));
            throw new StepRejectedException(StepRejectedException.Reason.RATE_LIMIT_EXCEEDED);
        }

        Instant createdAt = session.createdAt() != null ? session.createdAt() : Instant.EPOCH;
        Duration age = Duration.between(createdAt, now);
        if (age.compareTo(sessionTimeout) > 0) {
            logger.warning(
                    "[Security] Session timeout: "
                            + age.toMinutes()
                            + " minutes elapsed (max: "
                            + sessionTimeout.toMinutes()
                            + "), session="
                            + LogSanitizer.sanitize(session.sessionId()));
            throw new StepRejectedException(StepRejectedException.Reason.SESSION_TIMEOUT);
        }

        List<String> visited = current.visitedNodeIds();
        if (visited.size() > maxVisitedHistory) {
            logger.warning(
                    "[Security] Visited nodes history too large ("
                            + visited.size()
                            + "), truncating to last "
                            + maxVisitedHistory
                            + " entries");
            visited = tail(visited, maxVisitedHistory);
        }
        StepHistory trimmed = new StepHistory(visited, recent);

        int visits = trimmed.visitCount(session.currentNodeId());
        if (visits >= maxVisitsPerNode) {
            logger.warning(
                    "[Security] Circular reference detected: node "
                            + LogSanitizer.sanitize(session.currentNodeId())
                            + " visited "
                            + visits
                            + " times (max: "
                            + maxVisitsPerNode
                            + ")");
            throw new StepRejectedException(StepRejectedException.Reason.CIRCULAR_REFERENCE);
        }
        if (visited.size() >= maxTotalNodes) {
            logger.warning(
                    "[Security] Maximum flow length exceeded: "
                            + visited.size()
                            + " nodes visited (max: "
                            + maxTotalNodes
                            + ")");
            throw new StepRejectedException(StepRejectedException.Reason.FLOW_TOO_LONG);
        }

        return trimmed.record(session.currentNodeId(), now);
    }

    private static <T> List<T> tail(List<T> list, int max) {
        return list.size() > max ? list.subList(list.size() - max, list.size()) : list;
    }
}
