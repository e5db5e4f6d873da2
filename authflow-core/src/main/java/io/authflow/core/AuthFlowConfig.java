package io.authflow.core;

import io.authflow.core.condition.RegexGuard;
import io.authflow.core.execution.StepGuard;
import java.time.Duration;
import java.util.Properties;

/// Configuration options for the authentication flow environment.
///
/// Controls the per-session limits enforced by {@link StepGuard} and the regex step budget of
/// the condition evaluator. Use the {@link Builder} for fluent configuration, setters for
/// mutable configuration, or {@link #fromProperties(Properties)} to read `authflow.*` keys.
///
/// ### Default Values
/// - `maxRequestsPerWindow`: `30` requests per `rateLimitWindow` of `60s`
/// - `maxTimestampHistory`: `100` request timestamps kept
/// - `sessionTimeout`: `30m`
/// - `maxVisitsPerNode`: `3`
/// - `maxTotalNodes`: `50`
/// - `maxVisitedHistory`: `200` visits kept
/// - `regexStepBudget`: `1,000,000` character reads per `matches` evaluation
///
/// @implNote **Not thread-safe**. Configure before passing to {@link AuthFlowFactory} and do
/// not modify afterwards.
///
/// @see AuthFlowFactory#createEnvironment(AuthFlowConfig)
public class AuthFlowConfig {

    static final String PREFIX = "authflow.";

    private int maxRequestsPerWindow = StepGuard.DEFAULT_MAX_REQUESTS_PER_WINDOW;
    private Duration rateLimitWindow = StepGuard.DEFAULT_RATE_LIMIT_WINDOW;
    private int maxTimestampHistory = StepGuard.DEFAULT_MAX_TIMESTAMP_HISTORY;
    private Duration sessionTimeout = StepGuard.DEFAULT_SESSION_TIMEOUT;
    private int maxVisitsPerNode = StepGuard.DEFAULT_MAX_VISITS_PER_NODE;
    private int maxTotalNodes = StepGuard.DEFAULT_MAX_TOTAL_NODES;
    private int maxVisitedHistory = StepGuard.DEFAULT_MAX_VISITED_HISTORY;
    private long regexStepBudget = RegexGuard.DEFAULT_STEP_BUDGET;

    /// Creates a configuration with default values.
    public AuthFlowConfig() {}

    public int getMaxRequestsPerWindow() {
        return maxRequestsPerWindow;
    }

    public void setMaxRequestsPerWindow(int maxRequestsPerWindow) {
        this.maxRequestsPerWindow = maxRequestsPerWindow;
    }

    public Duration getRateLimitWindow() {
        return rateLimitWindow;
    }

    public void setRateLimitWindow(Duration rateLimitWindow) {
        this.rateLimitWindow = rateLimitWindow;
    }

    public int getMaxTimestampHistory() {
        return maxTimestampHistory;
    }

    public void setMaxTimestampHistory(int maxTimestampHistory) {
        this.maxTimestampHistory = maxTimestampHistory;
    }

    /// Returns the maximum session age.
    ///
    /// @return session timeout, never null
    public Duration getSessionTimeout() {
        return sessionTimeout;
    }

    public void setSessionTimeout(Duration sessionTimeout) {
        this.sessionTimeout = sessionTimeout;
    }

    /// Returns how often one node may be visited before a step is rejected as circular.
    ///
    /// @return visit limit per node
    public int getMaxVisitsPerNode() {
        return maxVisitsPerNode;
    }

    public void setMaxVisitsPerNode(int maxVisitsPerNode) {
        this.maxVisitsPerNode = maxVisitsPerNode;
    }

    public int getMaxTotalNodes() {
        return maxTotalNodes;
    }

    public void setMaxTotalNodes(int maxTotalNodes) {
        this.maxTotalNodes = maxTotalNodes;
    }

    public int getMaxVisitedHistory() {
        return maxVisitedHistory;
    }

    public void setMaxVisitedHistory(int maxVisitedHistory) {
        this.maxVisitedHistory = maxVisitedHistory;
    }

    public long getRegexStepBudget() {
        return regexStepBudget;
    }

    public void setRegexStepBudget(long regexStepBudget) {
        this.regexStepBudget = regexStepBudget;
    }

    /// Reads a configuration from properties. Missing keys keep their defaults.
    ///
    /// Supported keys:
    /// - `authflow.rate-limit.max-requests`
    /// - `authflow.rate-limit.window-seconds`
    /// - `authflow.rate-limit.history-size`
    /// - `authflow.session.timeout-minutes`
    /// - `authflow.guard.max-visits-per-node`
    /// - `authflow.guard.max-total-nodes`
    /// - `authflow.guard.visited-history-size`
    /// - `authflow.regex.step-budget`
    ///
    /// @param properties the properties to read, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a present value is not a positive integer
    public static AuthFlowConfig fromProperties(Properties properties) {
        AuthFlowConfig config = new AuthFlowConfig();
        config.maxRequestsPerWindow =
                (int) read(properties, "rate-limit.max-requests", config.maxRequestsPerWindow);
        config.rateLimitWindow =
                Duration.ofSeconds(
                        read(
                                properties,
                                "rate-limit.window-seconds",
                                config.rateLimitWindow.toSeconds()));
        config.maxTimestampHistory =
                (int) read(properties, "rate-limit.history-size", config.maxTimestampHistory);
        config.sessionTimeout =
                Duration.ofMinutes(
                        read(
                                properties,
                                "session.timeout-minutes",
                                config.sessionTimeout.toMinutes()));
        config.maxVisitsPerNode =
                (int) read(properties, "guard.max-visits-per-node", config.maxVisitsPerNode);
        config.maxTotalNodes =
                (int) read(properties, "guard.max-total-nodes", config.maxTotalNodes);
        config.maxVisitedHistory =
                (int) read(properties, "guard.visited-history-size", config.maxVisitedHistory);
        config.regexStepBudget = read(properties, "regex.step-budget", config.regexStepBudget);
        return config;
    }

    private static long read(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Property " + PREFIX + key + " must be a positive integer: " + raw, e);
        }
        if (value <= 0 || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                    "Property " + PREFIX + key + " must be a positive integer: " + raw);
        }
        return value;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link AuthFlowConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final AuthFlowConfig config = new AuthFlowConfig();

        public Builder maxRequestsPerWindow(int maxRequestsPerWindow) {
            config.maxRequestsPerWindow = maxRequestsPerWindow;
            return this;
        }

        public Builder rateLimitWindow(Duration rateLimitWindow) {
            config.rateLimitWindow = rateLimitWindow;
            return this;
        }

        public Builder maxTimestampHistory(int maxTimestampHistory) {
            config.maxTimestampHistory = maxTimestampHistory;
            return this;
        }

        public Builder sessionTimeout(Duration sessionTimeout) {
            config.sessionTimeout = sessionTimeout;
            return this;
        }

        public Builder maxVisitsPerNode(int maxVisitsPerNode) {
            config.maxVisitsPerNode = maxVisitsPerNode;
            return this;
        }

        public Builder maxTotalNodes(int maxTotalNodes) {
            config.maxTotalNodes = maxTotalNodes;
            return this;
        }

        public Builder maxVisitedHistory(int maxVisitedHistory) {
            config.maxVisitedHistory = maxVisitedHistory;
            return this;
        }

        public Builder regexStepBudget(long regexStepBudget) {
            config.regexStepBudget = regexStepBudget;
            return this;
        }

        /// Builds and returns the configured {@link AuthFlowConfig} instance.
        ///
        /// @return the configured instance, never null
        public AuthFlowConfig build() {
            return config;
        }
    }
}
