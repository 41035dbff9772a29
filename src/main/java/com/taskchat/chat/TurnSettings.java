package com.taskchat.chat;

/**
 * Immutable per-process limits applied to every turn.
 */
public class TurnSettings {
    public static final int DEFAULT_HISTORY_LIMIT = 50;
    public static final int DEFAULT_MAX_TOOL_CALLS = 5;
    public static final long DEFAULT_TURN_TIMEOUT_MS = 8_000;
    public static final long DEFAULT_REASONING_TIMEOUT_MS = 4_000;

    private final int historyLimit;
    private final int maxToolCalls;
    private final long turnTimeoutMs;
    private final long reasoningTimeoutMs;

    public TurnSettings(int historyLimit, int maxToolCalls, long turnTimeoutMs, long reasoningTimeoutMs) {
        if (historyLimit < 0) {
            throw new IllegalArgumentException("historyLimit must be >= 0");
        }
        if (maxToolCalls < 0) {
            throw new IllegalArgumentException("maxToolCalls must be >= 0");
        }
        if (turnTimeoutMs <= 0 || reasoningTimeoutMs <= 0) {
            throw new IllegalArgumentException("timeouts must be positive");
        }
        this.historyLimit = historyLimit;
        this.maxToolCalls = maxToolCalls;
        this.turnTimeoutMs = turnTimeoutMs;
        this.reasoningTimeoutMs = reasoningTimeoutMs;
    }

    public static TurnSettings defaults() {
        return new TurnSettings(DEFAULT_HISTORY_LIMIT, DEFAULT_MAX_TOOL_CALLS,
            DEFAULT_TURN_TIMEOUT_MS, DEFAULT_REASONING_TIMEOUT_MS);
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public int getMaxToolCalls() {
        return maxToolCalls;
    }

    public long getTurnTimeoutMs() {
        return turnTimeoutMs;
    }

    public long getReasoningTimeoutMs() {
        return reasoningTimeoutMs;
    }

    @Override
    public String toString() {
        return "TurnSettings{historyLimit=" + historyLimit + ", maxToolCalls=" + maxToolCalls
            + ", turnTimeoutMs=" + turnTimeoutMs + ", reasoningTimeoutMs=" + reasoningTimeoutMs + "}";
    }
}
