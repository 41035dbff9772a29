package com.taskchat.chat;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable failure categories exposed to callers in {@code errorKind}.
 */
public enum ErrorKind {
    VALIDATION_ERROR("ValidationError"),
    NOT_FOUND("NotFoundError"),
    UNKNOWN_TOOL("UnknownToolError"),
    REASONING_TIMEOUT("ReasoningTimeoutError"),
    REASONING_UNAVAILABLE("ReasoningUnavailableError"),
    REASONING_RATE_LIMITED("ReasoningRateLimited"),
    STORE_ERROR("StoreError"),
    TURN_DEADLINE_EXCEEDED("TurnDeadlineExceeded"),
    TOOL_LOOP_EXHAUSTED("ToolLoopExhausted"),
    UNAUTHORIZED("Unauthorized"),
    INTERNAL_ERROR("InternalError");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
