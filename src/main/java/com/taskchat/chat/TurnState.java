package com.taskchat.chat;

/**
 * Steps of one chat turn. {@link #DONE} and {@link #ABORTED} are terminal.
 */
public enum TurnState {
    START,
    LOAD_HISTORY,
    APPEND_USER_MESSAGE,
    INVOKE_REASONING,
    EVALUATE_REASONING_OUTPUT,
    EXECUTE_TOOL,
    FEED_RESULT_BACK,
    APPEND_ASSISTANT_MESSAGE,
    DONE,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }
}
