package com.taskchat.reasoning;

import java.util.List;

/**
 * Either terminal text or a non-empty list of tool calls to run before asking again.
 */
public class ReasoningOutput {
    private final String text;
    private final List<ToolCallRequest> toolCalls;

    private ReasoningOutput(String text, List<ToolCallRequest> toolCalls) {
        this.text = text;
        this.toolCalls = toolCalls;
    }

    public static ReasoningOutput text(String text) {
        return new ReasoningOutput(text != null ? text : "", List.of());
    }

    public static ReasoningOutput toolCalls(List<ToolCallRequest> calls) {
        if (calls == null || calls.isEmpty()) {
            throw new IllegalArgumentException("at least one tool call is required");
        }
        return new ReasoningOutput(null, List.copyOf(calls));
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public String getText() {
        return text;
    }

    public List<ToolCallRequest> getToolCalls() {
        return toolCalls;
    }
}
