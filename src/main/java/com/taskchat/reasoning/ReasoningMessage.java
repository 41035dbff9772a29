package com.taskchat.reasoning;

import java.util.List;

/**
 * One entry of the context sent to the reasoning engine.
 */
public class ReasoningMessage {

    public enum Role {
        SYSTEM("system"),
        USER("user"),
        ASSISTANT("assistant"),
        TOOL("tool");

        private final String value;

        Role(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    private final Role role;
    private final String content;
    private final List<ToolCallRequest> toolCalls;
    private final String toolCallId;

    private ReasoningMessage(Role role, String content, List<ToolCallRequest> toolCalls, String toolCallId) {
        this.role = role;
        this.content = content;
        this.toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        this.toolCallId = toolCallId;
    }

    public static ReasoningMessage system(String content) {
        return new ReasoningMessage(Role.SYSTEM, content, null, null);
    }

    public static ReasoningMessage user(String content) {
        return new ReasoningMessage(Role.USER, content, null, null);
    }

    public static ReasoningMessage assistant(String content) {
        return new ReasoningMessage(Role.ASSISTANT, content, null, null);
    }

    public static ReasoningMessage assistantToolCalls(List<ToolCallRequest> toolCalls) {
        return new ReasoningMessage(Role.ASSISTANT, null, toolCalls, null);
    }

    public static ReasoningMessage toolResult(String toolCallId, String content) {
        return new ReasoningMessage(Role.TOOL, content, null, toolCallId);
    }

    public Role getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    public List<ToolCallRequest> getToolCalls() {
        return toolCalls;
    }

    public String getToolCallId() {
        return toolCallId;
    }
}
