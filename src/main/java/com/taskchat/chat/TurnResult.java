package com.taskchat.chat;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.taskchat.tools.ToolInvocationResult;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class TurnResult {
    private final String conversationId;
    private final String response;
    private final List<ToolInvocationResult> toolInvocations;
    private final boolean fallback;
    private final ErrorKind fallbackKind;

    private TurnResult(String conversationId, String response, List<ToolInvocationResult> toolInvocations,
                       boolean fallback, ErrorKind fallbackKind) {
        this.conversationId = conversationId;
        this.response = response;
        this.toolInvocations = List.copyOf(toolInvocations);
        this.fallback = fallback;
        this.fallbackKind = fallbackKind;
    }

    public static TurnResult completed(String conversationId, String response,
                                       List<ToolInvocationResult> toolInvocations) {
        return new TurnResult(conversationId, response, toolInvocations, false, null);
    }

    public static TurnResult fallback(String conversationId, ErrorKind kind,
                                      List<ToolInvocationResult> toolInvocations) {
        return new TurnResult(conversationId, FallbackMessages.forKind(kind), toolInvocations, true, kind);
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getResponse() {
        return response;
    }

    public List<ToolInvocationResult> getToolInvocations() {
        return toolInvocations;
    }

    public boolean isFallback() {
        return fallback;
    }

    public ErrorKind getFallbackKind() {
        return fallbackKind;
    }
}
