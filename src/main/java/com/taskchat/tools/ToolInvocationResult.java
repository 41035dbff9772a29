package com.taskchat.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of one tool call within a turn. Never persisted on its own; it is
 * folded into the assistant message's tool-call record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolInvocationResult {

    private final String tool;
    private final JsonNode input;
    private final boolean success;
    private final JsonNode result;
    private final ToolError error;

    private ToolInvocationResult(String tool, JsonNode input, boolean success, JsonNode result, ToolError error) {
        this.tool = tool;
        this.input = input;
        this.success = success;
        this.result = result;
        this.error = error;
    }

    public static ToolInvocationResult ok(String tool, JsonNode input, JsonNode result) {
        return new ToolInvocationResult(tool, input, true, result, null);
    }

    public static ToolInvocationResult error(String tool, JsonNode input, ToolErrorKind kind, String message) {
        return new ToolInvocationResult(tool, input, false, null, new ToolError(kind, message));
    }

    public String getTool() {
        return tool;
    }

    public JsonNode getInput() {
        return input;
    }

    public boolean isSuccess() {
        return success;
    }

    public JsonNode getResult() {
        return result;
    }

    public ToolError getError() {
        return error;
    }
}
