package com.taskchat.reasoning;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One tool call requested by the reasoning engine. The id correlates the call
 * with the result fed back on the next round.
 */
public class ToolCallRequest {
    private final String id;
    private final String name;
    private final JsonNode arguments;

    public ToolCallRequest(String id, String name, JsonNode arguments) {
        this.id = id;
        this.name = name;
        this.arguments = arguments;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public JsonNode getArguments() {
        return arguments;
    }

    @Override
    public String toString() {
        return "ToolCallRequest{id='" + id + "', name='" + name + "'}";
    }
}
