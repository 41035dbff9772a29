package com.taskchat.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A schema bound to its handler. Keeps the handler's input type private to
 * the pair so the registry can hold heterogeneous tools.
 */
final class RegisteredTool<I> {
    private final ToolSchema schema;
    private final ToolHandler<I> handler;

    RegisteredTool(ToolSchema schema, ToolHandler<I> handler) {
        this.schema = schema;
        this.handler = handler;
    }

    ToolSchema getSchema() {
        return schema;
    }

    JsonNode invoke(String owner, JsonNode validatedArguments) {
        I input = handler.parse(validatedArguments);
        return handler.handle(owner, input);
    }
}
