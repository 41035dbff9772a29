package com.taskchat.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Catalog entry handed to the reasoning engine: name, description and a JSON
 * Schema of the accepted input.
 */
public class ToolDescriptor {

    private final String name;
    private final String description;
    private final JsonNode parameters;

    public ToolDescriptor(String name, String description, JsonNode parameters) {
        this.name = name;
        this.description = description;
        this.parameters = parameters;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public JsonNode getParameters() {
        return parameters;
    }
}
