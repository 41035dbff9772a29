package com.taskchat.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Typed implementation of one catalog entry.
 *
 * @param <I> the concrete input type built from schema-validated arguments
 */
public interface ToolHandler<I> {

    /**
     * Converts schema-validated, alias-normalized arguments into the typed input.
     * Cross-field rules the schema cannot express are reported with
     * {@link ToolValidationException}.
     */
    I parse(JsonNode arguments);

    /**
     * Runs the operation for {@code owner}. The owner always comes from the
     * caller's verified context and never from {@code input}.
     */
    JsonNode handle(String owner, I input);
}
