package com.taskchat.tools;

/**
 * Tool input that passed the schema but still cannot be turned into a typed
 * input (for example an update with no fields to change).
 */
public class ToolValidationException extends RuntimeException {

    public ToolValidationException(String message) {
        super(message);
    }
}
