package com.taskchat.tools;

public class ToolError {

    private final ToolErrorKind kind;
    private final String message;

    public ToolError(ToolErrorKind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    public ToolErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return kind.getWireName() + ": " + message;
    }
}
