package com.taskchat.tools;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolErrorKind {
    UNKNOWN_TOOL("UnknownTool"),
    VALIDATION_ERROR("ValidationError"),
    NOT_FOUND("NotFound"),
    STORE_ERROR("StoreError");

    private final String wireName;

    ToolErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
