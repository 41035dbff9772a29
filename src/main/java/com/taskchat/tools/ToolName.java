package com.taskchat.tools;

import java.util.Optional;

/**
 * The closed set of operations the reasoning engine may invoke.
 */
public enum ToolName {
    CREATE_TASK("createTask"),
    LIST_TASKS("listTasks"),
    COMPLETE_TASK("completeTask"),
    UPDATE_TASK("updateTask"),
    DELETE_TASK("deleteTask");

    private final String id;

    ToolName(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static Optional<ToolName> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (ToolName name : values()) {
            if (name.id.equals(id)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }
}
