package com.taskchat.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatusFilter {
    ALL("all", null),
    PENDING("pending", TaskStatus.PENDING),
    COMPLETED("completed", TaskStatus.COMPLETED);

    private final String value;
    private final TaskStatus status;

    TaskStatusFilter(String value, TaskStatus status) {
        this.value = value;
        this.status = status;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * The status rows must have to match, or null for {@link #ALL}.
     */
    public TaskStatus getStatus() {
        return status;
    }

    @JsonCreator
    public static TaskStatusFilter fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        for (TaskStatusFilter filter : values()) {
            if (filter.value.equalsIgnoreCase(value.trim())) {
                return filter;
            }
        }
        throw new IllegalArgumentException("Unknown status filter: " + value);
    }
}
