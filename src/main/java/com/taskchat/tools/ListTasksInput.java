package com.taskchat.tools;

import com.taskchat.models.TaskStatusFilter;

public final class ListTasksInput {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    private final TaskStatusFilter status;
    private final int limit;
    private final int offset;

    public ListTasksInput(TaskStatusFilter status, int limit, int offset) {
        this.status = status != null ? status : TaskStatusFilter.ALL;
        this.limit = limit;
        this.offset = offset;
    }

    public TaskStatusFilter getStatus() {
        return status;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }
}
