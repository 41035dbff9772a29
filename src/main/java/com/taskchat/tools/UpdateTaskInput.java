package com.taskchat.tools;

import com.taskchat.models.TaskUpdate;

public final class UpdateTaskInput {
    private final String taskId;
    private final TaskUpdate update;

    public UpdateTaskInput(String taskId, TaskUpdate update) {
        this.taskId = taskId;
        this.update = update;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskUpdate getUpdate() {
        return update;
    }
}
