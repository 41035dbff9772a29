package com.taskchat.tools;

/**
 * Input of the tools that address a single task by id.
 */
public final class TaskIdInput {
    private final String taskId;

    public TaskIdInput(String taskId) {
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
