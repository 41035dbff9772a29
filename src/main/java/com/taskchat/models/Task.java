package com.taskchat.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class Task {

    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MAX_DESCRIPTION_LENGTH = 1000;

    private final String id;
    private final String owner;
    private final String title;
    private final String description;
    private final TaskStatus status;
    private final TaskPriority priority;
    private final String dueDate;
    private final long createdAt;
    private final long updatedAt;

    public Task(String id, String owner, String title, String description, TaskStatus status,
                TaskPriority priority, String dueDate, long createdAt, long updatedAt) {
        this.id = id;
        this.owner = owner;
        this.title = title;
        this.description = description;
        this.status = status;
        this.priority = priority;
        this.dueDate = dueDate;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public String getId() {
        return id;
    }

    @JsonIgnore
    public String getOwner() {
        return owner;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public TaskPriority getPriority() {
        return priority;
    }

    /**
     * ISO-8601 instant, or null when the task has no due date.
     */
    public String getDueDate() {
        return dueDate;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }

    @Override
    public String toString() {
        return "Task{" +
            "id='" + id + '\'' +
            ", status=" + status +
            ", priority=" + priority +
            ", createdAt=" + createdAt +
            ", updatedAt=" + updatedAt +
            '}';
    }
}
