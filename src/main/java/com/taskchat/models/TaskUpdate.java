package com.taskchat.models;

/**
 * Partial task update. Null fields are left unchanged; an empty description
 * clears the stored one.
 */
public class TaskUpdate {

    private String title;
    private String description;
    private TaskPriority priority;
    private String dueDate;
    private TaskStatus status;

    public TaskUpdate() {
    }

    public TaskUpdate title(String title) {
        this.title = title;
        return this;
    }

    public TaskUpdate description(String description) {
        this.description = description;
        return this;
    }

    public TaskUpdate priority(TaskPriority priority) {
        this.priority = priority;
        return this;
    }

    public TaskUpdate dueDate(String dueDate) {
        this.dueDate = dueDate;
        return this;
    }

    public TaskUpdate status(TaskStatus status) {
        this.status = status;
        return this;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public TaskPriority getPriority() {
        return priority;
    }

    public String getDueDate() {
        return dueDate;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public boolean isEmpty() {
        return title == null && description == null && priority == null && dueDate == null && status == null;
    }
}
