package com.taskchat.models;

/**
 * Fields supplied when creating a task. Id, owner, status and timestamps are
 * assigned by the store.
 */
public class NewTask {

    private final String title;
    private final String description;
    private final TaskPriority priority;
    private final String dueDate;

    public NewTask(String title, String description, TaskPriority priority, String dueDate) {
        this.title = title;
        this.description = description;
        this.priority = priority != null ? priority : TaskPriority.DEFAULT;
        this.dueDate = dueDate;
    }

    public static NewTask titled(String title) {
        return new NewTask(title, null, null, null);
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
}
