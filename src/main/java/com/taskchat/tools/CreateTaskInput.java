package com.taskchat.tools;

import com.taskchat.models.NewTask;
import com.taskchat.models.TaskPriority;

public final class CreateTaskInput {
    private final String title;
    private final String description;
    private final TaskPriority priority;
    private final String dueDate;

    public CreateTaskInput(String title, String description, TaskPriority priority, String dueDate) {
        this.title = title;
        this.description = description;
        this.priority = priority;
        this.dueDate = dueDate;
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

    public NewTask toNewTask() {
        return new NewTask(title, description, priority, dueDate);
    }
}
