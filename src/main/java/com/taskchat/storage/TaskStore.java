package com.taskchat.storage;

import com.taskchat.models.NewTask;
import com.taskchat.models.Task;
import com.taskchat.models.TaskStatusFilter;
import com.taskchat.models.TaskUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Durable, owner-filtered task storage. Mutations on an id that the owner does
 * not have raise {@link NotFoundException}, whether or not another owner has it.
 */
public interface TaskStore {

    Task createTask(String owner, NewTask task);

    Optional<Task> getTask(String owner, String taskId);

    /**
     * Newest first, with insertion order as tie-break.
     */
    List<Task> listTasks(String owner, TaskStatusFilter filter, int limit, int offset);

    int countTasks(String owner, TaskStatusFilter filter);

    Task updateTask(String owner, String taskId, TaskUpdate update);

    /**
     * Marks the task completed. Completing an already completed task returns it
     * unchanged.
     */
    Task completeTask(String owner, String taskId);

    /**
     * Hard delete.
     *
     * @return the id of the removed task
     */
    String deleteTask(String owner, String taskId);
}
