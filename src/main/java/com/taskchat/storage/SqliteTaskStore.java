package com.taskchat.storage;

import com.taskchat.AppLogger;
import com.taskchat.models.NewTask;
import com.taskchat.models.Task;
import com.taskchat.models.TaskPriority;
import com.taskchat.models.TaskStatus;
import com.taskchat.models.TaskStatusFilter;
import com.taskchat.models.TaskUpdate;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public class SqliteTaskStore implements TaskStore {

    private static final int MAX_LIST_LIMIT = 100;
    private static final String TASK_COLUMNS =
        "id, owner, title, description, status, priority, due_date, created_at, updated_at";

    private final SqliteDatabase database;
    private final Clock clock;
    private final AppLogger logger;

    public SqliteTaskStore(SqliteDatabase database) {
        this(database, Clock.systemUTC());
    }

    public SqliteTaskStore(SqliteDatabase database, Clock clock) {
        this.database = Objects.requireNonNull(database, "database");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = AppLogger.get();
    }

    @Override
    public Task createTask(String owner, NewTask newTask) {
        Ownership.requireOwner(owner);
        Objects.requireNonNull(newTask, "newTask");
        String id = UUID.randomUUID().toString();
        long now = clock.millis();
        Task task = new Task(id, owner, newTask.getTitle(), emptyToNull(newTask.getDescription()),
            TaskStatus.PENDING, newTask.getPriority(), newTask.getDueDate(), now, now);
        database.write(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO tasks (" + TASK_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                ps.setString(1, task.getId());
                ps.setString(2, owner);
                ps.setString(3, task.getTitle());
                ps.setString(4, task.getDescription());
                ps.setString(5, task.getStatus().getValue());
                ps.setString(6, task.getPriority().getValue());
                ps.setString(7, task.getDueDate());
                ps.setLong(8, task.getCreatedAt());
                ps.setLong(9, task.getUpdatedAt());
                ps.executeUpdate();
            }
            return null;
        });
        logger.info("[SqliteTaskStore] Created task " + id + " for owner " + owner);
        return task;
    }

    @Override
    public Optional<Task> getTask(String owner, String taskId) {
        Ownership.requireOwner(owner);
        if (taskId == null || taskId.isBlank()) {
            return Optional.empty();
        }
        return database.read(connection -> Optional.ofNullable(findOwned(connection, owner, taskId)));
    }

    @Override
    public List<Task> listTasks(String owner, TaskStatusFilter filter, int limit, int offset) {
        Ownership.requireOwner(owner);
        TaskStatus status = filter != null ? filter.getStatus() : null;
        int bounded = Ownership.clampLimit(limit, MAX_LIST_LIMIT);
        int skip = Math.max(0, offset);
        if (bounded == 0) {
            return List.of();
        }
        String sql = "SELECT " + TASK_COLUMNS + " FROM tasks WHERE owner = ?"
            + (status != null ? " AND status = ?" : "")
            + " ORDER BY created_at DESC, rowid DESC LIMIT ? OFFSET ?";
        return database.read(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                int index = 1;
                ps.setString(index++, owner);
                if (status != null) {
                    ps.setString(index++, status.getValue());
                }
                ps.setInt(index++, bounded);
                ps.setInt(index, skip);
                try (ResultSet rs = ps.executeQuery()) {
                    List<Task> results = new ArrayList<>();
                    while (rs.next()) {
                        results.add(mapTask(rs));
                    }
                    return results;
                }
            }
        });
    }

    @Override
    public int countTasks(String owner, TaskStatusFilter filter) {
        Ownership.requireOwner(owner);
        TaskStatus status = filter != null ? filter.getStatus() : null;
        String sql = "SELECT COUNT(*) FROM tasks WHERE owner = ?" + (status != null ? " AND status = ?" : "");
        return database.read(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                ps.setString(1, owner);
                if (status != null) {
                    ps.setString(2, status.getValue());
                }
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    @Override
    public Task updateTask(String owner, String taskId, TaskUpdate update) {
        Ownership.requireOwner(owner);
        Objects.requireNonNull(update, "update");
        Task updated = database.write(connection -> {
            Task current = requireOwned(connection, owner, taskId);
            if (update.isEmpty()) {
                return current;
            }
            Task next = new Task(
                current.getId(),
                current.getOwner(),
                update.getTitle() != null ? update.getTitle() : current.getTitle(),
                update.getDescription() != null ? emptyToNull(update.getDescription()) : current.getDescription(),
                update.getStatus() != null ? update.getStatus() : current.getStatus(),
                update.getPriority() != null ? update.getPriority() : current.getPriority(),
                update.getDueDate() != null ? update.getDueDate() : current.getDueDate(),
                current.getCreatedAt(),
                nextUpdatedAt(current)
            );
            persist(connection, next);
            return next;
        });
        logger.info("[SqliteTaskStore] Updated task " + taskId + " for owner " + owner);
        return updated;
    }

    @Override
    public Task completeTask(String owner, String taskId) {
        Ownership.requireOwner(owner);
        Task completed = database.write(connection -> {
            Task current = requireOwned(connection, owner, taskId);
            if (current.isCompleted()) {
                return current;
            }
            Task next = new Task(current.getId(), current.getOwner(), current.getTitle(), current.getDescription(),
                TaskStatus.COMPLETED, current.getPriority(), current.getDueDate(), current.getCreatedAt(),
                nextUpdatedAt(current));
            persist(connection, next);
            return next;
        });
        logger.info("[SqliteTaskStore] Completed task " + taskId + " for owner " + owner);
        return completed;
    }

    @Override
    public String deleteTask(String owner, String taskId) {
        Ownership.requireOwner(owner);
        if (taskId == null || taskId.isBlank()) {
            throw new NotFoundException("Task", String.valueOf(taskId));
        }
        int deleted = database.write(connection -> {
            try (PreparedStatement ps = connection.prepareStatement("DELETE FROM tasks WHERE id = ? AND owner = ?")) {
                ps.setString(1, taskId);
                ps.setString(2, owner);
                return ps.executeUpdate();
            }
        });
        if (deleted == 0) {
            throw new NotFoundException("Task", taskId);
        }
        logger.info("[SqliteTaskStore] Deleted task " + taskId + " for owner " + owner);
        return taskId;
    }

    private long nextUpdatedAt(Task current) {
        return Math.max(clock.millis(), current.getUpdatedAt() + 1);
    }

    private void persist(Connection connection, Task task) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
            "UPDATE tasks SET title = ?, description = ?, status = ?, priority = ?, due_date = ?, updated_at = ?" +
                " WHERE id = ? AND owner = ?")) {
            ps.setString(1, task.getTitle());
            ps.setString(2, task.getDescription());
            ps.setString(3, task.getStatus().getValue());
            ps.setString(4, task.getPriority().getValue());
            ps.setString(5, task.getDueDate());
            ps.setLong(6, task.getUpdatedAt());
            ps.setString(7, task.getId());
            ps.setString(8, task.getOwner());
            ps.executeUpdate();
        }
    }

    private Task requireOwned(Connection connection, String owner, String taskId) throws SQLException {
        Task task = taskId == null || taskId.isBlank() ? null : findOwned(connection, owner, taskId);
        if (task == null) {
            throw new NotFoundException("Task", String.valueOf(taskId));
        }
        return task;
    }

    private Task findOwned(Connection connection, String owner, String taskId) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
            "SELECT " + TASK_COLUMNS + " FROM tasks WHERE id = ? AND owner = ?")) {
            ps.setString(1, taskId);
            ps.setString(2, owner);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapTask(rs) : null;
            }
        }
    }

    private Task mapTask(ResultSet rs) throws SQLException {
        return new Task(
            rs.getString("id"),
            rs.getString("owner"),
            rs.getString("title"),
            rs.getString("description"),
            TaskStatus.fromValue(rs.getString("status")),
            TaskPriority.fromValue(rs.getString("priority")),
            rs.getString("due_date"),
            rs.getLong("created_at"),
            rs.getLong("updated_at")
        );
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
