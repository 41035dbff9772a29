package com.taskchat.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskchat.models.Task;
import com.taskchat.models.TaskPriority;
import com.taskchat.models.TaskStatusFilter;
import com.taskchat.models.TaskUpdate;
import com.taskchat.storage.TaskStore;

import java.util.List;
import java.util.Set;

/**
 * The five task operations exposed to the reasoning engine, each with its
 * input contract and handler over {@link TaskStore}.
 */
public final class TaskTools {

    private static final Set<String> STATUS_FILTERS = Set.of("all", "pending", "completed");

    private TaskTools() {
    }

    public static ToolRegistry createRegistry(TaskStore taskStore, ObjectMapper mapper) {
        return new ToolRegistry()
            .register(createTaskSchema(), new CreateTaskHandler(taskStore, mapper))
            .register(listTasksSchema(), new ListTasksHandler(taskStore, mapper))
            .register(completeTaskSchema(), new CompleteTaskHandler(taskStore, mapper))
            .register(updateTaskSchema(), new UpdateTaskHandler(taskStore, mapper))
            .register(deleteTaskSchema(), new DeleteTaskHandler(taskStore, mapper));
    }

    static ToolSchema createTaskSchema() {
        return new ToolSchema(ToolName.CREATE_TASK, "Create a new task for the user.")
            .arg(new ToolArgSpec("title", ToolArgSpec.Type.STRING, true, "Short task title")
                .length(1, Task.MAX_TITLE_LENGTH))
            .arg(new ToolArgSpec("description", ToolArgSpec.Type.STRING, false, "Optional details")
                .length(0, Task.MAX_DESCRIPTION_LENGTH))
            .arg(new ToolArgSpec("priority", ToolArgSpec.Type.STRING, false, "Task priority, defaults to medium")
                .oneOf(TaskPriority.allowedValues()))
            .arg(new ToolArgSpec("dueDate", ToolArgSpec.Type.DATE, false, "Due date as ISO-8601 date or date-time"))
            .alias("name", "title")
            .alias("details", "description")
            .alias("due", "dueDate");
    }

    static ToolSchema listTasksSchema() {
        return new ToolSchema(ToolName.LIST_TASKS, "List the user's tasks, newest first.")
            .arg(new ToolArgSpec("status", ToolArgSpec.Type.STRING, false, "Filter: all, pending or completed")
                .oneOf(STATUS_FILTERS))
            .arg(new ToolArgSpec("limit", ToolArgSpec.Type.INT, false, "Maximum number of tasks to return")
                .range(1, ListTasksInput.MAX_LIMIT))
            .arg(new ToolArgSpec("offset", ToolArgSpec.Type.INT, false, "Number of tasks to skip")
                .range(0, Integer.MAX_VALUE))
            .alias("filter", "status");
    }

    static ToolSchema completeTaskSchema() {
        return new ToolSchema(ToolName.COMPLETE_TASK, "Mark one of the user's tasks as completed.")
            .arg(taskIdArg())
            .alias("id", "taskId");
    }

    static ToolSchema updateTaskSchema() {
        return new ToolSchema(ToolName.UPDATE_TASK,
            "Change the title, description, priority or due date of one of the user's tasks.")
            .arg(taskIdArg())
            .arg(new ToolArgSpec("title", ToolArgSpec.Type.STRING, false, "New title")
                .length(1, Task.MAX_TITLE_LENGTH))
            .arg(new ToolArgSpec("description", ToolArgSpec.Type.STRING, false, "New description, empty to clear")
                .length(0, Task.MAX_DESCRIPTION_LENGTH))
            .arg(new ToolArgSpec("priority", ToolArgSpec.Type.STRING, false, "New priority")
                .oneOf(TaskPriority.allowedValues()))
            .arg(new ToolArgSpec("dueDate", ToolArgSpec.Type.DATE, false, "New due date"))
            .alias("id", "taskId")
            .alias("due", "dueDate");
    }

    static ToolSchema deleteTaskSchema() {
        return new ToolSchema(ToolName.DELETE_TASK, "Permanently delete one of the user's tasks.")
            .arg(taskIdArg())
            .alias("id", "taskId");
    }

    private static ToolArgSpec taskIdArg() {
        return new ToolArgSpec("taskId", ToolArgSpec.Type.UUID, true, "Id of an existing task");
    }

    private static String text(JsonNode arguments, String field) {
        JsonNode node = arguments != null ? arguments.get(field) : null;
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText().trim();
    }

    private static int intValue(JsonNode arguments, String field, int fallback) {
        JsonNode node = arguments != null ? arguments.get(field) : null;
        return node == null || node.isNull() ? fallback : node.asInt();
    }

    private static String dueDate(JsonNode arguments) {
        String raw = text(arguments, "dueDate");
        return raw == null ? null : DueDates.normalize(raw);
    }

    private static TaskPriority priority(JsonNode arguments) {
        String raw = text(arguments, "priority");
        return raw == null ? null : TaskPriority.fromValue(raw);
    }

    static final class CreateTaskHandler implements ToolHandler<CreateTaskInput> {
        private final TaskStore store;
        private final ObjectMapper mapper;

        CreateTaskHandler(TaskStore store, ObjectMapper mapper) {
            this.store = store;
            this.mapper = mapper;
        }

        @Override
        public CreateTaskInput parse(JsonNode arguments) {
            String description = text(arguments, "description");
            return new CreateTaskInput(
                text(arguments, "title"),
                description == null || description.isEmpty() ? null : description,
                priority(arguments),
                dueDate(arguments));
        }

        @Override
        public JsonNode handle(String owner, CreateTaskInput input) {
            Task task = store.createTask(owner, input.toNewTask());
            return mapper.valueToTree(task);
        }
    }

    static final class ListTasksHandler implements ToolHandler<ListTasksInput> {
        private final TaskStore store;
        private final ObjectMapper mapper;

        ListTasksHandler(TaskStore store, ObjectMapper mapper) {
            this.store = store;
            this.mapper = mapper;
        }

        @Override
        public ListTasksInput parse(JsonNode arguments) {
            return new ListTasksInput(
                TaskStatusFilter.fromValue(text(arguments, "status")),
                intValue(arguments, "limit", ListTasksInput.DEFAULT_LIMIT),
                intValue(arguments, "offset", 0));
        }

        @Override
        public JsonNode handle(String owner, ListTasksInput input) {
            List<Task> tasks = store.listTasks(owner, input.getStatus(), input.getLimit(), input.getOffset());
            int total = store.countTasks(owner, input.getStatus());
            ObjectNode result = mapper.createObjectNode();
            ArrayNode items = result.putArray("tasks");
            for (Task task : tasks) {
                items.add(mapper.<JsonNode>valueToTree(task));
            }
            result.put("count", tasks.size());
            result.put("total", total);
            result.put("status", input.getStatus().getValue());
            result.put("limit", input.getLimit());
            result.put("offset", input.getOffset());
            return result;
        }
    }

    static final class CompleteTaskHandler implements ToolHandler<TaskIdInput> {
        private final TaskStore store;
        private final ObjectMapper mapper;

        CompleteTaskHandler(TaskStore store, ObjectMapper mapper) {
            this.store = store;
            this.mapper = mapper;
        }

        @Override
        public TaskIdInput parse(JsonNode arguments) {
            return new TaskIdInput(text(arguments, "taskId"));
        }

        @Override
        public JsonNode handle(String owner, TaskIdInput input) {
            return mapper.valueToTree(store.completeTask(owner, input.getTaskId()));
        }
    }

    static final class UpdateTaskHandler implements ToolHandler<UpdateTaskInput> {
        private final TaskStore store;
        private final ObjectMapper mapper;

        UpdateTaskHandler(TaskStore store, ObjectMapper mapper) {
            this.store = store;
            this.mapper = mapper;
        }

        @Override
        public UpdateTaskInput parse(JsonNode arguments) {
            TaskUpdate update = new TaskUpdate()
                .title(text(arguments, "title"))
                .description(text(arguments, "description"))
                .priority(priority(arguments))
                .dueDate(dueDate(arguments));
            if (update.isEmpty()) {
                throw new ToolValidationException(
                    "at least one of title, description, priority or dueDate is required");
            }
            return new UpdateTaskInput(text(arguments, "taskId"), update);
        }

        @Override
        public JsonNode handle(String owner, UpdateTaskInput input) {
            return mapper.valueToTree(store.updateTask(owner, input.getTaskId(), input.getUpdate()));
        }
    }

    static final class DeleteTaskHandler implements ToolHandler<TaskIdInput> {
        private final TaskStore store;
        private final ObjectMapper mapper;

        DeleteTaskHandler(TaskStore store, ObjectMapper mapper) {
            this.store = store;
            this.mapper = mapper;
        }

        @Override
        public TaskIdInput parse(JsonNode arguments) {
            return new TaskIdInput(text(arguments, "taskId"));
        }

        @Override
        public JsonNode handle(String owner, TaskIdInput input) {
            ObjectNode result = mapper.createObjectNode();
            result.put("id", store.deleteTask(owner, input.getTaskId()));
            return result;
        }
    }
}
