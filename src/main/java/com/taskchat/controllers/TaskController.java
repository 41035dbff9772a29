package com.taskchat.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskchat.AppLogger;
import com.taskchat.auth.IdentityProvider;
import com.taskchat.chat.ErrorKind;
import com.taskchat.models.Task;
import com.taskchat.models.TaskStatus;
import com.taskchat.models.TaskUpdate;
import com.taskchat.storage.NotFoundException;
import com.taskchat.storage.TaskStore;
import com.taskchat.tools.ToolExecutor;
import com.taskchat.tools.ToolInvocationResult;
import com.taskchat.tools.ToolName;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Optional;

/**
 * REST access to the owner's tasks. Writes go through the same tool handlers
 * the assistant uses, so both paths share one set of input rules.
 */
public class TaskController implements Controller {

    private final IdentityProvider identityProvider;
    private final ToolExecutor toolExecutor;
    private final TaskStore taskStore;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public TaskController(IdentityProvider identityProvider, ToolExecutor toolExecutor, TaskStore taskStore,
                          ObjectMapper objectMapper) {
        this.identityProvider = identityProvider;
        this.toolExecutor = toolExecutor;
        this.taskStore = taskStore;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/tasks", this::listTasks);
        app.post("/api/tasks", this::createTask);
        app.get("/api/tasks/{id}", this::getTask);
        app.put("/api/tasks/{id}", this::updateTask);
        app.patch("/api/tasks/{id}/status", this::setStatus);
        app.delete("/api/tasks/{id}", this::deleteTask);
    }

    private void listTasks(Context ctx) {
        String owner = Controller.requireOwner(identityProvider, ctx);
        ObjectNode args = objectMapper.createObjectNode();
        String status = ctx.queryParam("status");
        if (status != null && !status.isBlank()) {
            args.put("status", status);
        }
        if (!copyIntParam(ctx, args, "limit") || !copyIntParam(ctx, args, "offset")) {
            return;
        }
        respond(ctx, toolExecutor.execute(ToolName.LIST_TASKS.getId(), args, owner), 200);
    }

    private void createTask(Context ctx) {
        String owner = Controller.requireOwner(identityProvider, ctx);
        JsonNode json = Controller.readJsonObject(objectMapper, ctx);
        if (json == null) {
            return;
        }
        respond(ctx, toolExecutor.execute(ToolName.CREATE_TASK.getId(), json, owner), 201);
    }

    private void getTask(Context ctx) {
        String owner = Controller.requireOwner(identityProvider, ctx);
        Optional<Task> task = taskStore.getTask(owner, ctx.pathParam("id"));
        if (task.isEmpty()) {
            ctx.status(404).json(Controller.errorBody(ErrorKind.NOT_FOUND, "Task not found"));
            return;
        }
        ctx.json(task.get());
    }

    private void updateTask(Context ctx) {
        String owner = Controller.requireOwner(identityProvider, ctx);
        JsonNode json = Controller.readJsonObject(objectMapper, ctx);
        if (json == null) {
            return;
        }
        ObjectNode args = ((ObjectNode) json).deepCopy();
        args.put("taskId", ctx.pathParam("id"));
        respond(ctx, toolExecutor.execute(ToolName.UPDATE_TASK.getId(), args, owner), 200);
    }

    private void setStatus(Context ctx) {
        String owner = Controller.requireOwner(identityProvider, ctx);
        JsonNode json = Controller.readJsonObject(objectMapper, ctx);
        if (json == null) {
            return;
        }
        TaskStatus status;
        try {
            status = TaskStatus.fromValue(json.path("status").asText(""));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(ErrorKind.VALIDATION_ERROR,
                "status must be one of pending, completed"));
            return;
        }
        String taskId = ctx.pathParam("id");
        try {
            Task task = status == TaskStatus.COMPLETED
                ? taskStore.completeTask(owner, taskId)
                : taskStore.updateTask(owner, taskId, new TaskUpdate().status(TaskStatus.PENDING));
            logger.info("[TaskController] Task " + taskId + " set to " + status.getValue());
            ctx.json(task);
        } catch (NotFoundException e) {
            ctx.status(404).json(Controller.errorBody(ErrorKind.NOT_FOUND, "Task not found"));
        }
    }

    private void deleteTask(Context ctx) {
        String owner = Controller.requireOwner(identityProvider, ctx);
        ObjectNode args = objectMapper.createObjectNode();
        args.put("taskId", ctx.pathParam("id"));
        respond(ctx, toolExecutor.execute(ToolName.DELETE_TASK.getId(), args, owner), 200);
    }

    private boolean copyIntParam(Context ctx, ObjectNode args, String name) {
        String raw = ctx.queryParam(name);
        if (raw == null || raw.isBlank()) {
            return true;
        }
        Integer value = Controller.intQueryParam(ctx, name, 0);
        if (value == null) {
            ctx.status(400).json(Controller.errorBody(ErrorKind.VALIDATION_ERROR, name + " must be an integer"));
            return false;
        }
        args.put(name, value);
        return true;
    }

    private void respond(Context ctx, ToolInvocationResult result, int successStatus) {
        if (result.isSuccess()) {
            ctx.status(successStatus).json(result.getResult());
            return;
        }
        switch (result.getError().getKind()) {
            case VALIDATION_ERROR:
                ctx.status(400).json(Controller.errorBody(ErrorKind.VALIDATION_ERROR, result.getError().getMessage()));
                break;
            case NOT_FOUND:
                ctx.status(404).json(Controller.errorBody(ErrorKind.NOT_FOUND, result.getError().getMessage()));
                break;
            case UNKNOWN_TOOL:
                ctx.status(500).json(Controller.errorBody(ErrorKind.INTERNAL_ERROR, "Unexpected server error"));
                break;
            case STORE_ERROR:
            default:
                ctx.status(500).json(Controller.errorBody(ErrorKind.STORE_ERROR, result.getError().getMessage()));
                break;
        }
    }
}
