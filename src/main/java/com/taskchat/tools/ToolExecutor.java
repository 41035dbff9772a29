package com.taskchat.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskchat.AppLogger;
import com.taskchat.storage.ForbiddenException;
import com.taskchat.storage.NotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * Runs catalog tools on behalf of a verified owner. Every failure is returned
 * as a structured {@link ToolInvocationResult}; nothing is retried here.
 */
public class ToolExecutor {
    private final ToolRegistry registry;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public ToolExecutor(ToolRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    public List<ToolDescriptor> catalog() {
        return registry.catalog(objectMapper);
    }

    public ToolInvocationResult execute(String name, JsonNode rawInput, String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner is required");
        }
        JsonNode input = rawInput == null || rawInput.isNull() || rawInput.isMissingNode()
            ? objectMapper.createObjectNode()
            : rawInput;

        Optional<ToolName> resolved = registry.resolve(name);
        if (resolved.isEmpty()) {
            logger.warn("[ToolExecutor] Unknown tool requested: " + name);
            return ToolInvocationResult.error(name, input, ToolErrorKind.UNKNOWN_TOOL, "Unknown tool: " + name);
        }
        ToolName toolName = resolved.get();
        String tool = toolName.getId();
        RegisteredTool<?> registered = registry.get(toolName);

        JsonNode normalized = registered.getSchema().normalizeArgsNode(input);
        String reason = registered.getSchema().validate(normalized);
        if (reason != null) {
            logger.info("[ToolExecutor] Rejected " + tool + " input: " + reason);
            return ToolInvocationResult.error(tool, normalized, ToolErrorKind.VALIDATION_ERROR, reason);
        }

        try {
            JsonNode result = registered.invoke(owner, normalized);
            logger.info("[ToolExecutor] " + tool + " succeeded for owner " + owner);
            return ToolInvocationResult.ok(tool, normalized, result);
        } catch (ToolValidationException e) {
            logger.info("[ToolExecutor] Rejected " + tool + " input: " + e.getMessage());
            return ToolInvocationResult.error(tool, normalized, ToolErrorKind.VALIDATION_ERROR, e.getMessage());
        } catch (NotFoundException | ForbiddenException e) {
            // Missing and foreign-owned rows must look the same to the caller.
            logger.info("[ToolExecutor] " + tool + " found nothing for owner " + owner);
            return ToolInvocationResult.error(tool, normalized, ToolErrorKind.NOT_FOUND, "Task not found");
        } catch (RuntimeException e) {
            logger.error("[ToolExecutor] " + tool + " failed for owner " + owner, e);
            return ToolInvocationResult.error(tool, normalized, ToolErrorKind.STORE_ERROR,
                "The task could not be saved or read right now");
        }
    }
}
