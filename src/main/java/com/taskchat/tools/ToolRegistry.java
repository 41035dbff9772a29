package com.taskchat.tools;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed registry of the callable tools, keyed by {@link ToolName}. Names coming
 * from the reasoning engine are resolved leniently, but only to catalog entries.
 */
public class ToolRegistry {
    private static final Map<String, ToolName> TOOL_ALIASES = buildToolAliases();

    private final Map<ToolName, RegisteredTool<?>> tools = new EnumMap<>(ToolName.class);

    public <I> ToolRegistry register(ToolSchema schema, ToolHandler<I> handler) {
        if (schema == null || handler == null) {
            throw new IllegalArgumentException("schema and handler are required");
        }
        tools.put(schema.getToolName(), new RegisteredTool<>(schema, handler));
        return this;
    }

    /**
     * Maps a raw tool name (exact id, different casing or separators, or a
     * curated alias) to a registered tool.
     */
    public Optional<ToolName> resolve(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            return Optional.empty();
        }
        String trimmed = rawName.trim();
        Optional<ToolName> exact = ToolName.fromId(trimmed);
        if (exact.isPresent()) {
            return exact.filter(tools::containsKey);
        }
        String key = normalizeToolKey(trimmed);
        for (ToolName name : tools.keySet()) {
            if (normalizeToolKey(name.getId()).equals(key)) {
                return Optional.of(name);
            }
        }
        return Optional.ofNullable(TOOL_ALIASES.get(key)).filter(tools::containsKey);
    }

    RegisteredTool<?> get(ToolName name) {
        return tools.get(name);
    }

    public List<ToolDescriptor> catalog(ObjectMapper mapper) {
        List<ToolDescriptor> descriptors = new ArrayList<>();
        for (RegisteredTool<?> tool : tools.values()) {
            descriptors.add(tool.getSchema().toDescriptor(mapper));
        }
        return Collections.unmodifiableList(descriptors);
    }

    private static String normalizeToolKey(String name) {
        return name.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "").replace(" ", "");
    }

    private static Map<String, ToolName> buildToolAliases() {
        // Naming drift seen from models; keep to unambiguous verbs.
        Map<String, ToolName> map = new HashMap<>();
        map.put("addtask", ToolName.CREATE_TASK);
        map.put("newtask", ToolName.CREATE_TASK);
        map.put("gettasks", ToolName.LIST_TASKS);
        map.put("showtasks", ToolName.LIST_TASKS);
        map.put("listtask", ToolName.LIST_TASKS);
        map.put("finishtask", ToolName.COMPLETE_TASK);
        map.put("marktaskcomplete", ToolName.COMPLETE_TASK);
        map.put("marktaskcompleted", ToolName.COMPLETE_TASK);
        map.put("edittask", ToolName.UPDATE_TASK);
        map.put("removetask", ToolName.DELETE_TASK);
        return map;
    }
}
