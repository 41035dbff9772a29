package com.taskchat.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Input contract of one tool. Field names are matched leniently (case and
 * separators are ignored, curated aliases are mapped) before strict validation.
 */
public class ToolSchema {
    private final ToolName toolName;
    private final String description;
    private final Map<String, ToolArgSpec> args = new LinkedHashMap<>();
    // Normalized key -> canonical arg name
    private final Map<String, String> argAliases = new HashMap<>();

    public ToolSchema(ToolName toolName, String description) {
        this.toolName = toolName;
        this.description = description;
    }

    public ToolSchema arg(ToolArgSpec spec) {
        args.put(spec.getName(), spec);
        argAliases.put(normalizeArgKey(spec.getName()), spec.getName());
        return this;
    }

    public ToolSchema alias(String alias, String canonical) {
        if (alias == null || alias.isBlank() || canonical == null || !args.containsKey(canonical)) {
            return this;
        }
        argAliases.put(normalizeArgKey(alias), canonical);
        return this;
    }

    public ToolName getToolName() {
        return toolName;
    }

    public String getDescription() {
        return description;
    }

    public Set<String> getArgNames() {
        return Collections.unmodifiableSet(args.keySet());
    }

    public Map<String, ToolArgSpec> getArgSpecs() {
        return Collections.unmodifiableMap(args);
    }

    /**
     * Returns a copy of the input with field names mapped to their canonical
     * spelling. Unrecognized fields are kept so that validation can reject them.
     */
    public JsonNode normalizeArgsNode(JsonNode argsNode) {
        if (argsNode == null || !argsNode.isObject()) {
            return argsNode;
        }
        // Copy to avoid mutating the caller's tree, which is echoed back in the result.
        ObjectNode obj = ((ObjectNode) argsNode).deepCopy();

        List<String> keys = new ArrayList<>();
        Iterator<String> it = obj.fieldNames();
        while (it.hasNext()) {
            keys.add(it.next());
        }
        for (String key : keys) {
            if (args.containsKey(key)) continue;
            String canonical = argAliases.get(normalizeArgKey(key));
            if (canonical == null) {
                continue;
            }
            if (!obj.has(canonical)) {
                obj.set(canonical, obj.get(key));
            }
            obj.remove(key);
        }
        return obj;
    }

    private String normalizeArgKey(String key) {
        if (key == null) return "";
        return key.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "").replace(" ", "");
    }

    /**
     * @return a human-readable reason, or null when the (normalized) input is valid
     */
    public String validate(JsonNode normalized) {
        if (normalized == null || normalized.isNull() || normalized.isMissingNode()) {
            normalized = new ObjectMapper().createObjectNode();
        }
        if (!normalized.isObject()) {
            return "input must be a JSON object";
        }
        Iterator<String> fields = normalized.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            if (!args.containsKey(field)) {
                return "unknown field: " + field;
            }
        }
        for (ToolArgSpec spec : args.values()) {
            String error = spec.validate(normalized.get(spec.getName()));
            if (error != null) {
                return error;
            }
        }
        return null;
    }

    public ToolDescriptor toDescriptor(ObjectMapper mapper) {
        ObjectNode parameters = mapper.createObjectNode();
        parameters.put("type", "object");
        ObjectNode properties = parameters.putObject("properties");
        ArrayNode required = parameters.putArray("required");
        for (ToolArgSpec spec : args.values()) {
            properties.set(spec.getName(), spec.toJsonSchema(mapper));
            if (spec.isRequired()) {
                required.add(spec.getName());
            }
        }
        parameters.put("additionalProperties", false);
        return new ToolDescriptor(toolName.getId(), description, parameters);
    }
}
