package com.taskchat.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * One field of a tool's input contract: its type, whether it is required, and
 * its length, range or enum constraints.
 */
public class ToolArgSpec {
    public enum Type {
        STRING,
        INT,
        UUID,
        DATE
    }

    private final String name;
    private final Type type;
    private final boolean required;
    private final String description;
    private Integer minLength;
    private Integer maxLength;
    private Integer min;
    private Integer max;
    private Set<String> allowedValues;

    public ToolArgSpec(String name, Type type, boolean required, String description) {
        this.name = name;
        this.type = type;
        this.required = required;
        this.description = description;
    }

    public ToolArgSpec length(int minLength, int maxLength) {
        this.minLength = minLength;
        this.maxLength = maxLength;
        return this;
    }

    public ToolArgSpec range(int min, int max) {
        this.min = min;
        this.max = max;
        return this;
    }

    public ToolArgSpec oneOf(Set<String> values) {
        this.allowedValues = values != null ? new LinkedHashSet<>(values) : null;
        return this;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public String getDescription() {
        return description;
    }

    public Set<String> getAllowedValues() {
        return allowedValues == null ? Set.of() : Collections.unmodifiableSet(allowedValues);
    }

    /**
     * @return a human-readable reason, or null when the value is acceptable
     */
    public String validate(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return required ? name + " is required" : null;
        }
        switch (type) {
            case STRING:
                if (!node.isTextual()) {
                    return name + " must be a string";
                }
                return validateString(node.asText());
            case INT:
                if (!node.isIntegralNumber() || !node.canConvertToInt()) {
                    return name + " must be an integer";
                }
                int value = node.asInt();
                if (min != null && value < min) {
                    return name + " must be at least " + min;
                }
                if (max != null && value > max) {
                    return name + " must be at most " + max;
                }
                return null;
            case UUID:
                if (!node.isTextual() || !isCanonicalUuid(node.asText())) {
                    return name + " must be a valid task id";
                }
                return null;
            case DATE:
                if (!node.isTextual() || !DueDates.isValid(node.asText())) {
                    return name + " must be an ISO-8601 date or date-time";
                }
                return null;
            default:
                return name + " has an unsupported type";
        }
    }

    private String validateString(String raw) {
        String trimmed = raw.trim();
        if (minLength != null && trimmed.length() < minLength) {
            return minLength == 1 ? name + " must not be blank" : name + " must be at least " + minLength + " characters";
        }
        if (maxLength != null && trimmed.length() > maxLength) {
            return name + " must be at most " + maxLength + " characters";
        }
        if (allowedValues != null && !allowedValues.isEmpty()
            && !allowedValues.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return name + " must be one of " + String.join(", ", allowedValues);
        }
        return null;
    }

    private static boolean isCanonicalUuid(String value) {
        if (value == null || value.length() != 36) {
            return false;
        }
        try {
            return java.util.UUID.fromString(value).toString().equalsIgnoreCase(value);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * JSON Schema fragment describing this field for the tool catalog.
     */
    ObjectNode toJsonSchema(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        switch (type) {
            case INT:
                node.put("type", "integer");
                if (min != null) node.put("minimum", min);
                if (max != null) node.put("maximum", max);
                break;
            case UUID:
                node.put("type", "string");
                node.put("format", "uuid");
                break;
            case DATE:
                node.put("type", "string");
                node.put("format", "date-time");
                break;
            case STRING:
            default:
                node.put("type", "string");
                if (minLength != null) node.put("minLength", minLength);
                if (maxLength != null) node.put("maxLength", maxLength);
                if (allowedValues != null && !allowedValues.isEmpty()) {
                    ArrayNode values = node.putArray("enum");
                    allowedValues.forEach(values::add);
                }
                break;
        }
        if (description != null && !description.isBlank()) {
            node.put("description", description);
        }
        return node;
    }
}
