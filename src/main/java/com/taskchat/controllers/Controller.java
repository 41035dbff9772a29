package com.taskchat.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskchat.auth.IdentityProvider;
import com.taskchat.chat.ErrorKind;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interface for API controllers.
 * Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    /**
     * Register this controller's routes with the Javalin app.
     */
    void registerRoutes(Javalin app);

    /**
     * Error body in the one shape every endpoint uses: {@code {errorKind, detail}}.
     */
    static Map<String, Object> errorBody(ErrorKind kind, String detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("errorKind", kind.getWireName());
        body.put("detail", detail == null || detail.isBlank() ? kind.getWireName() : detail);
        return body;
    }

    /**
     * Owner of the request, taken only from the verified Authorization header.
     */
    static String requireOwner(IdentityProvider identityProvider, Context ctx) {
        return identityProvider.resolveOwner(ctx.header("Authorization"));
    }

    /**
     * Parses an optional integer query parameter.
     *
     * @return the value, or {@code fallback} when absent; null when present but not a number
     */
    static Integer intQueryParam(Context ctx, String name, int fallback) {
        String raw = ctx.queryParam(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Reads the request body as a JSON object, answering 400 itself when it is not one.
     *
     * @return the object, or null after a 400 response has been written
     */
    static JsonNode readJsonObject(ObjectMapper objectMapper, Context ctx) {
        JsonNode json;
        try {
            json = objectMapper.readTree(ctx.body());
        } catch (JsonProcessingException e) {
            ctx.status(400).json(errorBody(ErrorKind.VALIDATION_ERROR, "Request body is not valid JSON"));
            return null;
        }
        if (json == null || !json.isObject()) {
            ctx.status(400).json(errorBody(ErrorKind.VALIDATION_ERROR, "Request body must be a JSON object"));
            return null;
        }
        return json;
    }
}
