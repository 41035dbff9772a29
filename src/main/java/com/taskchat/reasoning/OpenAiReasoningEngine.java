package com.taskchat.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.taskchat.AppLogger;
import com.taskchat.tools.ToolDescriptor;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reasoning engine backed by an OpenAI-compatible {@code /v1/chat/completions}
 * endpoint using function tools.
 */
public class OpenAiReasoningEngine implements ReasoningEngine {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com";
    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final String completionsUrl;
    private final String model;
    private final String apiKey;
    private final Duration requestTimeout;
    private final AppLogger logger;

    public OpenAiReasoningEngine(ObjectMapper mapper, HttpClient httpClient, String baseUrl, String model,
                                 String apiKey, long requestTimeoutMs) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.completionsUrl = normalizeOpenAiBaseUrl(baseUrl) + "/v1/chat/completions";
        this.model = model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
        this.apiKey = apiKey;
        this.requestTimeout = Duration.ofMillis(Math.max(1, requestTimeoutMs));
        this.logger = AppLogger.get();
    }

    public String getCompletionsUrl() {
        return completionsUrl;
    }

    @Override
    public ReasoningOutput respond(List<ReasoningMessage> messages, List<ToolDescriptor> tools)
        throws ReasoningException {
        ObjectNode payload = buildPayload(messages, tools);
        JsonNode response = sendJsonPost(payload);
        return parseResponse(response);
    }

    ObjectNode buildPayload(List<ReasoningMessage> messages, List<ToolDescriptor> tools) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", model);

        ArrayNode messageArray = payload.putArray("messages");
        messageArray.addObject()
            .put("role", "system")
            .put("content", SystemPrompts.taskAssistant(tools));
        for (ReasoningMessage message : messages) {
            ObjectNode msg = messageArray.addObject();
            msg.put("role", message.getRole().getValue());
            if (message.getContent() != null) {
                msg.put("content", message.getContent());
            } else {
                msg.putNull("content");
            }
            if (!message.getToolCalls().isEmpty()) {
                ArrayNode calls = msg.putArray("tool_calls");
                for (ToolCallRequest call : message.getToolCalls()) {
                    ObjectNode callNode = calls.addObject();
                    callNode.put("id", call.getId());
                    callNode.put("type", "function");
                    ObjectNode function = callNode.putObject("function");
                    function.put("name", call.getName());
                    function.put("arguments", argumentsText(call.getArguments()));
                }
            }
            if (message.getToolCallId() != null) {
                msg.put("tool_call_id", message.getToolCallId());
            }
        }

        if (tools != null && !tools.isEmpty()) {
            ArrayNode toolArray = payload.putArray("tools");
            for (ToolDescriptor tool : tools) {
                ObjectNode toolNode = toolArray.addObject();
                toolNode.put("type", "function");
                ObjectNode function = toolNode.putObject("function");
                function.put("name", tool.getName());
                function.put("description", tool.getDescription());
                function.set("parameters", tool.getParameters());
            }
            payload.put("tool_choice", "auto");
        }
        return payload;
    }

    ReasoningOutput parseResponse(JsonNode response) throws ReasoningUnavailableException {
        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.size() == 0) {
            throw new ReasoningUnavailableException("Reasoning response had no choices");
        }
        JsonNode messageNode = choices.get(0).path("message");
        JsonNode toolCalls = messageNode.path("tool_calls");
        if (toolCalls.isArray() && toolCalls.size() > 0) {
            List<ToolCallRequest> requests = new ArrayList<>();
            int index = 0;
            for (JsonNode call : toolCalls) {
                String id = call.path("id").asText("");
                if (id.isBlank()) {
                    id = "call_" + index;
                }
                JsonNode function = call.path("function");
                requests.add(new ToolCallRequest(id, function.path("name").asText(""),
                    parseArguments(function.path("arguments"))));
                index++;
            }
            return ReasoningOutput.toolCalls(requests);
        }
        JsonNode content = messageNode.path("content");
        if (content.isTextual() && !content.asText().isBlank()) {
            return ReasoningOutput.text(content.asText());
        }
        throw new ReasoningUnavailableException("Reasoning response had neither text nor tool calls");
    }

    private JsonNode parseArguments(JsonNode arguments) {
        if (arguments.isObject()) {
            return arguments;
        }
        if (arguments.isMissingNode() || arguments.isNull()) {
            return mapper.createObjectNode();
        }
        String raw = arguments.asText("");
        if (raw.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            // Left as text; tool validation reports it back to the model.
            logger.warn("[OpenAiReasoningEngine] Tool call arguments were not valid JSON");
            return TextNode.valueOf(raw);
        }
    }

    private String argumentsText(JsonNode arguments) {
        if (arguments == null || arguments.isNull() || arguments.isMissingNode()) {
            return "{}";
        }
        if (arguments.isTextual()) {
            return arguments.asText();
        }
        return arguments.toString();
    }

    private JsonNode sendJsonPost(JsonNode payload) throws ReasoningException {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder()
                .uri(URI.create(completionsUrl))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));
        } catch (JsonProcessingException e) {
            throw new ReasoningUnavailableException("Cannot encode reasoning request", e);
        }
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ReasoningTimeoutException("Reasoning request timed out after " + requestTimeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new ReasoningUnavailableException("Reasoning service unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReasoningTimeoutException("Reasoning request interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            logger.warn("[OpenAiReasoningEngine] Chat completion failed with status " + status);
            throw new ReasoningUnavailableException("Reasoning request failed (" + status + ")", status, null);
        }
        try {
            return mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new ReasoningUnavailableException("Reasoning response was not valid JSON", e);
        }
    }

    private static String normalizeOpenAiBaseUrl(String baseUrl) {
        String url = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url;
    }
}
