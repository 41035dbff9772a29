package com.taskchat.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskchat.AppLogger;
import com.taskchat.auth.IdentityProvider;
import com.taskchat.chat.ChatOrchestrator;
import com.taskchat.chat.ErrorKind;
import com.taskchat.chat.TurnRequest;
import com.taskchat.chat.TurnResult;
import com.taskchat.models.Conversation;
import com.taskchat.models.Message;
import com.taskchat.storage.ConversationStore;
import com.taskchat.storage.NotFoundException;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat turns and conversation history.
 */
public class ChatController implements Controller {

    private static final int DEFAULT_CONVERSATION_LIMIT = 20;
    private static final int DEFAULT_MESSAGE_LIMIT = 50;

    private final IdentityProvider identityProvider;
    private final ChatOrchestrator orchestrator;
    private final ConversationStore conversationStore;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public ChatController(IdentityProvider identityProvider, ChatOrchestrator orchestrator,
                          ConversationStore conversationStore, ObjectMapper objectMapper) {
        this.identityProvider = identityProvider;
        this.orchestrator = orchestrator;
        this.conversationStore = conversationStore;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/chat", this::chat);
        app.post("/api/conversations", this::createConversation);
        app.get("/api/conversations", this::listConversations);
        app.get("/api/conversations/{id}/messages", this::listMessages);
    }

    private void chat(Context ctx) {
        String owner = Controller.requireOwner(identityProvider, ctx);
        JsonNode json = Controller.readJsonObject(objectMapper, ctx);
        if (json == null) {
            return;
        }
        JsonNode conversationNode = json.get("conversationId");
        if (conversationNode != null && !conversationNode.isNull() && !conversationNode.isTextual()) {
            ctx.status(400).json(Controller.errorBody(ErrorKind.VALIDATION_ERROR, "conversationId must be a string"));
            return;
        }
        JsonNode messageNode = json.get("message");
        if (messageNode == null || !messageNode.isTextual()) {
            ctx.status(400).json(Controller.errorBody(ErrorKind.VALIDATION_ERROR, "message is required"));
            return;
        }
        String conversationId = conversationNode != null && !conversationNode.isNull()
            ? conversationNode.asText()
            : null;

        logger.info("[ChatController] Chat turn requested by owner " + owner
            + (conversationId != null ? " in conversation " + conversationId : " (new conversation)"));
        TurnResult result = orchestrator.runTurn(new TurnRequest(owner, conversationId, messageNode.asText()));
        ctx.json(result);
    }

    private void createConversation(Context ctx) {
        String owner = Controller.requireOwner(identityProvider, ctx);
        String title = null;
        if (ctx.body() != null && !ctx.body().isBlank()) {
            JsonNode json = Controller.readJsonObject(objectMapper, ctx);
            if (json == null) {
                return;
            }
            JsonNode titleNode = json.get("title");
            if (titleNode != null && !titleNode.isNull()) {
                if (!titleNode.isTextual() || titleNode.asText().length() > Conversation.MAX_TITLE_LENGTH) {
                    ctx.status(400).json(Controller.errorBody(ErrorKind.VALIDATION_ERROR,
                        "title must be a string of at most " + Conversation.MAX_TITLE_LENGTH + " characters"));
                    return;
                }
                title = titleNode.asText();
            }
        }
        Conversation conversation = conversationStore.createConversation(owner, title);
        ctx.status(201).json(conversation);
    }

    private void listConversations(Context ctx) {
        String owner = Controller.requireOwner(identityProvider, ctx);
        Integer limit = Controller.intQueryParam(ctx, "limit", DEFAULT_CONVERSATION_LIMIT);
        if (limit == null || limit < 1) {
            ctx.status(400).json(Controller.errorBody(ErrorKind.VALIDATION_ERROR, "limit must be a positive integer"));
            return;
        }
        List<Conversation> conversations = conversationStore.listConversations(owner, limit);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("conversations", conversations);
        body.put("count", conversations.size());
        ctx.json(body);
    }

    private void listMessages(Context ctx) {
        String owner = Controller.requireOwner(identityProvider, ctx);
        String conversationId = ctx.pathParam("id");
        Integer limit = Controller.intQueryParam(ctx, "limit", DEFAULT_MESSAGE_LIMIT);
        if (limit == null || limit < 1) {
            ctx.status(400).json(Controller.errorBody(ErrorKind.VALIDATION_ERROR, "limit must be a positive integer"));
            return;
        }
        List<Message> messages;
        try {
            messages = conversationStore.listRecentMessages(owner, conversationId, limit);
        } catch (NotFoundException e) {
            ctx.status(404).json(Controller.errorBody(ErrorKind.NOT_FOUND, "Conversation not found"));
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("conversationId", conversationId);
        body.put("messages", messages);
        body.put("count", messages.size());
        ctx.json(body);
    }
}
