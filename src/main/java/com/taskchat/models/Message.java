package com.taskchat.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One immutable turn of a conversation. Messages are append-only and ordered by
 * (createdAt, seq) within their conversation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public static final int MAX_CONTENT_LENGTH = 8000;

    private final String id;
    private final String conversationId;
    private final String owner;
    private final MessageRole role;
    private final String content;
    private final JsonNode toolCalls;
    private final long seq;
    private final long createdAt;

    public Message(String id, String conversationId, String owner, MessageRole role, String content,
                   JsonNode toolCalls, long seq, long createdAt) {
        this.id = id;
        this.conversationId = conversationId;
        this.owner = owner;
        this.role = role;
        this.content = content;
        this.toolCalls = toolCalls;
        this.seq = seq;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getConversationId() {
        return conversationId;
    }

    @JsonIgnore
    public String getOwner() {
        return owner;
    }

    public MessageRole getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    /**
     * Structured record of the tool invocations made while producing this
     * message, or null when none were made.
     */
    public JsonNode getToolCalls() {
        return toolCalls;
    }

    public long getSeq() {
        return seq;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "Message{" +
            "id='" + id + '\'' +
            ", conversationId='" + conversationId + '\'' +
            ", role=" + role +
            ", seq=" + seq +
            ", createdAt=" + createdAt +
            '}';
    }
}
