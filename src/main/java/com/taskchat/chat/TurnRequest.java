package com.taskchat.chat;

/**
 * Input of one turn. The owner comes from the verified identity, never from the request body.
 */
public class TurnRequest {
    private final String owner;
    private final String conversationId;
    private final String message;

    public TurnRequest(String owner, String conversationId, String message) {
        this.owner = owner;
        this.conversationId = conversationId;
        this.message = message;
    }

    public String getOwner() {
        return owner;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getMessage() {
        return message;
    }
}
