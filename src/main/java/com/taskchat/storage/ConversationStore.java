package com.taskchat.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskchat.models.Conversation;
import com.taskchat.models.Message;
import com.taskchat.models.MessageRole;

import java.util.List;
import java.util.Optional;

/**
 * Durable, owner-filtered storage for conversations and their messages. Every
 * call takes the requesting owner; writes are committed before returning.
 */
public interface ConversationStore {

    Conversation createConversation(String owner, String title);

    Optional<Conversation> getConversation(String owner, String conversationId);

    /**
     * Conversations of the owner, most recently active first.
     */
    List<Conversation> listConversations(String owner, int limit);

    /**
     * Appends one message in its own transaction. Appends to the same
     * conversation are serialized so that concurrent turns never reorder or
     * overwrite each other.
     *
     * @throws NotFoundException if the conversation does not exist
     * @throws ForbiddenException if the conversation belongs to another owner
     */
    Message appendMessage(String owner, String conversationId, MessageRole role, String content, JsonNode toolCalls);

    /**
     * Up to {@code limit} most recent messages, returned oldest first.
     *
     * @throws NotFoundException if the owner has no such conversation
     */
    List<Message> listRecentMessages(String owner, String conversationId, int limit);
}
