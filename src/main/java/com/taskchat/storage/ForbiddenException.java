package com.taskchat.storage;

/**
 * Raised by {@link ConversationStore#appendMessage} when the conversation exists
 * but belongs to a different owner.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
