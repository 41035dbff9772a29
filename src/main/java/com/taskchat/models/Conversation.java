package com.taskchat.models;

/**
 * A chat session. The owner never changes after creation and updatedAt only
 * advances when a message is appended.
 */
public class Conversation {

    public static final int MAX_TITLE_LENGTH = 200;
    public static final String DEFAULT_TITLE = "New Conversation";

    private final String id;
    private final String owner;
    private final String title;
    private final long createdAt;
    private final long updatedAt;

    public Conversation(String id, String owner, String title, long createdAt, long updatedAt) {
        this.id = id;
        this.owner = owner;
        this.title = title;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public String getId() {
        return id;
    }

    public String getOwner() {
        return owner;
    }

    public String getTitle() {
        return title;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "Conversation{" +
            "id='" + id + '\'' +
            ", owner='" + owner + '\'' +
            ", title='" + title + '\'' +
            ", createdAt=" + createdAt +
            ", updatedAt=" + updatedAt +
            '}';
    }
}
