package com.taskchat.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskchat.AppLogger;
import com.taskchat.models.Conversation;
import com.taskchat.models.Message;
import com.taskchat.models.MessageRole;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public class SqliteConversationStore implements ConversationStore {

    private static final int MAX_LIST_LIMIT = 200;

    private static final String CONVERSATION_COLUMNS = "id, owner, title, created_at, updated_at";
    private static final String MESSAGE_COLUMNS =
        "id, conversation_id, owner, role, content, tool_calls, seq, created_at";

    private final SqliteDatabase database;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AppLogger logger;

    public SqliteConversationStore(SqliteDatabase database, ObjectMapper objectMapper) {
        this(database, objectMapper, Clock.systemUTC());
    }

    public SqliteConversationStore(SqliteDatabase database, ObjectMapper objectMapper, Clock clock) {
        this.database = Objects.requireNonNull(database, "database");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = AppLogger.get();
    }

    @Override
    public Conversation createConversation(String owner, String title) {
        Ownership.requireOwner(owner);
        String resolvedTitle = title == null || title.isBlank() ? Conversation.DEFAULT_TITLE : title.trim();
        if (resolvedTitle.length() > Conversation.MAX_TITLE_LENGTH) {
            resolvedTitle = resolvedTitle.substring(0, Conversation.MAX_TITLE_LENGTH);
        }
        String id = UUID.randomUUID().toString();
        long now = clock.millis();
        String finalTitle = resolvedTitle;
        database.write(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO conversations (" + CONVERSATION_COLUMNS + ") VALUES (?, ?, ?, ?, ?)")) {
                ps.setString(1, id);
                ps.setString(2, owner);
                ps.setString(3, finalTitle);
                ps.setLong(4, now);
                ps.setLong(5, now);
                ps.executeUpdate();
            }
            return null;
        });
        logger.info("[SqliteConversationStore] Created conversation " + id + " for owner " + owner);
        return new Conversation(id, owner, finalTitle, now, now);
    }

    @Override
    public Optional<Conversation> getConversation(String owner, String conversationId) {
        Ownership.requireOwner(owner);
        if (conversationId == null || conversationId.isBlank()) {
            return Optional.empty();
        }
        return database.read(connection -> Optional.ofNullable(findOwned(connection, owner, conversationId)));
    }

    @Override
    public List<Conversation> listConversations(String owner, int limit) {
        Ownership.requireOwner(owner);
        int bounded = Ownership.clampLimit(limit, MAX_LIST_LIMIT);
        if (bounded == 0) {
            return List.of();
        }
        return database.read(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(
                "SELECT " + CONVERSATION_COLUMNS + " FROM conversations WHERE owner = ?" +
                    " ORDER BY updated_at DESC, rowid DESC LIMIT ?")) {
                ps.setString(1, owner);
                ps.setInt(2, bounded);
                try (ResultSet rs = ps.executeQuery()) {
                    List<Conversation> results = new ArrayList<>();
                    while (rs.next()) {
                        results.add(mapConversation(rs));
                    }
                    return results;
                }
            }
        });
    }

    @Override
    public Message appendMessage(String owner, String conversationId, MessageRole role, String content,
                                 JsonNode toolCalls) {
        Ownership.requireOwner(owner);
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
        if (conversationId == null || conversationId.isBlank()) {
            throw new NotFoundException("Conversation", String.valueOf(conversationId));
        }
        String toolCallsJson = serializeToolCalls(toolCalls);
        String messageId = UUID.randomUUID().toString();

        Message message = database.write(connection -> {
            String conversationOwner = findOwner(connection, conversationId);
            if (conversationOwner == null) {
                throw new NotFoundException("Conversation", conversationId);
            }
            if (!conversationOwner.equals(owner)) {
                throw new ForbiddenException("Conversation belongs to another owner");
            }

            long lastSeq = 0;
            long lastCreatedAt = 0;
            try (PreparedStatement ps = connection.prepareStatement(
                "SELECT COALESCE(MAX(seq), 0), COALESCE(MAX(created_at), 0) FROM messages WHERE conversation_id = ?")) {
                ps.setString(1, conversationId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        lastSeq = rs.getLong(1);
                        lastCreatedAt = rs.getLong(2);
                    }
                }
            }
            long seq = lastSeq + 1;
            // Never earlier than the latest message, even if the wall clock stepped back.
            long createdAt = Math.max(clock.millis(), lastCreatedAt);

            try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO messages (" + MESSAGE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)")) {
                ps.setString(1, messageId);
                ps.setString(2, conversationId);
                ps.setString(3, owner);
                ps.setString(4, role.getValue());
                ps.setString(5, content);
                ps.setString(6, toolCallsJson);
                ps.setLong(7, seq);
                ps.setLong(8, createdAt);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = connection.prepareStatement(
                "UPDATE conversations SET updated_at = MAX(updated_at + 1, ?) WHERE id = ? AND owner = ?")) {
                ps.setLong(1, createdAt);
                ps.setString(2, conversationId);
                ps.setString(3, owner);
                ps.executeUpdate();
            }
            return new Message(messageId, conversationId, owner, role, content, toolCalls, seq, createdAt);
        });
        logger.info("[SqliteConversationStore] Appended " + role.getValue() + " message #" + message.getSeq()
            + " to conversation " + conversationId);
        return message;
    }

    @Override
    public List<Message> listRecentMessages(String owner, String conversationId, int limit) {
        Ownership.requireOwner(owner);
        if (conversationId == null || conversationId.isBlank()) {
            throw new NotFoundException("Conversation", String.valueOf(conversationId));
        }
        int bounded = Ownership.clampLimit(limit, MAX_LIST_LIMIT);
        return database.read(connection -> {
            if (findOwned(connection, owner, conversationId) == null) {
                throw new NotFoundException("Conversation", conversationId);
            }
            if (bounded == 0) {
                return List.<Message>of();
            }
            try (PreparedStatement ps = connection.prepareStatement(
                "SELECT " + MESSAGE_COLUMNS + " FROM messages WHERE conversation_id = ? AND owner = ?" +
                    " ORDER BY created_at DESC, seq DESC LIMIT ?")) {
                ps.setString(1, conversationId);
                ps.setString(2, owner);
                ps.setInt(3, bounded);
                try (ResultSet rs = ps.executeQuery()) {
                    List<Message> newestFirst = new ArrayList<>();
                    while (rs.next()) {
                        newestFirst.add(mapMessage(rs));
                    }
                    Collections.reverse(newestFirst);
                    return Collections.unmodifiableList(newestFirst);
                }
            }
        });
    }

    private Conversation findOwned(Connection connection, String owner, String conversationId) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
            "SELECT " + CONVERSATION_COLUMNS + " FROM conversations WHERE id = ? AND owner = ?")) {
            ps.setString(1, conversationId);
            ps.setString(2, owner);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapConversation(rs) : null;
            }
        }
    }

    private String findOwner(Connection connection, String conversationId) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement("SELECT owner FROM conversations WHERE id = ?")) {
            ps.setString(1, conversationId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private Conversation mapConversation(ResultSet rs) throws SQLException {
        return new Conversation(
            rs.getString("id"),
            rs.getString("owner"),
            rs.getString("title"),
            rs.getLong("created_at"),
            rs.getLong("updated_at")
        );
    }

    private Message mapMessage(ResultSet rs) throws SQLException {
        return new Message(
            rs.getString("id"),
            rs.getString("conversation_id"),
            rs.getString("owner"),
            MessageRole.fromValue(rs.getString("role")),
            rs.getString("content"),
            parseToolCalls(rs.getString("tool_calls")),
            rs.getLong("seq"),
            rs.getLong("created_at")
        );
    }

    private String serializeToolCalls(JsonNode toolCalls) {
        if (toolCalls == null || toolCalls.isNull() || toolCalls.isMissingNode()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(toolCalls);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot serialize tool call record", e);
        }
    }

    private JsonNode parseToolCalls(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StoreException("Stored tool call record is not valid JSON", e);
        }
    }
}
