package io.lunahistory.core.query;

import io.lunahistory.core.model.Conversation;
import io.lunahistory.core.model.ConversationSummary;
import io.lunahistory.core.model.Message;
import io.lunahistory.core.model.MessageSearchHit;
import io.lunahistory.core.store.StoreHandle;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only queries over the archived conversations written by the chat application.
 */
public final class ConversationQueryService {
    private static final Logger LOG = LoggerFactory.getLogger(ConversationQueryService.class);

    public static final int SEARCH_LIMIT = 50;
    public static final int PREVIEW_LENGTH = 200;
    public static final int TITLE_SEARCH_LIMIT = 100;
    public static final int DEFAULT_LIST_LIMIT = 50;
    public static final int MAX_LIST_LIMIT = 200;

    private static final String MESSAGE_COLUMNS = """
        id, conversation_id, role, content, created_at,
        tool_calls, tool_call_id, tool_name, tool_status,
        tool_params_json, tool_result_json, reasoning_content
        """;

    private static final String SUMMARY_SELECT = """
        SELECT
            c.id,
            c.title,
            c.created_at,
            c.title_generated,
            c.profile_name,
            COUNT(m.id) AS message_count
        FROM conversations c
        LEFT JOIN messages m ON c.id = m.conversation_id
        """;

    private static final String SUMMARY_GROUP = """
        GROUP BY c.id, c.title, c.created_at, c.title_generated, c.profile_name
        ORDER BY c.created_at DESC
        """;

    private final StoreHandle store;

    public ConversationQueryService(StoreHandle store) {
        this.store = store;
    }

    public List<MessageSearchHit> searchConversations(List<String> keywords) {
        Optional<String> match = FullTextQuery.anyOf(keywords);
        if (match.isEmpty()) {
            return List.of();
        }
        String sql = """
            SELECT DISTINCT
                m.id,
                m.conversation_id,
                m.role,
                substr(m.content, 1, %d) AS content_preview,
                m.created_at
            FROM messages m
            JOIN messages_fts ON m.id = messages_fts.rowid
            WHERE messages_fts MATCH ?
            ORDER BY m.created_at DESC, m.id DESC
            LIMIT %d
            """.formatted(PREVIEW_LENGTH, SEARCH_LIMIT);
        try {
            return store.withStore("search conversations", connection -> {
                try (PreparedStatement statement = connection.prepareStatement(sql)) {
                    statement.setString(1, match.get());
                    try (ResultSet rs = statement.executeQuery()) {
                        List<MessageSearchHit> hits = new ArrayList<>();
                        while (rs.next()) {
                            hits.add(new MessageSearchHit(
                                rs.getString("conversation_id"),
                                rs.getLong("id"),
                                rs.getString("role"),
                                rs.getString("content_preview"),
                                rs.getLong("created_at")
                            ));
                        }
                        return hits;
                    }
                }
            });
        } catch (IOException e) {
            LOG.warn("Conversation search failed: {}", e.getMessage());
            return List.of();
        }
    }

    public Lookup<Conversation> getConversation(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            return Lookup.notFound();
        }
        try {
            return store.withStore("get conversation", connection -> {
                Conversation conversation = findConversation(connection, conversationId);
                if (conversation == null) {
                    return Lookup.<Conversation>notFound();
                }
                return Lookup.found(conversation.withMessages(messagesOf(connection, conversationId)));
            });
        } catch (IOException e) {
            LOG.warn("Lookup of conversation {} failed: {}", conversationId, e.getMessage());
            return Lookup.failed(e.getMessage());
        }
    }

    public List<ConversationSummary> searchConversationTitles(String query) {
        String pattern = "%" + escapeLike(query == null ? "" : query) + "%";
        String sql = SUMMARY_SELECT + "WHERE c.title LIKE ? ESCAPE '\\'\n" + SUMMARY_GROUP + "LIMIT " + TITLE_SEARCH_LIMIT;
        try {
            return store.withStore("search conversation titles", connection -> {
                try (PreparedStatement statement = connection.prepareStatement(sql)) {
                    statement.setString(1, pattern);
                    return readSummaries(statement);
                }
            });
        } catch (IOException e) {
            LOG.warn("Conversation title search failed: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Lists conversations newest first.
     *
     * @param limit page size; {@code null} means {@value #DEFAULT_LIST_LIMIT}, larger values are
     *              cut to {@value #MAX_LIST_LIMIT} and negative ones to zero
     * @param offset rows to skip; {@code null} or negative means none
     */
    public List<ConversationSummary> listConversations(Integer limit, Integer offset) {
        int pageSize = clampLimit(limit);
        int skip = offset == null ? 0 : Math.max(0, offset);
        if (pageSize == 0) {
            return List.of();
        }
        String sql = SUMMARY_SELECT + SUMMARY_GROUP + "LIMIT ? OFFSET ?";
        try {
            return store.withStore("list conversations", connection -> {
                try (PreparedStatement statement = connection.prepareStatement(sql)) {
                    statement.setInt(1, pageSize);
                    statement.setInt(2, skip);
                    return readSummaries(statement);
                }
            });
        } catch (IOException e) {
            LOG.warn("Listing conversations failed: {}", e.getMessage());
            return List.of();
        }
    }

    public Lookup<Message> getMessage(long messageId) {
        String sql = "SELECT " + MESSAGE_COLUMNS + "FROM messages WHERE id = ?";
        try {
            return store.withStore("get message", connection -> {
                try (PreparedStatement statement = connection.prepareStatement(sql)) {
                    statement.setLong(1, messageId);
                    try (ResultSet rs = statement.executeQuery()) {
                        return rs.next() ? Lookup.found(readMessage(rs)) : Lookup.<Message>notFound();
                    }
                }
            });
        } catch (IOException e) {
            LOG.warn("Lookup of message {} failed: {}", messageId, e.getMessage());
            return Lookup.failed(e.getMessage());
        }
    }

    public Lookup<Long> countConversations() {
        try {
            return store.withStore("count conversations", connection -> {
                try (PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM conversations");
                     ResultSet rs = statement.executeQuery()) {
                    return Lookup.found(rs.next() ? rs.getLong(1) : 0L);
                }
            });
        } catch (IOException e) {
            return Lookup.failed(e.getMessage());
        }
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIST_LIMIT;
        }
        return Math.max(0, Math.min(limit, MAX_LIST_LIMIT));
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private Conversation findConversation(Connection connection, String conversationId) throws SQLException {
        String sql = "SELECT id, title, created_at, title_generated, profile_name FROM conversations WHERE id = ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, conversationId);
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new Conversation(
                    rs.getString("id"),
                    safe(rs.getString("title")),
                    rs.getLong("created_at"),
                    rs.getInt("title_generated"),
                    rs.getString("profile_name"),
                    List.of()
                );
            }
        }
    }

    private List<Message> messagesOf(Connection connection, String conversationId) throws SQLException {
        String sql = "SELECT " + MESSAGE_COLUMNS + "FROM messages WHERE conversation_id = ? ORDER BY created_at ASC, id ASC";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, conversationId);
            try (ResultSet rs = statement.executeQuery()) {
                List<Message> messages = new ArrayList<>();
                while (rs.next()) {
                    messages.add(readMessage(rs));
                }
                return messages;
            }
        }
    }

    private List<ConversationSummary> readSummaries(PreparedStatement statement) throws SQLException {
        try (ResultSet rs = statement.executeQuery()) {
            List<ConversationSummary> summaries = new ArrayList<>();
            while (rs.next()) {
                summaries.add(new ConversationSummary(
                    rs.getString("id"),
                    safe(rs.getString("title")),
                    rs.getLong("created_at"),
                    rs.getInt("title_generated"),
                    rs.getString("profile_name"),
                    rs.getLong("message_count")
                ));
            }
            return summaries;
        }
    }

    private Message readMessage(ResultSet rs) throws SQLException {
        return new Message(
            rs.getLong("id"),
            rs.getString("conversation_id"),
            safe(rs.getString("role")),
            safe(rs.getString("content")),
            rs.getLong("created_at"),
            rs.getString("tool_calls"),
            rs.getString("tool_call_id"),
            rs.getString("tool_name"),
            rs.getString("tool_status"),
            rs.getString("tool_params_json"),
            rs.getString("tool_result_json"),
            rs.getString("reasoning_content")
        );
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
