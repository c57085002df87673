package io.lunahistory.core.query;

import io.lunahistory.core.model.DeleteMemoryResult;
import io.lunahistory.core.model.MemoryEntry;
import io.lunahistory.core.store.StoreHandle;
import java.io.IOException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores, searches and removes memory notes. Entries are never updated in place; callers
 * replace an entry by deleting it and storing a new one.
 */
public final class MemoryQueryService {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryQueryService.class);

    public static final int SEARCH_LIMIT = 10;
    public static final int CATEGORY_LIMIT = 50;

    private static final String MEMORY_COLUMNS = "m.id, m.content, m.category, m.importance, m.created_at";

    private final StoreHandle store;
    private final Clock clock;

    public MemoryQueryService(StoreHandle store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Inserts a new entry. The insert trigger adds it to the full-text index.
     *
     * @param importance {@code null} means {@value MemoryEntry#DEFAULT_IMPORTANCE}; values outside
     *                   1..10 are clamped
     * @throws IllegalArgumentException if {@code content} is blank
     */
    public Lookup<MemoryEntry> storeMemory(String content, String category, Integer importance) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        String normalizedCategory = category == null || category.isBlank() ? null : category.trim();
        int normalizedImportance = clampImportance(importance);
        long createdAt = clock.instant().getEpochSecond();

        String sql = "INSERT INTO memory (content, category, importance, created_at) VALUES (?, ?, ?, ?)";
        try {
            long id = store.withStore("store memory", connection -> {
                try (PreparedStatement statement = connection.prepareStatement(sql)) {
                    statement.setString(1, content);
                    if (normalizedCategory == null) {
                        statement.setNull(2, Types.VARCHAR);
                    } else {
                        statement.setString(2, normalizedCategory);
                    }
                    statement.setInt(3, normalizedImportance);
                    statement.setLong(4, createdAt);
                    statement.executeUpdate();
                }
                try (Statement statement = connection.createStatement();
                     ResultSet rs = statement.executeQuery("SELECT last_insert_rowid()")) {
                    rs.next();
                    return rs.getLong(1);
                }
            });
            LOG.debug("Stored memory {} in category {}", id, normalizedCategory);
            return Lookup.found(new MemoryEntry(id, content, normalizedCategory, normalizedImportance, createdAt));
        } catch (IOException e) {
            LOG.warn("Storing memory failed: {}", e.getMessage());
            return Lookup.failed(e.getMessage());
        }
    }

    /**
     * Full-text search over memory content, best bm25 match first.
     */
    public List<MemoryEntry> searchMemory(List<String> keywords) {
        Optional<String> match = FullTextQuery.anyOf(keywords);
        if (match.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT " + MEMORY_COLUMNS + """

            FROM memory_fts
            JOIN memory m ON m.id = memory_fts.rowid
            WHERE memory_fts MATCH ?
            ORDER BY bm25(memory_fts)
            LIMIT ?
            """;
        try {
            return store.withStore("search memory", connection -> {
                try (PreparedStatement statement = connection.prepareStatement(sql)) {
                    statement.setString(1, match.get());
                    statement.setInt(2, SEARCH_LIMIT);
                    return readEntries(statement);
                }
            });
        } catch (IOException e) {
            LOG.warn("Memory search failed: {}", e.getMessage());
            return List.of();
        }
    }

    public List<MemoryEntry> searchMemoryByCategory(String category) {
        if (category == null || category.isBlank()) {
            return List.of();
        }
        String sql = "SELECT " + MEMORY_COLUMNS + """

            FROM memory m
            WHERE m.category = ?
            ORDER BY m.importance DESC, m.created_at DESC, m.id DESC
            LIMIT ?
            """;
        try {
            return store.withStore("search memory by category", connection -> {
                try (PreparedStatement statement = connection.prepareStatement(sql)) {
                    statement.setString(1, category.trim());
                    statement.setInt(2, CATEGORY_LIMIT);
                    return readEntries(statement);
                }
            });
        } catch (IOException e) {
            LOG.warn("Memory category search for '{}' failed: {}", category, e.getMessage());
            return List.of();
        }
    }

    public Lookup<MemoryEntry> getMemory(long memoryId) {
        String sql = "SELECT " + MEMORY_COLUMNS + " FROM memory m WHERE m.id = ?";
        try {
            return store.withStore("get memory", connection -> {
                try (PreparedStatement statement = connection.prepareStatement(sql)) {
                    statement.setLong(1, memoryId);
                    List<MemoryEntry> entries = readEntries(statement);
                    return entries.isEmpty() ? Lookup.<MemoryEntry>notFound() : Lookup.found(entries.get(0));
                }
            });
        } catch (IOException e) {
            LOG.warn("Lookup of memory {} failed: {}", memoryId, e.getMessage());
            return Lookup.failed(e.getMessage());
        }
    }

    /**
     * Removes an entry. The delete trigger drops it from the full-text index.
     */
    public DeleteMemoryResult deleteMemory(long memoryId) {
        try {
            int deleted = store.withStore("delete memory", connection -> {
                try (PreparedStatement statement = connection.prepareStatement("DELETE FROM memory WHERE id = ?")) {
                    statement.setLong(1, memoryId);
                    return statement.executeUpdate();
                }
            });
            if (deleted == 0) {
                return DeleteMemoryResult.missing(memoryId);
            }
            LOG.debug("Deleted memory {}", memoryId);
            return DeleteMemoryResult.deleted();
        } catch (IOException e) {
            LOG.warn("Deleting memory {} failed: {}", memoryId, e.getMessage());
            return DeleteMemoryResult.failed(e.getMessage());
        }
    }

    public Lookup<Long> countMemories() {
        try {
            return store.withStore("count memories", connection -> {
                try (PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM memory");
                     ResultSet rs = statement.executeQuery()) {
                    return Lookup.found(rs.next() ? rs.getLong(1) : 0L);
                }
            });
        } catch (IOException e) {
            return Lookup.failed(e.getMessage());
        }
    }

    static int clampImportance(Integer importance) {
        if (importance == null) {
            return MemoryEntry.DEFAULT_IMPORTANCE;
        }
        return Math.max(MemoryEntry.MIN_IMPORTANCE, Math.min(importance, MemoryEntry.MAX_IMPORTANCE));
    }

    private List<MemoryEntry> readEntries(PreparedStatement statement) throws SQLException {
        try (ResultSet rs = statement.executeQuery()) {
            List<MemoryEntry> entries = new ArrayList<>();
            while (rs.next()) {
                int importance = rs.getInt("importance");
                if (rs.wasNull()) {
                    importance = MemoryEntry.DEFAULT_IMPORTANCE;
                }
                entries.add(new MemoryEntry(
                    rs.getLong("id"),
                    rs.getString("content"),
                    rs.getString("category"),
                    importance,
                    rs.getLong("created_at")
                ));
            }
            return entries;
        }
    }
}
