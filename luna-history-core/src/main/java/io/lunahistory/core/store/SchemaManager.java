package io.lunahistory.core.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the memory table, its FTS5 shadow index and the triggers that keep the two in step.
 * Every statement is guarded by {@code IF NOT EXISTS}, so running it against an initialized
 * store only rebuilds the index.
 *
 * <p>The {@code conversations}, {@code messages} and {@code messages_fts} tables belong to the
 * chat application that writes the history and are never created here.
 */
public final class SchemaManager {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaManager.class);

    private static final List<Step> STEPS = List.of(
        new Step("create memory table", """
            CREATE TABLE IF NOT EXISTS memory (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                content TEXT NOT NULL,
                category TEXT,
                importance INTEGER DEFAULT 5,
                created_at INTEGER
            )
            """),
        new Step("create memory_fts virtual table", """
            CREATE VIRTUAL TABLE IF NOT EXISTS memory_fts USING fts5(
                content,
                content='memory',
                content_rowid='id'
            )
            """),
        new Step("create memory_ai trigger", """
            CREATE TRIGGER IF NOT EXISTS memory_ai AFTER INSERT ON memory BEGIN
                INSERT INTO memory_fts(rowid, content) VALUES (new.id, new.content);
            END
            """),
        new Step("create memory_ad trigger", """
            CREATE TRIGGER IF NOT EXISTS memory_ad AFTER DELETE ON memory BEGIN
                INSERT INTO memory_fts(memory_fts, rowid, content) VALUES ('delete', old.id, old.content);
            END
            """),
        // rows written before the triggers existed are only indexed by a rebuild
        new Step("rebuild memory_fts index", "INSERT INTO memory_fts(memory_fts) VALUES ('rebuild')")
    );

    public void ensureSchema(Connection connection) throws StoreSetupException {
        for (Step step : STEPS) {
            try (Statement statement = connection.createStatement()) {
                statement.execute(step.sql());
            } catch (SQLException e) {
                throw new StoreSetupException(step.name(), e);
            }
            LOG.debug("Schema step done: {}", step.name());
        }
    }

    private record Step(String name, String sql) {
    }
}
