package io.lunahistory.cli;

import io.lunahistory.core.query.ConversationQueryService;
import io.lunahistory.core.query.Lookup;
import io.lunahistory.core.query.MemoryQueryService;
import io.lunahistory.core.store.StoreHandle;
import io.lunahistory.mcp.server.config.McpServerConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show the store location and record counts")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--db"}, description = "SQLite database path (overrides " + McpServerConfig.DB_PATH_ENV + ")")
    Path db;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Path dbPath;
        try {
            dbPath = db != null ? db : McpServerConfig.fromEnv(context.environment()).dbPath();
        } catch (RuntimeException e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }

        boolean exists = Files.exists(dbPath);
        System.out.println("Database path: " + dbPath.toAbsolutePath());
        System.out.println("Database exists: " + exists);
        if (!exists) {
            return 0;
        }

        // Opening applies the memory schema, so counts are only read from an existing store.
        try (StoreHandle store = new StoreHandle(dbPath)) {
            System.out.println("Memories: " + describe(new MemoryQueryService(store, context.clock()).countMemories()));
            System.out.println("Conversations: " + describe(new ConversationQueryService(store).countConversations()));
        }
        return 0;
    }

    private static String describe(Lookup<Long> count) {
        return count.isFound() ? String.valueOf(count.value()) : "unavailable (" + count.error() + ")";
    }
}
