package io.lunahistory.cli;

import io.lunahistory.mcp.server.config.McpServerConfig;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Serve the history and memory tools over stdio or HTTP")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--db"}, description = "SQLite database path (overrides " + McpServerConfig.DB_PATH_ENV + ")")
    Path db;

    @Option(names = {"--transport"}, description = "stdio or http")
    String transport;

    @Option(names = {"--port"}, description = "HTTP port")
    Integer port;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        McpServerConfig config;
        try {
            config = McpServerConfig.fromEnv(withOverrides());
        } catch (IllegalStateException | IllegalArgumentException e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
        try {
            return context.serverRunner().run(config);
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }

    private Map<String, String> withOverrides() {
        Map<String, String> env = new HashMap<>(context.environment());
        if (db != null) {
            env.put(McpServerConfig.DB_PATH_ENV, db.toString());
        }
        if (transport != null) {
            env.put(McpServerConfig.TRANSPORT_ENV, transport);
        }
        if (port != null) {
            env.put(McpServerConfig.PORT_ENV, String.valueOf(port));
        }
        return env;
    }
}
