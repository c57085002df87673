package io.lunahistory.mcp.server.config;

import java.nio.file.Path;
import java.util.Map;

public record McpServerConfig(
    Path dbPath,
    Transport transport,
    String host,
    int port
) {
    public static final String DB_PATH_ENV = "LUNA_HISTORY_DB_PATH";
    public static final String LEGACY_DB_PATH_ENV = "COSMIC_LLM_DB_PATH";
    public static final String TRANSPORT_ENV = "LUNA_HISTORY_TRANSPORT";
    public static final String HOST_ENV = "LUNA_HISTORY_HOST";
    public static final String PORT_ENV = "LUNA_HISTORY_PORT";

    public McpServerConfig {
        if (dbPath == null) {
            throw new IllegalStateException(DB_PATH_ENV + " (or " + LEGACY_DB_PATH_ENV + ") environment variable must be set");
        }
    }

    public static McpServerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * @throws IllegalStateException if no database path is configured
     */
    public static McpServerConfig fromEnv(Map<String, String> env) {
        String dbPath = env(env, DB_PATH_ENV, env(env, LEGACY_DB_PATH_ENV, ""));
        return new McpServerConfig(
            dbPath.isBlank() ? null : Path.of(dbPath),
            Transport.parse(env(env, TRANSPORT_ENV, "stdio")),
            env(env, HOST_ENV, "127.0.0.1"),
            intEnv(env, PORT_ENV, 8791)
        );
    }

    private static String env(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int intEnv(Map<String, String> env, String key, int fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
