package io.lunahistory.cli;

import io.lunahistory.mcp.server.config.McpServerConfig;

@FunctionalInterface
public interface ServerRunner {
    int run(McpServerConfig config) throws Exception;
}
