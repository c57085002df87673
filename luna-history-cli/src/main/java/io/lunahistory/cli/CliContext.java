package io.lunahistory.cli;

import io.lunahistory.mcp.server.McpServerApplication;
import java.time.Clock;
import java.util.Map;

public record CliContext(
    Map<String, String> environment,
    Clock clock,
    ServerRunner serverRunner
) {
    public CliContext(Map<String, String> environment, Clock clock) {
        this(environment, clock, config -> {
            try (McpServerApplication application = new McpServerApplication(config, clock)) {
                return application.run();
            }
        });
    }
}
