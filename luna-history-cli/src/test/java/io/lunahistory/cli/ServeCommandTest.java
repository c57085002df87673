package io.lunahistory.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.lunahistory.mcp.server.config.McpServerConfig;
import io.lunahistory.mcp.server.config.Transport;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ServeCommandTest {

    @Test
    void shouldLetOptionsOverrideEnvironment() {
        List<McpServerConfig> started = new ArrayList<>();
        CliContext context = new CliContext(
            Map.of("LUNA_HISTORY_DB_PATH", "/tmp/env.db", "LUNA_HISTORY_PORT", "9000"),
            Clock.systemUTC(),
            config -> {
                started.add(config);
                return 0;
            }
        );

        StatusCommandTest.Captured result = StatusCommandTest.run(
            context, "serve", "--db", "/tmp/cli.db", "--transport", "http"
        );

        assertThat(result.code()).isEqualTo(0);
        assertThat(started).hasSize(1);
        McpServerConfig config = started.get(0);
        assertThat(config.dbPath()).isEqualTo(Path.of("/tmp/cli.db"));
        assertThat(config.transport()).isEqualTo(Transport.HTTP);
        assertThat(config.port()).isEqualTo(9000);
    }

    @Test
    void shouldUseLegacyVariableWhenNoOptionGiven() {
        List<McpServerConfig> started = new ArrayList<>();
        CliContext context = new CliContext(Map.of("COSMIC_LLM_DB_PATH", "/tmp/legacy.db"), Clock.systemUTC(), config -> {
            started.add(config);
            return 0;
        });

        StatusCommandTest.run(context, "serve");

        assertThat(started).extracting(McpServerConfig::dbPath).containsExactly(Path.of("/tmp/legacy.db"));
        assertThat(started.get(0).transport()).isEqualTo(Transport.STDIO);
    }

    @Test
    void shouldExitWithOneWhenMisconfigured() {
        CliContext context = new CliContext(Map.of(), Clock.systemUTC(), config -> 0);

        StatusCommandTest.Captured missingDb = StatusCommandTest.run(context, "serve");
        StatusCommandTest.Captured badTransport = StatusCommandTest.run(context, "serve", "--db", "/tmp/x.db", "--transport", "grpc");

        assertThat(missingDb.code()).isEqualTo(1);
        assertThat(missingDb.err()).contains("must be set");
        assertThat(badTransport.code()).isEqualTo(1);
        assertThat(badTransport.err()).contains("Unknown transport");
    }

    @Test
    void shouldPropagateRunnerExitCode() {
        CliContext context = new CliContext(Map.of("LUNA_HISTORY_DB_PATH", "/tmp/x.db"), Clock.systemUTC(), config -> {
            throw new IllegalStateException("port in use");
        });

        StatusCommandTest.Captured result = StatusCommandTest.run(context, "serve");

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("port in use");
    }
}
