package io.lunahistory.mcp.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lunahistory.core.query.ConversationQueryService;
import io.lunahistory.core.query.MemoryQueryService;
import io.lunahistory.core.store.StoreHandle;
import io.lunahistory.mcp.server.config.McpServerConfig;
import io.lunahistory.mcp.server.provider.ConversationToolProvider;
import io.lunahistory.mcp.server.provider.MemoryToolProvider;
import io.lunahistory.mcp.server.provider.ToolProvider;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class McpServerApplication implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(McpServerApplication.class);

    public static final String SERVER_NAME = "luna-history";
    public static final String SERVER_VERSION = "0.1.0";

    private final McpServerConfig config;
    private final StoreHandle store;
    private final ObjectMapper mapper;
    private final ToolRouter router;

    public McpServerApplication(McpServerConfig config, Clock clock) {
        this.config = config;
        this.store = new StoreHandle(config.dbPath());
        this.mapper = new ObjectMapper();

        List<ToolProvider> providers = List.of(
            new ConversationToolProvider(new ConversationQueryService(store), mapper),
            new MemoryToolProvider(new MemoryQueryService(store, clock), mapper)
        );
        logProviders(providers);
        this.router = new ToolRouter(providers);
    }

    public static void main(String[] args) {
        McpServerConfig config;
        try {
            config = McpServerConfig.fromEnv();
        } catch (RuntimeException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }
        int exitCode;
        try (McpServerApplication application = new McpServerApplication(config, Clock.systemUTC())) {
            exitCode = application.run();
        }
        System.exit(exitCode);
    }

    public ToolRouter router() {
        return router;
    }

    /**
     * Serves on the configured transport and blocks until it shuts down.
     *
     * @return process exit code
     */
    public int run() {
        log.info("Luna History serving {} over {}", config.dbPath(), config.transport());
        return switch (config.transport()) {
            case STDIO -> runStdio();
            case HTTP -> runHttp();
        };
    }

    public void serveStdio(BufferedReader in, Writer out) throws IOException {
        new StdioMcpServer(router, mapper, SERVER_NAME, SERVER_VERSION).serve(in, out);
    }

    public McpHttpServer startHttp() {
        McpHttpServer server = new McpHttpServer(config.host(), config.port(), router, mapper);
        server.start();
        log.info("Luna History HTTP server listening on {}:{}", config.host(), server.port());
        return server;
    }

    @Override
    public void close() {
        store.close();
    }

    private int runStdio() {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
        try {
            serveStdio(in, out);
            return 0;
        } catch (IOException e) {
            log.error("stdio transport failed", e);
            return 1;
        }
    }

    private int runHttp() {
        McpHttpServer server = startHttp();
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            store.close();
            stopped.countDown();
        }));
        try {
            stopped.await();
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.stop();
            return 1;
        }
    }

    private static void logProviders(List<ToolProvider> providers) {
        for (ToolProvider provider : providers) {
            log.debug("Provider {} tools={}", provider.name(), provider.tools().size());
        }
    }
}
