package io.lunahistory.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lunahistory.mcp.server.model.ToolCallResponse;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Map;

/**
 * Plain HTTP access to the tools, for clients that do not speak MCP over stdio.
 */
public final class McpHttpServer {
    private final Undertow undertow;

    public McpHttpServer(String host, int port, ToolRouter router, ObjectMapper mapper) {
        HttpHandler handler = exchange -> route(exchange, router, mapper);
        this.undertow = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(new BlockingHandler(handler))
            .build();
    }

    public void start() {
        undertow.start();
    }

    public void stop() {
        undertow.stop();
    }

    /**
     * The bound port; differs from the configured one when that was 0.
     */
    public int port() {
        return ((InetSocketAddress) undertow.getListenerInfo().get(0).getAddress()).getPort();
    }

    private void route(HttpServerExchange exchange, ToolRouter router, ObjectMapper mapper) throws Exception {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        if (exchange.getRequestMethod().equalToString("GET") && exchange.getRequestPath().equals("/healthz")) {
            writeJson(exchange, mapper, Map.of("status", "ok"));
            return;
        }

        if (exchange.getRequestMethod().equalToString("GET") && exchange.getRequestPath().equals("/mcp/tools")) {
            writeJson(exchange, mapper, Map.of("tools", router.listTools()));
            return;
        }

        if (exchange.getRequestMethod().equalToString("POST") && exchange.getRequestPath().equals("/mcp/call")) {
            Map<String, Object> request;
            try {
                request = mapper.readValue(exchange.getInputStream(), new TypeReference<>() {});
            } catch (JsonProcessingException e) {
                exchange.setStatusCode(400);
                writeJson(exchange, mapper, ToolCallResponse.error("Malformed request body: " + e.getOriginalMessage()));
                return;
            }
            if (request == null) {
                exchange.setStatusCode(400);
                writeJson(exchange, mapper, ToolCallResponse.error("Malformed request body: expected a JSON object"));
                return;
            }
            String name = String.valueOf(request.getOrDefault("name", ""));
            @SuppressWarnings("unchecked")
            Map<String, Object> args = request.get("arguments") instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
            ToolCallResponse response = router.callTool(name, args);
            int status = response.ok() ? 200 : 400;
            exchange.setStatusCode(status);
            writeJson(exchange, mapper, response);
            return;
        }

        exchange.setStatusCode(404);
        writeJson(exchange, mapper, Map.of("error", "Not found"));
    }

    private void writeJson(HttpServerExchange exchange, ObjectMapper mapper, Object payload) throws IOException {
        exchange.getResponseSender().send(mapper.writeValueAsString(payload));
    }
}
