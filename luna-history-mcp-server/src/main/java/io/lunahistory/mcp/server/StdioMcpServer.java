package io.lunahistory.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lunahistory.mcp.server.model.ToolCallResponse;
import io.lunahistory.mcp.server.model.ToolDefinition;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MCP over stdio: one JSON-RPC 2.0 message per line in each direction.
 *
 * <p>Handles {@code initialize}, {@code ping}, {@code tools/list} and {@code tools/call}.
 * Notifications get no reply. {@code initialize} never touches the store.
 */
public final class StdioMcpServer {
    private static final Logger LOG = LoggerFactory.getLogger(StdioMcpServer.class);

    static final String DEFAULT_PROTOCOL_VERSION = "2024-11-05";
    static final int PARSE_ERROR = -32700;
    static final int INVALID_REQUEST = -32600;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final int INTERNAL_ERROR = -32603;

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {
    };

    private static final String INSTRUCTIONS = "MCP server for searching and retrieving past conversations with the user "
        + "and for storing and searching long-term memory notes.";

    private final ToolRouter router;
    private final ObjectMapper mapper;
    private final String serverName;
    private final String serverVersion;

    public StdioMcpServer(ToolRouter router, ObjectMapper mapper, String serverName, String serverVersion) {
        this.router = router;
        this.mapper = mapper;
        this.serverName = serverName;
        this.serverVersion = serverVersion;
    }

    /**
     * Serves requests until {@code in} reaches end of stream.
     */
    public void serve(BufferedReader in, Writer out) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode reply = handleLine(line);
            if (reply != null) {
                out.write(mapper.writeValueAsString(reply));
                out.write("\n");
                out.flush();
            }
        }
        LOG.info("Input closed, stopping stdio server");
    }

    /**
     * @return the reply to write, or {@code null} for notifications
     */
    JsonNode handleLine(String line) {
        JsonNode message;
        try {
            message = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            return error(NullNode.getInstance(), PARSE_ERROR, "Parse error: " + e.getOriginalMessage());
        }
        if (message == null || !message.isObject() || !message.path("method").isTextual()) {
            JsonNode id = message != null && message.has("id") ? message.get("id") : NullNode.getInstance();
            return error(id, INVALID_REQUEST, "Invalid request");
        }

        String method = message.get("method").asText();
        JsonNode params = message.path("params");
        if (!message.has("id")) {
            LOG.debug("Notification {}", method);
            return null;
        }
        JsonNode id = message.get("id");

        try {
            return switch (method) {
                case "initialize" -> result(id, initialize(params));
                case "ping" -> result(id, mapper.createObjectNode());
                case "tools/list" -> result(id, listTools());
                case "tools/call" -> callTool(id, params);
                default -> error(id, METHOD_NOT_FOUND, "Method not found: " + method);
            };
        } catch (RuntimeException e) {
            LOG.error("Request {} failed", method, e);
            return error(id, INTERNAL_ERROR, "Internal error: " + e.getMessage());
        }
    }

    private ObjectNode initialize(JsonNode params) {
        ObjectNode result = mapper.createObjectNode();
        result.put("protocolVersion", params.path("protocolVersion").asText(DEFAULT_PROTOCOL_VERSION));
        result.putObject("capabilities").putObject("tools");
        ObjectNode serverInfo = result.putObject("serverInfo");
        serverInfo.put("name", serverName);
        serverInfo.put("version", serverVersion);
        result.put("instructions", INSTRUCTIONS);
        LOG.info("Client initialized: {}", params.path("clientInfo").path("name").asText("unknown"));
        return result;
    }

    private ObjectNode listTools() {
        ObjectNode result = mapper.createObjectNode();
        ArrayNode tools = result.putArray("tools");
        for (ToolDefinition definition : router.listTools()) {
            ObjectNode tool = tools.addObject();
            tool.put("name", definition.name());
            tool.put("description", definition.description());
            tool.set("inputSchema", mapper.valueToTree(definition.inputSchema()));
            tool.putObject("annotations").put("readOnlyHint", !definition.mutating());
        }
        return result;
    }

    private JsonNode callTool(JsonNode id, JsonNode params) {
        if (!params.path("name").isTextual()) {
            return error(id, INVALID_PARAMS, "tools/call requires a tool name");
        }
        String name = params.get("name").asText();
        JsonNode rawArguments = params.path("arguments");
        Map<String, Object> arguments = rawArguments.isObject() ? mapper.convertValue(rawArguments, ARGUMENTS) : Map.of();

        ToolCallResponse response = router.callTool(name, arguments);
        ObjectNode result = mapper.createObjectNode();
        String text;
        try {
            text = response.ok() ? mapper.writeValueAsString(response.data()) : response.message();
        } catch (JsonProcessingException e) {
            return error(id, INTERNAL_ERROR, "Failed to encode result of " + name);
        }
        result.putArray("content").addObject().put("type", "text").put("text", text);
        result.set("structuredContent", mapper.valueToTree(response.data()));
        result.put("isError", !response.ok());
        return result(id, result);
    }

    private ObjectNode result(JsonNode id, JsonNode result) {
        ObjectNode reply = envelope(id);
        reply.set("result", result);
        return reply;
    }

    private ObjectNode error(JsonNode id, int code, String message) {
        ObjectNode reply = envelope(id);
        ObjectNode error = reply.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return reply;
    }

    private ObjectNode envelope(JsonNode id) {
        ObjectNode reply = mapper.createObjectNode();
        reply.put("jsonrpc", "2.0");
        reply.set("id", id);
        return reply;
    }
}
