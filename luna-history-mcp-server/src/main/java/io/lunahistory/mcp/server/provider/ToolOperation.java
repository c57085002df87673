package io.lunahistory.mcp.server.provider;

import io.lunahistory.mcp.server.model.ToolCallResponse;
import java.util.Map;

public record ToolOperation(
    String toolName,
    String description,
    Map<String, Object> inputSchema,
    boolean mutating,
    Handler handler
) {
    @FunctionalInterface
    public interface Handler {
        ToolCallResponse handle(ToolArguments arguments);
    }
}
