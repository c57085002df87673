package io.lunahistory.mcp.server;

import io.lunahistory.mcp.server.model.ToolCallResponse;
import io.lunahistory.mcp.server.model.ToolDefinition;
import io.lunahistory.mcp.server.provider.ToolProvider;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ToolRouter {
    private final Map<String, ToolProvider> providerByTool;
    private final Map<String, ToolDefinition> definitionByTool;

    public ToolRouter(List<ToolProvider> providers) {
        this.providerByTool = new LinkedHashMap<>();
        this.definitionByTool = new LinkedHashMap<>();
        for (ToolProvider provider : providers) {
            for (ToolDefinition definition : provider.tools()) {
                if (providerByTool.putIfAbsent(definition.name(), provider) != null) {
                    throw new IllegalArgumentException("Duplicate tool name: " + definition.name());
                }
                definitionByTool.put(definition.name(), definition);
            }
        }
    }

    /**
     * Tool definitions in registration order.
     */
    public List<ToolDefinition> listTools() {
        return new ArrayList<>(definitionByTool.values());
    }

    public ToolCallResponse callTool(String toolName, Map<String, Object> arguments) {
        ToolProvider provider = providerByTool.get(toolName);
        if (provider == null) {
            return ToolCallResponse.error("Unknown tool: " + toolName);
        }
        return provider.execute(toolName, arguments == null ? Map.of() : arguments);
    }
}
