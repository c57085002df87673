package io.lunahistory.mcp.server.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lunahistory.mcp.server.model.ToolCallResponse;
import io.lunahistory.mcp.server.model.ToolDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for providers whose tools are a fixed table of {@link ToolOperation}s, registered by the
 * subclass constructor.
 */
public abstract class AbstractToolProvider implements ToolProvider {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractToolProvider.class);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final Map<String, ToolOperation> operations = new LinkedHashMap<>();

    protected AbstractToolProvider(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    protected void register(ToolOperation operation) {
        operations.put(operation.toolName(), operation);
    }

    @Override
    public List<ToolDefinition> tools() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolOperation operation : operations.values()) {
            definitions.add(new ToolDefinition(
                operation.toolName(),
                operation.description(),
                operation.inputSchema(),
                name(),
                operation.mutating()
            ));
        }
        return definitions;
    }

    @Override
    public ToolCallResponse execute(String toolName, Map<String, Object> arguments) {
        ToolOperation operation = operations.get(toolName);
        if (operation == null) {
            return ToolCallResponse.error("Unknown tool: " + toolName);
        }
        try {
            return operation.handler().handle(new ToolArguments(arguments));
        } catch (IllegalArgumentException e) {
            return ToolCallResponse.error("Invalid arguments for " + toolName + ": " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Tool {} failed", toolName, e);
            return ToolCallResponse.error("Tool " + toolName + " failed: " + e.getMessage());
        }
    }

    protected Map<String, Object> toJson(Object value) {
        return mapper.convertValue(value, JSON_OBJECT);
    }

    protected List<Map<String, Object>> toJsonList(List<?> values) {
        List<Map<String, Object>> out = new ArrayList<>(values.size());
        for (Object value : values) {
            out.add(toJson(value));
        }
        return out;
    }

    protected ToolCallResponse items(String message, List<?> values) {
        return ToolCallResponse.ok(message, Map.of("items", toJsonList(values)));
    }
}
