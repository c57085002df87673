package io.lunahistory.mcp.server.provider;

import static io.lunahistory.mcp.server.provider.InputSchemas.integer;
import static io.lunahistory.mcp.server.provider.InputSchemas.object;
import static io.lunahistory.mcp.server.provider.InputSchemas.string;
import static io.lunahistory.mcp.server.provider.InputSchemas.stringArray;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lunahistory.core.model.DeleteMemoryResult;
import io.lunahistory.core.model.MemoryEntry;
import io.lunahistory.core.query.Lookup;
import io.lunahistory.core.query.MemoryQueryService;
import io.lunahistory.mcp.server.model.ToolCallResponse;
import java.util.List;
import java.util.Map;

/**
 * Long-term memory tools. Entries are immutable; to change one, delete it and store a new one.
 */
public final class MemoryToolProvider extends AbstractToolProvider {
    private final MemoryQueryService memory;

    public MemoryToolProvider(MemoryQueryService memory, ObjectMapper mapper) {
        super(mapper);
        this.memory = memory;

        register(new ToolOperation(
            "store_memory",
            "Store a fact or piece of information to remember across conversations.",
            object(
                Map.of(
                    "content", string("The fact or information to remember"),
                    "category", string("A tag for grouping (e.g., 'workflow', 'crate-info')"),
                    "importance", integer("Priority score 1-10 (default: 5)")
                ),
                List.of("content")
            ),
            true,
            this::storeMemory
        ));
        register(new ToolOperation(
            "search_memory",
            "Full-text search over stored memories. Matches entries containing any of the keywords, best match first.",
            object(
                Map.of("keywords", stringArray("Keywords to search in memory (OR semantics)")),
                List.of("keywords")
            ),
            false,
            this::searchMemory
        ));
        register(new ToolOperation(
            "search_memory_by_category",
            "List memories of one category, most important first.",
            object(
                Map.of("category", string("Category to filter memory entries (e.g. 'work', 'personal')")),
                List.of("category")
            ),
            false,
            this::searchByCategory
        ));
        register(new ToolOperation(
            "get_memory",
            "Retrieve a single memory entry by id. Reports found=false if the id does not exist.",
            object(
                Map.of("memory_id", integer("The ID of the memory entry to retrieve")),
                List.of("memory_id")
            ),
            false,
            this::getMemory
        ));
        register(new ToolOperation(
            "delete_memory",
            "Remove a memory entry by id. To update an entry, delete it and store the new version.",
            object(
                Map.of("memory_id", integer("The ID of the memory entry to remove")),
                List.of("memory_id")
            ),
            true,
            this::deleteMemory
        ));
    }

    @Override
    public String name() {
        return "memory";
    }

    private ToolCallResponse storeMemory(ToolArguments arguments) {
        Lookup<MemoryEntry> stored = memory.storeMemory(
            arguments.requiredString("content"),
            arguments.optionalString("category"),
            arguments.optionalInt("importance")
        );
        if (!stored.isFound()) {
            return ToolCallResponse.error("Failed to store memory: " + stored.error());
        }
        return ToolCallResponse.ok("Memory stored (id: " + stored.value().id() + ")", toJson(stored.value()));
    }

    private ToolCallResponse searchMemory(ToolArguments arguments) {
        List<MemoryEntry> entries = memory.searchMemory(arguments.keywords("keywords"));
        return items("Found " + entries.size() + " memories", entries);
    }

    private ToolCallResponse searchByCategory(ToolArguments arguments) {
        List<MemoryEntry> entries = memory.searchMemoryByCategory(arguments.requiredString("category"));
        return items("Found " + entries.size() + " memories", entries);
    }

    private ToolCallResponse getMemory(ToolArguments arguments) {
        long memoryId = arguments.requiredLong("memory_id");
        Lookup<MemoryEntry> lookup = memory.getMemory(memoryId);
        return switch (lookup.status()) {
            case FOUND -> ToolCallResponse.ok(
                "Memory " + memoryId,
                Map.of("found", true, "memory", toJson(lookup.value()))
            );
            case NOT_FOUND -> ToolCallResponse.ok(
                "Memory not found: " + memoryId,
                Map.of("found", false, "memory_id", memoryId)
            );
            case FAILED -> ToolCallResponse.error(lookup.error());
        };
    }

    private ToolCallResponse deleteMemory(ToolArguments arguments) {
        long memoryId = arguments.requiredLong("memory_id");
        DeleteMemoryResult result = memory.deleteMemory(memoryId);
        if (result.success()) {
            return ToolCallResponse.ok("Memory removed: " + memoryId, toJson(result));
        }
        if (result.notFound()) {
            return ToolCallResponse.ok("Memory not found: " + memoryId, toJson(result));
        }
        return ToolCallResponse.error("Failed to delete memory " + memoryId + ": " + result.error(), toJson(result));
    }
}
