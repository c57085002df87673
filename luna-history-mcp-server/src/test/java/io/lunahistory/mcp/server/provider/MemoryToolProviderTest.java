package io.lunahistory.mcp.server.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lunahistory.core.query.MemoryQueryService;
import io.lunahistory.core.store.StoreHandle;
import io.lunahistory.mcp.server.model.ToolCallResponse;
import io.lunahistory.mcp.server.model.ToolDefinition;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MemoryToolProviderTest {
    private static final Instant NOW = Instant.parse("2026-05-10T08:30:00Z");

    @TempDir
    Path tempDir;

    private StoreHandle store;
    private MemoryToolProvider provider;

    @BeforeEach
    void setUp() {
        store = new StoreHandle(tempDir.resolve("memory.db"));
        provider = new MemoryToolProvider(
            new MemoryQueryService(store, Clock.fixed(NOW, ZoneOffset.UTC)),
            new ObjectMapper()
        );
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void shouldExposeMemoryTools() {
        assertThat(provider.tools()).extracting(ToolDefinition::name).containsExactly(
            "store_memory", "search_memory", "search_memory_by_category", "get_memory", "delete_memory"
        );
        assertThat(provider.tools()).filteredOn(ToolDefinition::mutating)
            .extracting(ToolDefinition::name)
            .containsExactly("store_memory", "delete_memory");
        assertThat(provider.supports("search_memory")).isTrue();
    }

    @Test
    void shouldStoreWithSnakeCaseFields() {
        ToolCallResponse response = provider.execute(
            "store_memory",
            Map.of("content", "user prefers dark mode", "category", "preferences", "importance", 8)
        );

        assertThat(response.ok()).isTrue();
        assertThat(response.message()).startsWith("Memory stored (id: ");
        assertThat(response.data())
            .containsEntry("content", "user prefers dark mode")
            .containsEntry("category", "preferences")
            .containsEntry("importance", 8);
        assertThat(((Number) response.data().get("created_at")).longValue()).isEqualTo(NOW.getEpochSecond());
        assertThat(((Number) response.data().get("id")).longValue()).isPositive();
    }

    @Test
    void shouldRankCategoryByImportance() {
        provider.execute("store_memory", Map.of("content", "uses tabs", "category", "preferences", "importance", 3));
        provider.execute("store_memory", Map.of("content", "user prefers dark mode", "category", "preferences", "importance", 8));

        ToolCallResponse response = provider.execute("search_memory_by_category", Map.of("category", "preferences"));

        assertThat(items(response)).extracting(item -> item.get("content"))
            .containsExactly("user prefers dark mode", "uses tabs");
    }

    @Test
    void shouldAcceptSingleStringKeywords() {
        provider.execute("store_memory", Map.of("content", "moltbook security review is due friday"));

        ToolCallResponse asList = provider.execute("search_memory", Map.of("keywords", List.of("moltbook", "nothing")));
        ToolCallResponse asString = provider.execute("search_memory", Map.of("keywords", "moltbook security info"));

        assertThat(items(asList)).hasSize(1);
        assertThat(items(asString)).hasSize(1);
    }

    @Test
    void shouldReturnEmptyItemsForBlankKeywords() {
        ToolCallResponse response = provider.execute("search_memory", Map.of("keywords", List.of("", " ")));

        assertThat(response.ok()).isTrue();
        assertThat(items(response)).isEmpty();
    }

    @Test
    void shouldTellNotFoundApartOnDelete() {
        ToolCallResponse stored = provider.execute("store_memory", Map.of("content", "temporary"));
        Object id = stored.data().get("id");

        ToolCallResponse deleted = provider.execute("delete_memory", Map.of("memory_id", id));
        ToolCallResponse again = provider.execute("delete_memory", Map.of("memory_id", id));
        ToolCallResponse lookup = provider.execute("get_memory", Map.of("memory_id", id));

        assertThat(deleted.ok()).isTrue();
        assertThat(deleted.data()).containsEntry("success", true).containsEntry("not_found", false);
        assertThat(again.ok()).isTrue();
        assertThat(again.data()).containsEntry("success", false).containsEntry("not_found", true);
        assertThat(again.message()).contains("not found");
        assertThat(lookup.data()).containsEntry("found", false);
    }

    @Test
    void shouldRejectInvalidArguments() {
        ToolCallResponse missingContent = provider.execute("store_memory", Map.of("category", "x"));
        ToolCallResponse blankContent = provider.execute("store_memory", Map.of("content", "  "));
        ToolCallResponse badId = provider.execute("delete_memory", Map.of("memory_id", "abc"));
        ToolCallResponse missingKeywords = provider.execute("search_memory", Map.of());

        assertThat(missingContent.ok()).isFalse();
        assertThat(missingContent.message()).contains("content is required");
        assertThat(blankContent.ok()).isFalse();
        assertThat(badId.ok()).isFalse();
        assertThat(badId.message()).contains("memory_id must be an integer");
        assertThat(missingKeywords.ok()).isFalse();
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> items(ToolCallResponse response) {
        return (List<Map<String, Object>>) response.data().get("items");
    }
}
