package io.lunahistory.core.query;

import static org.assertj.core.api.Assertions.assertThat;

import io.lunahistory.core.HistoryFixtures;
import io.lunahistory.core.model.Conversation;
import io.lunahistory.core.model.ConversationSummary;
import io.lunahistory.core.model.Message;
import io.lunahistory.core.model.MessageSearchHit;
import io.lunahistory.core.store.StoreHandle;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConversationQueryServiceTest {

    @TempDir
    Path tempDir;

    private Path db;
    private StoreHandle store;
    private ConversationQueryService service;

    @BeforeEach
    void setUp() {
        db = tempDir.resolve("conversations.db");
        store = new StoreHandle(db);
        service = new ConversationQueryService(store);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void shouldMatchAnyKeywordNewestFirst() throws Exception {
        long rust;
        long async;
        try (HistoryFixtures fixtures = HistoryFixtures.create(db)) {
            fixtures.conversation("c1", "Borrow checker", 1_000).conversation("c2", "Runtimes", 2_000);
            rust = fixtures.message("c1", "user", "how do lifetimes work in rust", 1_100);
            fixtures.message("c1", "assistant", "lifetimes describe how long references live", 1_200);
            async = fixtures.message("c2", "user", "tokio or async-std for async io?", 2_100);
        }

        List<MessageSearchHit> hits = service.searchConversations(List.of("rust", "async"));

        assertThat(hits).extracting(MessageSearchHit::messageId).containsExactly(async, rust);
        assertThat(hits.get(0).conversationId()).isEqualTo("c2");
        assertThat(hits.get(0).role()).isEqualTo("user");
        assertThat(hits.get(1).createdAt()).isEqualTo(1_100);
    }

    @Test
    void shouldTruncatePreviewTo200Characters() throws Exception {
        String longContent = "rust " + "x".repeat(500);
        try (HistoryFixtures fixtures = HistoryFixtures.create(db)) {
            fixtures.conversation("c1", "Long", 1_000);
            fixtures.message("c1", "assistant", longContent, 1_001);
        }

        List<MessageSearchHit> hits = service.searchConversations(List.of("rust"));

        assertThat(hits).hasSize(1);
        assertThat(hits.get(0).contentPreview()).hasSize(200).isEqualTo(longContent.substring(0, 200));
    }

    @Test
    void shouldCapSearchResults() throws Exception {
        try (HistoryFixtures fixtures = HistoryFixtures.create(db)) {
            fixtures.conversation("c1", "Spam", 1_000);
            for (int i = 0; i < 60; i++) {
                fixtures.message("c1", "user", "kotlin question " + i, 1_000 + i);
            }
        }

        assertThat(service.searchConversations(List.of("kotlin"))).hasSize(ConversationQueryService.SEARCH_LIMIT);
    }

    @Test
    void shouldReturnEmptyForBlankKeywordsWithoutOpeningStore() {
        assertThat(service.searchConversations(List.of())).isEmpty();
        assertThat(service.searchConversations(Arrays.asList("", "  ", null))).isEmpty();
        assertThat(db).doesNotExist();
    }

    @Test
    void shouldReturnEmptyWhenHistoryTablesAreMissing() {
        assertThat(service.searchConversations(List.of("rust"))).isEmpty();
        assertThat(service.listConversations(null, null)).isEmpty();
        assertThat(service.getMessage(1).isFailed()).isTrue();
    }

    @Test
    void shouldReturnConversationWithMessagesInOrder() throws Exception {
        try (HistoryFixtures fixtures = HistoryFixtures.create(db)) {
            fixtures.conversation("c1", "Trip planning", 5_000, "travel");
            fixtures.message("c1", "assistant", "second", 5_200);
            fixtures.message("c1", "user", "first", 5_100);
            fixtures.toolMessage("c1", "weather", "{\"city\":\"Oslo\"}", "{\"temp\":3}", 5_300);
        }

        Lookup<Conversation> lookup = service.getConversation("c1");

        assertThat(lookup.isFound()).isTrue();
        Conversation conversation = lookup.value();
        assertThat(conversation.title()).isEqualTo("Trip planning");
        assertThat(conversation.profileName()).isEqualTo("travel");
        assertThat(conversation.titleGenerated()).isEqualTo(1);
        assertThat(conversation.messages()).extracting(Message::content).containsExactly("first", "second", "");
        Message tool = conversation.messages().get(2);
        assertThat(tool.toolName()).isEqualTo("weather");
        assertThat(tool.toolParamsJson()).isEqualTo("{\"city\":\"Oslo\"}");
        assertThat(tool.reasoningContent()).isNull();
    }

    @Test
    void shouldReportMissingConversationAsNotFound() throws Exception {
        try (HistoryFixtures fixtures = HistoryFixtures.create(db)) {
            fixtures.conversation("c1", "Exists", 1_000);
        }

        Lookup<Conversation> lookup = service.getConversation("nope");

        assertThat(lookup.isNotFound()).isTrue();
        assertThat(lookup.value()).isNull();
        assertThat(lookup.error()).isNull();
    }

    @Test
    void shouldSearchTitlesWithMessageCounts() throws Exception {
        try (HistoryFixtures fixtures = HistoryFixtures.create(db)) {
            fixtures.conversation("c1", "Rust async patterns", 1_000)
                .conversation("c2", "Grocery list", 2_000)
                .conversation("c3", "More RUST questions", 3_000);
            fixtures.message("c1", "user", "a", 1_001);
            fixtures.message("c1", "assistant", "b", 1_002);
        }

        List<ConversationSummary> summaries = service.searchConversationTitles("rust");

        assertThat(summaries).extracting(ConversationSummary::id).containsExactly("c3", "c1");
        assertThat(summaries).extracting(ConversationSummary::messageCount).containsExactly(0L, 2L);
    }

    @Test
    void shouldTreatLikeWildcardsLiterally() throws Exception {
        try (HistoryFixtures fixtures = HistoryFixtures.create(db)) {
            fixtures.conversation("c1", "100% done", 1_000).conversation("c2", "1000 done", 2_000);
        }

        assertThat(service.searchConversationTitles("0%")).extracting(ConversationSummary::id).containsExactly("c1");
        assertThat(service.searchConversationTitles("")).hasSize(2);
    }

    @Test
    void shouldPaginateByRecency() throws Exception {
        try (HistoryFixtures fixtures = HistoryFixtures.create(db)) {
            for (int i = 0; i < 5; i++) {
                fixtures.conversation("c" + i, "Conversation " + i, 1_000 + i);
            }
        }

        assertThat(service.listConversations(2, 0)).extracting(ConversationSummary::id).containsExactly("c4", "c3");
        assertThat(service.listConversations(2, 2)).extracting(ConversationSummary::id).containsExactly("c2", "c1");
        assertThat(service.listConversations(null, 4)).extracting(ConversationSummary::id).containsExactly("c0");
        assertThat(service.listConversations(0, 0)).isEmpty();
        assertThat(service.listConversations(-3, -1)).isEmpty();
        assertThat(service.listConversations(10, -1)).hasSize(5);
    }

    @Test
    void shouldClampListLimit() throws Exception {
        try (HistoryFixtures fixtures = HistoryFixtures.create(db)) {
            for (int i = 0; i < 230; i++) {
                fixtures.conversation("c" + i, "Conversation " + i, i);
            }
        }

        assertThat(service.listConversations(1_000, 0)).hasSize(ConversationQueryService.MAX_LIST_LIMIT);
        assertThat(service.listConversations(null, 0)).hasSize(ConversationQueryService.DEFAULT_LIST_LIMIT);
        assertThat(service.listConversations(200, 100)).hasSize(130);
        assertThat(ConversationQueryService.clampLimit(201)).isEqualTo(200);
    }

    @Test
    void shouldLookUpSingleMessage() throws Exception {
        long id;
        try (HistoryFixtures fixtures = HistoryFixtures.create(db)) {
            fixtures.conversation("c1", "One", 1_000);
            id = fixtures.message("c1", "user", "hello there", 1_001);
        }

        assertThat(service.getMessage(id).value().content()).isEqualTo("hello there");
        assertThat(service.getMessage(id + 100).isNotFound()).isTrue();
    }

    @Test
    void shouldCountConversationsOrFailWithoutTables() throws Exception {
        assertThat(service.countConversations().isFailed()).isTrue();

        try (HistoryFixtures fixtures = HistoryFixtures.create(db)) {
            fixtures.conversation("c1", "One", 1_000).conversation("c2", "Two", 2_000);
        }

        assertThat(service.countConversations().value()).isEqualTo(2L);
    }
}
