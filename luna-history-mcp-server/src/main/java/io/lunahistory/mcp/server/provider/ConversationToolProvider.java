package io.lunahistory.mcp.server.provider;

import static io.lunahistory.mcp.server.provider.InputSchemas.integer;
import static io.lunahistory.mcp.server.provider.InputSchemas.object;
import static io.lunahistory.mcp.server.provider.InputSchemas.string;
import static io.lunahistory.mcp.server.provider.InputSchemas.stringArray;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lunahistory.core.model.Conversation;
import io.lunahistory.core.model.ConversationSummary;
import io.lunahistory.core.model.Message;
import io.lunahistory.core.model.MessageSearchHit;
import io.lunahistory.core.query.ConversationQueryService;
import io.lunahistory.core.query.Lookup;
import io.lunahistory.mcp.server.model.ToolCallResponse;
import java.util.List;
import java.util.Map;

/**
 * Read-only tools over the archived conversation history.
 */
public final class ConversationToolProvider extends AbstractToolProvider {
    private final ConversationQueryService conversations;

    public ConversationToolProvider(ConversationQueryService conversations, ObjectMapper mapper) {
        super(mapper);
        this.conversations = conversations;

        register(new ToolOperation(
            "search_conversations",
            "Search across all past conversations with the user using full-text search. "
                + "Matches messages containing any of the keywords, newest first.",
            object(
                Map.of("keywords", stringArray("Keywords to search in conversation messages (OR semantics)")),
                List.of("keywords")
            ),
            false,
            this::searchConversations
        ));
        register(new ToolOperation(
            "get_conversation",
            "Retrieve a complete conversation thread, including all messages, tool calls and responses "
                + "in chronological order. Reports found=false if the id does not exist.",
            object(
                Map.of("conversation_id", string("The unique identifier of the conversation to retrieve")),
                List.of("conversation_id")
            ),
            false,
            this::getConversation
        ));
        register(new ToolOperation(
            "search_conversation_titles",
            "Search conversation titles, useful when the topic is remembered but not the conversation id.",
            object(
                Map.of("query", string("Search query to find in conversation titles")),
                List.of("query")
            ),
            false,
            this::searchTitles
        ));
        register(new ToolOperation(
            "list_conversations",
            "List past conversations with the user, most recent first.",
            object(
                Map.of(
                    "limit", integer("Maximum number of conversations to return (default: 50, max: 200)"),
                    "offset", integer("Number of conversations to skip (default: 0)")
                ),
                List.of()
            ),
            false,
            this::listConversations
        ));
        register(new ToolOperation(
            "get_message",
            "Retrieve a single message by id, including role, content, tool calls and metadata. "
                + "Reports found=false if the id does not exist.",
            object(
                Map.of("message_id", integer("The unique identifier of the message to retrieve")),
                List.of("message_id")
            ),
            false,
            this::getMessage
        ));
    }

    @Override
    public String name() {
        return "conversations";
    }

    private ToolCallResponse searchConversations(ToolArguments arguments) {
        List<MessageSearchHit> hits = conversations.searchConversations(arguments.keywords("keywords"));
        return items("Found " + hits.size() + " matching messages", hits);
    }

    private ToolCallResponse getConversation(ToolArguments arguments) {
        String conversationId = arguments.requiredString("conversation_id");
        Lookup<Conversation> lookup = conversations.getConversation(conversationId);
        return switch (lookup.status()) {
            case FOUND -> ToolCallResponse.ok(
                "Conversation " + conversationId,
                Map.of("found", true, "conversation", toJson(lookup.value()))
            );
            case NOT_FOUND -> ToolCallResponse.ok(
                "Conversation not found: " + conversationId,
                Map.of("found", false, "conversation_id", conversationId)
            );
            case FAILED -> ToolCallResponse.error(lookup.error());
        };
    }

    private ToolCallResponse searchTitles(ToolArguments arguments) {
        List<ConversationSummary> summaries = conversations.searchConversationTitles(arguments.requiredString("query"));
        return items("Found " + summaries.size() + " conversations", summaries);
    }

    private ToolCallResponse listConversations(ToolArguments arguments) {
        List<ConversationSummary> summaries = conversations.listConversations(
            arguments.optionalInt("limit"),
            arguments.optionalInt("offset")
        );
        return items("Listed " + summaries.size() + " conversations", summaries);
    }

    private ToolCallResponse getMessage(ToolArguments arguments) {
        long messageId = arguments.requiredLong("message_id");
        Lookup<Message> lookup = conversations.getMessage(messageId);
        return switch (lookup.status()) {
            case FOUND -> ToolCallResponse.ok(
                "Message " + messageId,
                Map.of("found", true, "message", toJson(lookup.value()))
            );
            case NOT_FOUND -> ToolCallResponse.ok(
                "Message not found: " + messageId,
                Map.of("found", false, "message_id", messageId)
            );
            case FAILED -> ToolCallResponse.error(lookup.error());
        };
    }
}
