package io.lunahistory.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Message(
    long id,
    @JsonProperty("conversation_id") String conversationId,
    String role,
    String content,
    @JsonProperty("created_at") long createdAt,
    @JsonProperty("tool_calls") String toolCalls,
    @JsonProperty("tool_call_id") String toolCallId,
    @JsonProperty("tool_name") String toolName,
    @JsonProperty("tool_status") String toolStatus,
    @JsonProperty("tool_params_json") String toolParamsJson,
    @JsonProperty("tool_result_json") String toolResultJson,
    @JsonProperty("reasoning_content") String reasoningContent
) {
}
