package io.lunahistory.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A message matched by a full-text search, with its content cut down to a preview.
 */
public record MessageSearchHit(
    @JsonProperty("conversation_id") String conversationId,
    @JsonProperty("message_id") long messageId,
    String role,
    @JsonProperty("content_preview") String contentPreview,
    @JsonProperty("created_at") long createdAt
) {
}
