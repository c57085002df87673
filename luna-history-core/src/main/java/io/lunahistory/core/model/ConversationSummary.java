package io.lunahistory.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConversationSummary(
    String id,
    String title,
    @JsonProperty("created_at") long createdAt,
    @JsonProperty("title_generated") int titleGenerated,
    @JsonProperty("profile_name") String profileName,
    @JsonProperty("message_count") long messageCount
) {
}
