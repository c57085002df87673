package io.lunahistory.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record Conversation(
    String id,
    String title,
    @JsonProperty("created_at") long createdAt,
    @JsonProperty("title_generated") int titleGenerated,
    @JsonProperty("profile_name") String profileName,
    List<Message> messages
) {
    public Conversation {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public Conversation withMessages(List<Message> loaded) {
        return new Conversation(id, title, createdAt, titleGenerated, profileName, loaded);
    }
}
