package io.lunahistory.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MemoryEntry(
    long id,
    String content,
    String category,
    int importance,
    @JsonProperty("created_at") long createdAt
) {
    public static final int DEFAULT_IMPORTANCE = 5;
    public static final int MIN_IMPORTANCE = 1;
    public static final int MAX_IMPORTANCE = 10;
}
