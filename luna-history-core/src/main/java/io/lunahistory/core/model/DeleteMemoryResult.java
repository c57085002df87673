package io.lunahistory.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of removing a memory entry. A missing id ({@code notFound}) is reported apart from a
 * store failure ({@code error}).
 */
public record DeleteMemoryResult(
    boolean success,
    @JsonProperty("not_found") boolean notFound,
    String error
) {
    public static DeleteMemoryResult deleted() {
        return new DeleteMemoryResult(true, false, null);
    }

    public static DeleteMemoryResult missing(long memoryId) {
        return new DeleteMemoryResult(false, true, "Memory not found: " + memoryId);
    }

    public static DeleteMemoryResult failed(String error) {
        return new DeleteMemoryResult(false, false, error);
    }
}
