package io.lunahistory.core.query;

/**
 * Result of fetching or creating a single record. Keeps "no such row" apart from
 * "the store failed", which callers must be able to tell apart.
 */
public record Lookup<T>(Status status, T value, String error) {

    public enum Status {
        FOUND,
        NOT_FOUND,
        FAILED
    }

    public static <T> Lookup<T> found(T value) {
        return new Lookup<>(Status.FOUND, value, null);
    }

    public static <T> Lookup<T> notFound() {
        return new Lookup<>(Status.NOT_FOUND, null, null);
    }

    public static <T> Lookup<T> failed(String error) {
        return new Lookup<>(Status.FAILED, null, error);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isNotFound() {
        return status == Status.NOT_FOUND;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
