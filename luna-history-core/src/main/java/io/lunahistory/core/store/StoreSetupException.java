package io.lunahistory.core.store;

import java.io.IOException;

/**
 * The store could not be opened or its schema could not be applied.
 */
public final class StoreSetupException extends IOException {
    private final String step;

    public StoreSetupException(String step, Throwable cause) {
        super("Failed to " + step + (cause == null ? "" : ": " + cause.getMessage()), cause);
        this.step = step;
    }

    public String step() {
        return step;
    }
}
