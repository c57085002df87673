package io.lunahistory.core.store;

import java.io.IOException;

/**
 * Exclusive access to the store could not be obtained.
 */
public final class StoreUnavailableException extends IOException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
