package org.gudu0.journalbot.store;

/**
 * The store could not be reached (or kept failing transiently) after retries.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
