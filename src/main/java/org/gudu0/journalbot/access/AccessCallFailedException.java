package org.gudu0.journalbot.access;

/**
 * A grant/revoke call did not confirm. {@code retryable=false} means retrying cannot help
 * (missing permissions, unknown channel) and the retry loop should give up immediately.
 */
public class AccessCallFailedException extends RuntimeException {

    private final boolean retryable;

    public AccessCallFailedException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public AccessCallFailedException(String message, boolean retryable) {
        this(message, retryable, null);
    }

    public boolean retryable() {
        return retryable;
    }
}
