package org.gudu0.journalbot.discord;

public class ProvisioningFailedException extends RuntimeException {
    public ProvisioningFailedException(String message) {
        super(message);
    }

    public ProvisioningFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
