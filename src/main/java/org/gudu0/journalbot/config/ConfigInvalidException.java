package org.gudu0.journalbot.config;

import java.util.List;

/**
 * Fatal at startup: the bot refuses to run with this configuration.
 */
public class ConfigInvalidException extends RuntimeException {

    private final List<String> problems;

    public ConfigInvalidException(List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigInvalidException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public List<String> problems() {
        return problems;
    }
}
