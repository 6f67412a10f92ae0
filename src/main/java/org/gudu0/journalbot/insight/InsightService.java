package org.gudu0.journalbot.insight;

/**
 * Text generation backend for /gemini.
 */
@FunctionalInterface
public interface InsightService {

    /**
     * @throws InsightException when the backend fails or returns nothing usable
     */
    String generate(String prompt);

    static InsightService disabled(String reason) {
        return prompt -> {
            throw new InsightException("Insights are unavailable: " + reason);
        };
    }
}
