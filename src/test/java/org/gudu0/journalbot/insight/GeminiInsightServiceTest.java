package org.gudu0.journalbot.insight;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeminiInsightServiceTest {

    @Test
    void requestWrapsPromptInContentsParts() throws Exception {
        JsonNode body = new ObjectMapper().readTree(GeminiInsightService.requestBody("hello \"world\""));

        assertThat(body.path("contents").path(0).path("parts").path(0).path("text").asText())
                .isEqualTo("hello \"world\"");
    }

    @Test
    void extractsAndJoinsCandidateParts() {
        String json = """
                {"candidates":[{"content":{"parts":[{"text":"Hello "},{"text":"there"}],"role":"model"}}]}
                """;

        assertThat(GeminiInsightService.extractText(json)).isEqualTo("Hello there");
    }

    @Test
    void blockedPromptIsReported() {
        String json = """
                {"promptFeedback":{"blockReason":"SAFETY"}}
                """;

        assertThatThrownBy(() -> GeminiInsightService.extractText(json))
                .isInstanceOf(InsightException.class)
                .hasMessageContaining("SAFETY");
    }

    @Test
    void garbageResponseIsAnInsightFailure() {
        assertThatThrownBy(() -> GeminiInsightService.extractText("<html>502</html>"))
                .isInstanceOf(InsightException.class);
    }

    @Test
    void disabledServiceExplainsWhy() {
        assertThatThrownBy(() -> InsightService.disabled("GEMINI_API_KEY is not set").generate("x"))
                .isInstanceOf(InsightException.class)
                .hasMessageContaining("GEMINI_API_KEY");
    }
}
