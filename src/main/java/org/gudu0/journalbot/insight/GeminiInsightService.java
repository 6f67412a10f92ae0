package org.gudu0.journalbot.insight;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;
import org.gudu0.journalbot.config.BotConfig;
import org.gudu0.journalbot.util.ConsoleLog;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Calls Gemini's {@code generateContent} REST endpoint.
 */
public class GeminiInsightService implements InsightService {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String url;
    private final String apiKey;
    private final RequestConfig requestConfig;

    public GeminiInsightService(BotConfig.InsightSettings settings, String apiKey) {
        String base = settings.endpoint.endsWith("/") ? settings.endpoint : settings.endpoint + "/";
        this.url = base + settings.model + ":generateContent";
        this.apiKey = apiKey;
        this.requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofSeconds(10))
                .setResponseTimeout(Timeout.ofSeconds(settings.timeoutSeconds))
                .build();
    }

    @Override
    public String generate(String prompt) {
        HttpPost post = new HttpPost(url);
        post.setConfig(requestConfig);
        post.setHeader("x-goog-api-key", apiKey);
        post.setEntity(new StringEntity(requestBody(prompt), ContentType.APPLICATION_JSON));

        ConsoleLog.debug("Insight", "POST " + url + " promptChars=" + prompt.length());

        try (CloseableHttpClient client = HttpClients.createDefault()) {
            return client.execute(post, response -> {
                String body = response.getEntity() == null
                        ? ""
                        : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
                int code = response.getCode();
                if (code < 200 || code >= 300) {
                    throw new InsightException("Gemini returned HTTP " + code + ": " + abbreviate(body));
                }
                return extractText(body);
            });
        } catch (IOException e) {
            throw new InsightException("Gemini request failed: " + e.getMessage(), e);
        }
    }

    static String requestBody(String prompt) {
        ObjectNode root = MAPPER.createObjectNode();
        root.putArray("contents")
                .addObject()
                .putArray("parts")
                .addObject()
                .put("text", prompt);
        try {
            return MAPPER.writeValueAsString(root);
        } catch (IOException e) {
            throw new InsightException("Could not encode request", e);
        }
    }

    /**
     * Joins the text parts of the first candidate.
     */
    static String extractText(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new InsightException("Unreadable Gemini response: " + abbreviate(json), e);
        }

        JsonNode parts = node.path("candidates").path(0).path("content").path("parts");
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : parts) {
            sb.append(part.path("text").asText(""));
        }
        if (sb.length() == 0) {
            String reason = node.path("promptFeedback").path("blockReason").asText("");
            throw new InsightException(reason.isEmpty()
                    ? "Gemini returned no text"
                    : "Gemini blocked the prompt: " + reason);
        }
        return sb.toString();
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() > 300 ? s.substring(0, 300) + "..." : s;
    }
}
