package com.mcpfactory.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * Single-turn only: the interpreter sends one prompt and reads one reply.
 * Uses the JDK HttpClient so every header on the wire is explicit.
 */
@Component
public class ClaudeClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** role is "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Text of the first text block. */
        public String firstText() {
            if (content == null) {
                throw new ClaudeApiException(200, "response has no content");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new ClaudeApiException(200, "no text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_URL    = "https://api.anthropic.com/v1/messages";
    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 4096;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       model;

    public ClaudeClient(@Value("${anthropic.api-key:}") String apiKey,
                        @Value("${anthropic.model:claude-sonnet-4-20250514}") String model,
                        ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.model  = model;
        this.json   = objectMapper;
        this.http   = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /** False when no API key was supplied; callers fail fast instead of sending a request. */
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String model() {
        return model;
    }

    /**
     * Send a conversation and return the assistant's text reply.
     *
     * @throws ClaudeApiException on a non-200 status or a reply without text
     */
    public String complete(List<Message> messages) {
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",      model,
                    "max_tokens", MAX_TOKENS,
                    "messages",   messages
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(API_URL))
                    .timeout(Duration.ofSeconds(120))
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            log.debug("Calling {} with {} message(s)", model, messages.size());
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new ClaudeApiException(response.statusCode(), response.body());
            }

            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            return parsed.firstText();

        } catch (ClaudeApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while calling Claude API", e);
        } catch (Exception e) {
            throw new IllegalStateException("Claude API call failed: " + e.getMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeApiException extends RuntimeException {
        private final int statusCode;
        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }
        public int statusCode() { return statusCode; }
    }
}
