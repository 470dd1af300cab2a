package com.analystpilot.orchestrator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API client.
 *
 * Request:  POST {baseUrl}/messages  {model, max_tokens, messages:[{role:user, content}]}
 * Response: {content:[{type:"text", text}, ...]}; the first text block is the reply.
 */
public class AnthropicTransport extends HttpLlmTransport {

    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 4096;

    public AnthropicTransport(HttpClient http, ObjectMapper objectMapper) {
        super(http, objectMapper);
    }

    @Override
    public ProviderKind kind() { return ProviderKind.ANTHROPIC; }

    @Override
    protected String endpoint(ProviderConfig config) {
        return config.baseUrl() + "/messages";
    }

    @Override
    protected Map<String, String> headers(ProviderConfig config) {
        return Map.of(
                "x-api-key",         config.apiKey(),
                "anthropic-version", API_VER
        );
    }

    @Override
    protected Object requestBody(ProviderConfig config, String prompt) {
        return Map.of(
                "model",      config.model(),
                "max_tokens", MAX_TOKENS,
                "messages",   List.of(Map.of("role", "user", "content", prompt))
        );
    }

    @Override
    protected String extractText(JsonNode body) {
        for (JsonNode block : body.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                return block.path("text").asText();
            }
        }
        return null;
    }
}
