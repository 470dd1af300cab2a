package com.analystpilot.orchestrator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client for OpenAI and OpenAI-compatible endpoints
 * (NVIDIA's integrate API speaks the same shape).
 *
 * Request:  POST {baseUrl}/chat/completions  {model, messages:[{role:user, content}]}
 * Response: {choices:[{message:{content}}]}
 */
public class OpenAiCompatibleTransport extends HttpLlmTransport {

    public OpenAiCompatibleTransport(HttpClient http, ObjectMapper objectMapper) {
        super(http, objectMapper);
    }

    @Override
    public ProviderKind kind() { return ProviderKind.OPENAI_COMPATIBLE; }

    @Override
    protected String endpoint(ProviderConfig config) {
        return config.baseUrl() + "/chat/completions";
    }

    @Override
    protected Map<String, String> headers(ProviderConfig config) {
        return Map.of("authorization", "Bearer " + config.apiKey());
    }

    @Override
    protected Object requestBody(ProviderConfig config, String prompt) {
        return Map.of(
                "model",    config.model(),
                "messages", List.of(Map.of("role", "user", "content", prompt))
        );
    }

    @Override
    protected String extractText(JsonNode body) {
        JsonNode content = body.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }
}
