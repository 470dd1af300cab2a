package com.analystpilot.orchestrator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini generateContent client.
 *
 * Request:  POST {baseUrl}/models/{model}:generateContent  {contents:[{parts:[{text}]}]}
 * Response: {candidates:[{content:{parts:[{text}, ...]}}]}; all text parts are joined.
 */
public class GeminiTransport extends HttpLlmTransport {

    public GeminiTransport(HttpClient http, ObjectMapper objectMapper) {
        super(http, objectMapper);
    }

    @Override
    public ProviderKind kind() { return ProviderKind.GEMINI; }

    @Override
    protected String endpoint(ProviderConfig config) {
        return config.baseUrl() + "/models/" + config.model() + ":generateContent";
    }

    @Override
    protected Map<String, String> headers(ProviderConfig config) {
        return Map.of("x-goog-api-key", config.apiKey());
    }

    @Override
    protected Object requestBody(ProviderConfig config, String prompt) {
        return Map.of("contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))));
    }

    @Override
    protected String extractText(JsonNode body) {
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : body.path("candidates").path(0).path("content").path("parts")) {
            JsonNode text = part.path("text");
            if (text.isTextual()) sb.append(text.asText());
        }
        return sb.isEmpty() ? null : sb.toString();
    }
}
