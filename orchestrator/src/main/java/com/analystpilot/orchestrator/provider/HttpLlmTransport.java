package com.analystpilot.orchestrator.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Shared plumbing for the JSON-over-HTTPS provider APIs.
 *
 * Uses java.net.http.HttpClient directly: every provider here is a plain
 * REST endpoint, and owning the request lets us put the per-call timeout on
 * the exchange itself. {@link HttpClient#send} is interruptible, which is how
 * an overrunning call gets cancelled.
 */
public abstract class HttpLlmTransport implements LlmTransport {

    protected final HttpClient   http;
    protected final ObjectMapper json;

    protected HttpLlmTransport(HttpClient http, ObjectMapper objectMapper) {
        this.http = http;
        this.json = objectMapper;
    }

    /** Default client: HTTP/1.1 keeps proxies and some gateways happy. */
    public static HttpClient defaultHttpClient() {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String complete(ProviderConfig config, String prompt) throws InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(endpoint(config)))
                .timeout(config.timeout())
                .header("content-type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(requestBody(config, prompt))));
        headers(config).forEach(builder::header);

        HttpResponse<String> response;
        try {
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderException(config.name() + " call failed: " + e.getMessage(), e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new ProviderException(response.statusCode(), response.body());
        }

        String text = extractText(readTree(response.body()));
        if (text == null || text.isBlank()) {
            throw new ProviderException(config.name() + " returned an empty reply");
        }
        return text.strip();
    }

    // ------------------------------------------------------------------
    // Protocol hooks
    // ------------------------------------------------------------------

    protected abstract String endpoint(ProviderConfig config);

    protected abstract Map<String, String> headers(ProviderConfig config);

    protected abstract Object requestBody(ProviderConfig config, String prompt);

    /** Pull the reply text out of a parsed response body; null if there is none. */
    protected abstract String extractText(JsonNode body);

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Parse and extract in one go; package-private for response-shape tests. */
    String extractText(String body) {
        return extractText(readTree(body));
    }

    private JsonNode readTree(String body) {
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Unreadable provider response", e);
        }
    }

    private String toJson(Object body) {
        try {
            return json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException("JSON serialization failed", e);
        }
    }
}
