package com.analystpilot.orchestrator.provider;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable per-provider settings, built once at startup.
 *
 * @param name        short provider name used in logs, metrics and results ("nvidia", "gemini", ...)
 * @param kind        wire protocol of the endpoint
 * @param baseUrl     API root, without a trailing slash
 * @param model       model identifier sent with every request
 * @param apiKey      credential; never logged
 * @param timeout     wall-clock bound of one network attempt
 * @param maxRetries  extra attempts after the first one fails
 * @param backoffBase base delay of the exponential backoff between attempts
 */
public record ProviderConfig(
        String       name,
        ProviderKind kind,
        String       baseUrl,
        String       model,
        String       apiKey,
        Duration     timeout,
        int          maxRetries,
        Duration     backoffBase
) {
    public ProviderConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(backoffBase, "backoffBase");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (baseUrl != null && baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
    }

    /** Keeps the credential out of log lines and assertion messages. */
    @Override
    public String toString() {
        return "ProviderConfig[name=%s, kind=%s, model=%s, timeout=%s, maxRetries=%d]"
                .formatted(name, kind, model, timeout, maxRetries);
    }
}
