package com.analystpilot.orchestrator.provider;

/**
 * Thrown by an {@link LlmTransport} when a provider call fails: non-2xx
 * status, unreadable body, or a reply without any text.
 *
 * Never escapes {@link ProviderClient#invoke}; the client counts it as a
 * failed attempt and retries or gives up.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    public ProviderException(int statusCode, String body) {
        super("Provider API error %d: %s".formatted(statusCode, body));
    }
}
