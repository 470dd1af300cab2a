package com.analystpilot.orchestrator.provider;

/**
 * A single external model provider as seen by the feedback loop.
 */
public interface ProviderClient {

    /** Provider name, e.g. "gemini". */
    String name();

    /**
     * Send the prompt and return the reply text, or {@code null} if the
     * provider could not produce one. Never throws for provider-side failures.
     *
     * @throws IllegalArgumentException if the prompt is null or blank
     */
    String invoke(String prompt);
}
