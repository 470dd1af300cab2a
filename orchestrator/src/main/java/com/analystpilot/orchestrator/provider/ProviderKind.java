package com.analystpilot.orchestrator.provider;

/**
 * Wire protocol spoken by a provider endpoint. Selects the {@link LlmTransport}.
 */
public enum ProviderKind {
    /** OpenAI chat-completions shape; also served by NVIDIA's integrate API. */
    OPENAI_COMPATIBLE,
    /** Google Gemini generateContent. */
    GEMINI,
    /** Anthropic Messages API. */
    ANTHROPIC
}
