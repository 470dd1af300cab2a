package com.analystpilot.orchestrator.provider;

/**
 * One blocking request/response exchange with a provider endpoint.
 *
 * Implementations must honour thread interruption: the
 * {@link ResilientProviderClient} cancels an overrunning call by interrupting
 * the worker that runs it.
 */
public interface LlmTransport {

    ProviderKind kind();

    /**
     * Send a single-turn prompt and return the reply text.
     *
     * @throws ProviderException    on any HTTP, protocol or empty-reply failure
     * @throws InterruptedException if the call was cancelled
     */
    String complete(ProviderConfig config, String prompt) throws InterruptedException;
}
