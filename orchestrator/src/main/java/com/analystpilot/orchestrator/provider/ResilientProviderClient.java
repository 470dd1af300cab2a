package com.analystpilot.orchestrator.provider;

import com.analystpilot.orchestrator.cache.CacheKeys;
import com.analystpilot.orchestrator.cache.ResponseCache;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ProviderClient} that wraps one {@link LlmTransport} with the full
 * reliability stack:
 *
 * <ol>
 *   <li>Cache lookup keyed by (prompt, model). A hit returns immediately and
 *       never touches the circuit breaker.</li>
 *   <li>Circuit breaker check. While open the provider is skipped without a
 *       network call; once the cooldown has passed a single probe attempt is
 *       let through.</li>
 *   <li>Up to {@code maxRetries + 1} attempts, each run as a cancellable task
 *       on the shared worker pool and bounded by the per-call timeout. An
 *       overrunning attempt is cancelled, which interrupts the worker and
 *       aborts the HTTP exchange.</li>
 *   <li>Exponential backoff with jitter between attempts.</li>
 * </ol>
 *
 * Every failure collapses to a {@code null} result plus a log line; nothing
 * escapes {@link #invoke}.
 */
public class ResilientProviderClient implements ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientProviderClient.class);

    private final ProviderConfig  config;
    private final LlmTransport    transport;
    private final CircuitBreaker  breaker;
    private final ResponseCache   cache;
    private final CacheKeys       cacheKeys;
    private final Duration        cacheTtl;
    private final BackoffPolicy   backoff;
    private final Sleeper         sleeper;
    private final ExecutorService callPool;
    private final MeterRegistry   meterRegistry;

    public ResilientProviderClient(ProviderConfig config,
                                   LlmTransport transport,
                                   CircuitBreaker breaker,
                                   ResponseCache cache,
                                   CacheKeys cacheKeys,
                                   Duration cacheTtl,
                                   BackoffPolicy backoff,
                                   Sleeper sleeper,
                                   ExecutorService callPool,
                                   MeterRegistry meterRegistry) {
        this.config        = config;
        this.transport     = transport;
        this.breaker       = breaker;
        this.cache         = cache;
        this.cacheKeys     = cacheKeys;
        this.cacheTtl      = cacheTtl;
        this.backoff       = backoff;
        this.sleeper       = sleeper;
        this.callPool      = callPool;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public String name() {
        return config.name();
    }

    @Override
    public String invoke(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be empty");
        }

        String cacheKey = cacheKeys.forPrompt(prompt, config.model());
        Optional<String> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("Cache hit for provider '{}'", config.name());
            count("cache_hit");
            return cached.get();
        }

        CircuitBreaker.Admission admission = breaker.tryAcquire();
        if (admission == CircuitBreaker.Admission.REJECTED) {
            log.warn("Skipping provider '{}': circuit {} until {}",
                    config.name(), breaker.state(), breaker.blockedUntil());
            count("circuit_open");
            return null;
        }

        // A half-open probe is a single call; retries would turn it into a burst.
        int maxAttempts = admission == CircuitBreaker.Admission.PROBE ? 1 : config.maxRetries() + 1;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String text;
            try {
                text = callWithTimeout(prompt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Provider '{}' call interrupted on attempt {}", config.name(), attempt);
                breaker.recordFailure();
                count("failure");
                return null;
            } catch (Exception e) {
                log.warn("Provider '{}' attempt {}/{} failed: {}",
                        config.name(), attempt, maxAttempts, e.getMessage());
                text = null;
            }

            if (text != null && !text.isBlank()) {
                breaker.recordSuccess();
                cache.put(cacheKey, text, cacheTtl);
                count("success");
                return text;
            }

            if (attempt < maxAttempts) {
                Duration delay = backoff.delayAfter(attempt);
                log.debug("Provider '{}' backing off {} ms before attempt {}",
                        config.name(), delay.toMillis(), attempt + 1);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        breaker.recordFailure();
        count("failure");
        log.error("Provider '{}' exhausted {} attempt(s); {} consecutive failed call(s)",
                config.name(), maxAttempts, breaker.consecutiveFailures());
        return null;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Run one transport call on the worker pool, waiting at most the per-call
     * timeout. On timeout the task is cancelled so the worker stops the I/O
     * instead of finishing it in the background.
     *
     * @return reply text, or null on timeout
     */
    private String callWithTimeout(String prompt) throws InterruptedException, ExecutionException {
        Timer.Sample sample = Timer.start(meterRegistry);
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<String> future;
        try {
            future = callPool.submit(() -> {
                // Keep requestId/provider/iteration on the worker's log lines.
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return transport.complete(config, prompt);
                } finally {
                    MDC.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            throw new ProviderException("Provider call pool rejected the task", e);
        }
        try {
            return future.get(config.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Provider '{}' timed out after {} s", config.name(), config.timeout().toSeconds());
            return null;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (CancellationException e) {
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("analyst.provider.duration", "provider", config.name()));
        }
    }

    private void count(String outcome) {
        meterRegistry.counter("analyst.provider.calls",
                "provider", config.name(), "outcome", outcome).increment();
    }
}
