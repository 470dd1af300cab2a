package com.analystpilot.orchestrator.provider;

import java.time.Duration;
import java.util.random.RandomGenerator;

/**
 * Exponential backoff with a cap and symmetric jitter:
 * {@code min(base * 2^(attempt-1), cap) * (1 ± jitter)}.
 */
public class BackoffPolicy {

    private final Duration        base;
    private final Duration        cap;
    private final double          jitter;
    private final RandomGenerator random;

    public BackoffPolicy(Duration base, Duration cap, double jitter, RandomGenerator random) {
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1), got " + jitter);
        }
        this.base   = base;
        this.cap    = cap;
        this.jitter = jitter;
        this.random = random;
    }

    /** Delay to wait after the given failed attempt (1-based). */
    public Duration delayAfter(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based, got " + attempt);
        }
        double baseMs   = base.toMillis() * Math.pow(2, attempt - 1);
        double cappedMs = Math.min(baseMs, cap.toMillis());
        double factor   = 1.0 + jitter * (2 * random.nextDouble() - 1);
        return Duration.ofMillis(Math.round(cappedMs * factor));
    }
}
