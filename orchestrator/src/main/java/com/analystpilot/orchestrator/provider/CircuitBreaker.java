package com.analystpilot.orchestrator.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-provider circuit breaker.
 *
 * <pre>
 *   CLOSED    --(failures reach threshold)-->  OPEN
 *   OPEN      --(cooldown elapsed, next call)--> HALF_OPEN  (exactly one probe admitted)
 *   HALF_OPEN --(probe succeeds)-->             CLOSED
 *   HALF_OPEN --(probe fails)-->                OPEN        (cooldown restarts)
 * </pre>
 *
 * State is shared by every request that uses the provider, so all
 * transitions are synchronized. Time comes from the injected {@link Clock}.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State { CLOSED, OPEN, HALF_OPEN }

    /** Outcome of asking the breaker for permission to call. */
    public enum Admission {
        ALLOWED,
        /** Cooldown just elapsed; this caller is the single probe. */
        PROBE,
        REJECTED
    }

    private final String   provider;
    private final int      threshold;
    private final Duration cooldown;
    private final Clock    clock;

    private State   state = State.CLOSED;
    private int     consecutiveFailures;
    private Instant blockedUntil;
    private boolean probeInFlight;

    public CircuitBreaker(String provider, int threshold, Duration cooldown, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1, got " + threshold);
        }
        this.provider  = provider;
        this.threshold = threshold;
        this.cooldown  = cooldown;
        this.clock     = clock;
    }

    public synchronized Admission tryAcquire() {
        switch (state) {
            case CLOSED:
                return Admission.ALLOWED;
            case OPEN:
                if (clock.instant().isBefore(blockedUntil)) {
                    return Admission.REJECTED;
                }
                state = State.HALF_OPEN;
                probeInFlight = true;
                log.info("Circuit for '{}' half-open, admitting one probe call", provider);
                return Admission.PROBE;
            case HALF_OPEN:
            default:
                if (probeInFlight) {
                    return Admission.REJECTED;
                }
                probeInFlight = true;
                return Admission.PROBE;
        }
    }

    public synchronized void recordSuccess() {
        if (state != State.CLOSED) {
            log.info("Circuit for '{}' closed after successful call", provider);
        }
        state               = State.CLOSED;
        consecutiveFailures = 0;
        blockedUntil        = null;
        probeInFlight       = false;
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        probeInFlight = false;
        if (state == State.HALF_OPEN || consecutiveFailures >= threshold) {
            state        = State.OPEN;
            blockedUntil = clock.instant().plus(cooldown);
            log.warn("Circuit for '{}' open until {} ({} consecutive failures)",
                    provider, blockedUntil, consecutiveFailures);
        }
    }

    public synchronized State state() { return state; }

    public synchronized int consecutiveFailures() { return consecutiveFailures; }

    public synchronized Instant blockedUntil() { return blockedUntil; }
}
