package com.analystpilot.orchestrator.provider;

import com.analystpilot.orchestrator.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.analystpilot.orchestrator.provider.CircuitBreaker.Admission.ALLOWED;
import static com.analystpilot.orchestrator.provider.CircuitBreaker.Admission.PROBE;
import static com.analystpilot.orchestrator.provider.CircuitBreaker.Admission.REJECTED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    MutableClock   clock;
    CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock   = MutableClock.atEpoch();
        breaker = new CircuitBreaker("nvidia", 3, Duration.ofSeconds(120), clock);
    }

    @Test
    void closed_admitsCalls() {
        assertThat(breaker.tryAcquire()).isEqualTo(ALLOWED);
        assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void failuresBelowThreshold_keepCircuitClosed() {
        breaker.recordFailure();
        breaker.recordFailure();
        assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.tryAcquire()).isEqualTo(ALLOWED);
        assertThat(breaker.consecutiveFailures()).isEqualTo(2);
    }

    @Test
    void thresholdFailures_openCircuitForCooldown() {
        tripOpen();

        assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(breaker.blockedUntil()).isEqualTo(clock.instant().plusSeconds(120));
        assertThat(breaker.tryAcquire()).isEqualTo(REJECTED);

        clock.advance(Duration.ofSeconds(119));
        assertThat(breaker.tryAcquire()).isEqualTo(REJECTED);
    }

    @Test
    void successResetsFailureCount() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();
        assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void afterCooldown_exactlyOneProbeIsAdmitted() {
        tripOpen();
        clock.advance(Duration.ofSeconds(120));

        assertThat(breaker.tryAcquire()).isEqualTo(PROBE);
        assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        // Concurrent callers wait for the probe's verdict.
        assertThat(breaker.tryAcquire()).isEqualTo(REJECTED);
    }

    @Test
    void probeSuccess_closesCircuit() {
        tripOpen();
        clock.advance(Duration.ofSeconds(121));
        breaker.tryAcquire();

        breaker.recordSuccess();

        assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.consecutiveFailures()).isZero();
        assertThat(breaker.tryAcquire()).isEqualTo(ALLOWED);
    }

    @Test
    void probeFailure_reopensForFullCooldown() {
        tripOpen();
        clock.advance(Duration.ofSeconds(121));
        breaker.tryAcquire();

        breaker.recordFailure();

        assertThat(breaker.state()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(breaker.blockedUntil()).isEqualTo(clock.instant().plusSeconds(120));
        assertThat(breaker.tryAcquire()).isEqualTo(REJECTED);
    }

    @Test
    void thresholdBelowOne_isRejected() {
        assertThatThrownBy(() -> new CircuitBreaker("x", 0, Duration.ofSeconds(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void tripOpen() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
    }
}
