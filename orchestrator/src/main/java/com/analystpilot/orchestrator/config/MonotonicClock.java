package com.analystpilot.orchestrator.config;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock that never steps backwards or jumps with wall-clock corrections.
 *
 * Anchored to the wall time at construction, then advanced by
 * {@link System#nanoTime()}. Breaker cooldowns and attempt deadlines are
 * measured with it; anything persisted across restarts (cache expiry) uses
 * the system clock instead.
 */
public class MonotonicClock extends Clock {

    private final Instant anchor;
    private final long    anchorNanos;
    private final ZoneId  zone;

    public MonotonicClock() {
        this(Instant.now(), System.nanoTime(), ZoneOffset.UTC);
    }

    private MonotonicClock(Instant anchor, long anchorNanos, ZoneId zone) {
        this.anchor      = anchor;
        this.anchorNanos = anchorNanos;
        this.zone        = zone;
    }

    @Override
    public Instant instant() {
        return anchor.plusNanos(System.nanoTime() - anchorNanos);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return zone.equals(this.zone) ? this : new MonotonicClock(anchor, anchorNanos, zone);
    }
}
