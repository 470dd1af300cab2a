package com.analystpilot.orchestrator.provider;

import java.time.Duration;

/** Backoff sleep, swapped out in tests. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
