package com.landingzone.orchestrator.engine;

import java.time.Duration;

/**
 * Blocks the calling thread between polls. Swapped for a fake in tests so
 * nothing actually waits.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
