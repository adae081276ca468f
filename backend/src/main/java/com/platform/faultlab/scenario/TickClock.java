package com.platform.faultlab.scenario;

/**
 * Source of logical one-second ticks for scenarios.
 */
@FunctionalInterface
public interface TickClock {

    /**
     * Block until the next tick.
     * @throws InterruptedException if the scenario thread is interrupted
     */
    void awaitNextTick() throws InterruptedException;

    static TickClock wallClock(long tickMillis) {
        return () -> Thread.sleep(tickMillis);
    }
}
