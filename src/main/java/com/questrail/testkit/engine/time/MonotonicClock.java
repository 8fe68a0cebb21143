package com.questrail.testkit.engine.time;

/**
 * MonotonicClock
 * =============================================================================
 * Elapsed-time source for the real-time tick loop.
 *
 * <p>
 * Only {@code EngineRunner} reads this clock, to measure how much real time has
 * passed since the loop started. Values are only meaningful for elapsed time
 * computations.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     */
    long nowNanos();
}
