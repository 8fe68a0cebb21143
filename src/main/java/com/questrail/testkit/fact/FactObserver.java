package com.questrail.testkit.fact;

/**
 * Receives facts from the engine.
 *
 * <p>Observers are notified synchronously on the thread that performs the
 * operation and must not block for externally observable durations.</p>
 */
@FunctionalInterface
public interface FactObserver
{
    void onFact(Fact fact);
}
