package com.questrail.testkit.envelope;

/**
 * Allocates message IDs as a strictly increasing decimal sequence starting at
 * 1.
 *
 * <p>Not thread-safe. The engine only allocates IDs from its dispatch
 * thread.</p>
 */
public final class MessageIdGenerator {

    private long next = 1;

    public String next() {
        return Long.toString(next++);
    }

    /**
     * Returns the generator to its initial state.
     */
    public void reset() {
        next = 1;
    }
}
