package com.questrail.testkit.api;

/**
 * The state of a single aggregate instance.
 *
 * <p>The root is rebuilt from its event history before every command, so
 * {@link #applyEvent(Message)} must be deterministic and free of side
 * effects.</p>
 */
public interface AggregateRoot
{
    void applyEvent(Message event);
}
