package com.questrail.testkit.api;

/**
 * Operations available to an aggregate while it handles a command.
 *
 * <p>A scope is valid only for the duration of the call it is passed to.</p>
 */
public interface AggregateCommandScope
{
    /**
     * Returns the ID of the instance the command was routed to.
     */
    String instanceId();

    /**
     * Records an event and applies it to the root.
     *
     * <p>Recording an event on an instance that does not exist creates it.
     * Recording an event after {@link #destroy()} in the same call reverts
     * the destruction.</p>
     */
    void recordEvent(Message event);

    /**
     * Destroys the instance, discarding its history once the call returns.
     * Has no effect if the instance does not exist.
     */
    void destroy();

    /**
     * Records an informational message about the handling of the command.
     */
    void log(String format, Object... args);
}
