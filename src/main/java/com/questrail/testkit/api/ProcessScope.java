package com.questrail.testkit.api;

import java.time.Instant;

/**
 * Operations common to both process scopes.
 */
public interface ProcessScope
{
    String instanceId();

    /**
     * Ends the instance once the call returns. Ending is idempotent. Executing
     * a command or scheduling a timeout later in the same call reverts it.
     */
    void end();

    /**
     * Executes a command as a result of the message being handled.
     */
    void executeCommand(Message command);

    /**
     * Schedules a timeout to be handled by this instance at {@code at}.
     *
     * <p>A timeout scheduled for the current engine time, or earlier, is
     * delivered within the current dispatch cycle.</p>
     */
    void scheduleTimeout(Message timeout, Instant at);

    /**
     * Returns the engine's current virtual time.
     */
    Instant now();

    void log(String format, Object... args);
}
