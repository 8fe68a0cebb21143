package com.questrail.testkit.api;

import java.util.Optional;

/**
 * ProcessMessageHandler
 * -----------------------------------------------------------------------------
 * Coordinates a long-running business process: reacts to events by executing
 * commands and scheduling timeouts.
 *
 * <p>Checked exceptions thrown by the callbacks are reported as handler
 * errors; the engine carries on with the remaining work in the cycle.</p>
 *
 * @param <R> the process root type
 */
public interface ProcessMessageHandler<R extends ProcessRoot>
{
    void configure(HandlerConfigurer configurer);

    /**
     * Returns a new, empty root. Must never return {@code null}.
     */
    R newRoot();

    /**
     * Returns the ID of the instance the event targets, or empty if the event
     * should be ignored. A present ID must not be empty.
     */
    Optional<String> routeEventToInstance(OperationContext ctx, Message event) throws Exception;

    void handleEvent(OperationContext ctx, R root, ProcessEventScope scope, Message event) throws Exception;

    void handleTimeout(OperationContext ctx, R root, ProcessTimeoutScope scope, Message timeout) throws Exception;
}
