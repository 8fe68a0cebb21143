package com.questrail.testkit.api;

/**
 * AggregateMessageHandler
 * -----------------------------------------------------------------------------
 * Handles commands for a family of aggregate instances, recording events that
 * describe the resulting state changes.
 *
 * <p>Aggregate handlers are transactional and cannot fail: any failure is a
 * programming error and should be thrown as an unchecked exception.</p>
 *
 * @param <R> the aggregate root type
 */
public interface AggregateMessageHandler<R extends AggregateRoot>
{
    void configure(HandlerConfigurer configurer);

    /**
     * Returns a new, empty root. Must never return {@code null}.
     */
    R newRoot();

    /**
     * Returns the ID of the instance the command targets. Must not be empty.
     */
    String routeCommandToInstance(Message command);

    void handleCommand(R root, AggregateCommandScope scope, Message command);
}
