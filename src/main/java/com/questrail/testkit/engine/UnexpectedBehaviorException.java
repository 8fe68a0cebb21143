package com.questrail.testkit.engine;

import com.questrail.testkit.api.Message;
import com.questrail.testkit.config.HandlerConfig;
import com.questrail.testkit.location.Location;

/**
 * UnexpectedBehaviorException
 * -----------------------------------------------------------------------------
 * Thrown when a handler violates its contract with the engine, for example by
 * routing a message to an empty instance ID, returning a null root, or
 * producing a message it has not declared.
 *
 * <p>This is a programming error in the application. The engine does not
 * recover from it; the current operation is abandoned.</p>
 */
public final class UnexpectedBehaviorException extends RuntimeException {

    private final HandlerConfig handler;
    private final String interfaceName;
    private final String method;
    private final Object implementation;
    private final Message handledMessage;
    private final String description;
    private final Location location;

    public UnexpectedBehaviorException(
            HandlerConfig handler,
            String interfaceName,
            String method,
            Object implementation,
            Message handledMessage,
            String description,
            Location location
    ) {
        super(String.format(
                "the '%s' %s message handler behaved unexpectedly in %s.%s(): %s",
                handler.name(),
                handler.handlerType(),
                implementation.getClass().getName(),
                method,
                description));
        this.handler = handler;
        this.interfaceName = interfaceName;
        this.method = method;
        this.implementation = implementation;
        this.handledMessage = handledMessage;
        this.description = description;
        this.location = location;
    }

    public HandlerConfig handler() {
        return handler;
    }

    /**
     * The simple name of the handler-facing interface, such as
     * {@code AggregateMessageHandler}.
     */
    public String interfaceName() {
        return interfaceName;
    }

    public String method() {
        return method;
    }

    public Object implementation() {
        return implementation;
    }

    /**
     * The message being handled when the violation occurred.
     */
    public Message handledMessage() {
        return handledMessage;
    }

    public String description() {
        return description;
    }

    public Location location() {
        return location;
    }
}
