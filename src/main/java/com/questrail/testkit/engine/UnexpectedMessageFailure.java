package com.questrail.testkit.engine;

import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.UnexpectedMessageException;
import com.questrail.testkit.config.HandlerConfig;
import com.questrail.testkit.location.Location;

/**
 * Thrown in place of an {@link UnexpectedMessageException} raised by a
 * handler, adding the handler identity, the method that was called and the
 * location of the {@code throw}.
 */
public final class UnexpectedMessageFailure extends RuntimeException {

    private final HandlerConfig handler;
    private final String interfaceName;
    private final String method;
    private final Object implementation;
    private final Message unexpectedMessage;
    private final Location throwLocation;

    public UnexpectedMessageFailure(
            HandlerConfig handler,
            String interfaceName,
            String method,
            Object implementation,
            Message unexpectedMessage,
            UnexpectedMessageException cause
    ) {
        super(String.format(
                "the '%s' %s message handler did not expect %s.%s() to be called with a message of type %s",
                handler.name(),
                handler.handlerType(),
                implementation.getClass().getName(),
                method,
                unexpectedMessage.getClass().getName()), cause);
        this.handler = handler;
        this.interfaceName = interfaceName;
        this.method = method;
        this.implementation = implementation;
        this.unexpectedMessage = unexpectedMessage;
        this.throwLocation = Location.ofThrowable(cause);
    }

    public HandlerConfig handler() {
        return handler;
    }

    public String interfaceName() {
        return interfaceName;
    }

    public String method() {
        return method;
    }

    public Object implementation() {
        return implementation;
    }

    public Message unexpectedMessage() {
        return unexpectedMessage;
    }

    public Location throwLocation() {
        return throwLocation;
    }
}
