package com.questrail.testkit.api;

/**
 * Thrown by a handler that is called with a message it does not recognise.
 *
 * <p>The engine never treats this as a recoverable handler error. It is
 * enriched with the handler identity, method and call site, and re-thrown as
 * an unchecked failure.</p>
 */
public final class UnexpectedMessageException extends RuntimeException {

    public UnexpectedMessageException() {
        super("message handler was called with an unexpected message");
    }
}
