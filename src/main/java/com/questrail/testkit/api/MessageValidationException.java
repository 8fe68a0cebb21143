package com.questrail.testkit.api;

/**
 * Thrown by {@link Message#validate(ValidationScope)} when a message is not
 * well-formed.
 */
public class MessageValidationException extends RuntimeException {

    public MessageValidationException(String message) {
        super(message);
    }

    public MessageValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
