package com.questrail.testkit;

/**
 * Thrown by an {@link Action} that cannot be performed.
 */
public class ActionException extends Exception {

    public ActionException(String message) {
        super(message);
    }

    public ActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
