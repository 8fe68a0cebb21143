package com.questrail.testkit.expectation;

/**
 * Raised when a predicate cannot be built because its expectation could never
 * be met by the application under test.
 */
public class ExpectationException extends Exception {

    public ExpectationException(String message) {
        super(message);
    }

    public ExpectationException(String message, Throwable cause) {
        super(message, cause);
    }
}
