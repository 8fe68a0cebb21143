package com.questrail.testkit;

/**
 * Thrown to stop a test that has failed.
 */
public class TestFailedError extends AssertionError {

    public TestFailedError(String message) {
        super(message);
    }
}
