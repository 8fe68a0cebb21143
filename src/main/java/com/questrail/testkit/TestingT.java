package com.questrail.testkit;

/**
 * TestingT
 * =============================================================================
 * The host test runner, as seen by a {@link Test}.
 *
 * <p>Implementations bridge to whatever framework runs the test. The default
 * methods stop the test by throwing {@link TestFailedError}, which every
 * JUnit-style runner reports as a failure.</p>
 */
public interface TestingT
{
    /**
     * Writes a message to the test output.
     */
    void log(String message);

    /**
     * Marks the test as failed without stopping it.
     */
    void fail();

    boolean failed();

    /**
     * Marks the calling method as a test helper. Most runners ignore this.
     */
    default void helper() {
    }

    /**
     * Marks the test as failed and stops it.
     */
    default void failNow() {
        fail();
        throw new TestFailedError("test failed, see the log for details");
    }

    /**
     * Logs {@code message}, then marks the test as failed and stops it.
     */
    default void fatal(String message) {
        log(message);
        fail();
        throw new TestFailedError(message);
    }
}
