package com.questrail.testkit.engine.internal.projection;

/**
 * Raised when a projection returns a checkpoint offset other than the offset
 * of the event it just handled plus one.
 */
public final class CheckpointConflictException extends Exception {

    private final String streamId;
    private final long expected;
    private final long actual;

    public CheckpointConflictException(String handlerName, String streamId, long expected, long actual) {
        super(String.format(
                "the '%s' projection message handler returned checkpoint offset %d for stream %s, expected %d",
                handlerName, actual, streamId, expected));
        this.streamId = streamId;
        this.expected = expected;
        this.actual = actual;
    }

    public String streamId() {
        return streamId;
    }

    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }
}
