package com.questrail.testkit.api;

import java.time.Instant;

/**
 * Operations available to a projection while it handles an event.
 */
public interface ProjectionEventScope
{
    /** The ID of the stream the event belongs to. */
    String streamId();

    /** The offset of the event within its stream. */
    long offset();

    /** The checkpoint offset the projection reported before this call. */
    long checkpointOffset();

    Instant recordedAt();

    /**
     * Returns true if this is the first time the event is delivered. Always
     * true in the test engine.
     */
    boolean isPrimaryDelivery();

    Instant now();

    void log(String format, Object... args);
}
