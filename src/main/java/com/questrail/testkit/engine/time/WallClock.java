package com.questrail.testkit.engine.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of the default "current time" for engine operations.
 *
 * <p>
 * The engine never reads this clock while draining a dispatch queue. It is
 * consulted once per operation, when no explicit current time is supplied, to
 * seed the virtual clock for that operation.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
