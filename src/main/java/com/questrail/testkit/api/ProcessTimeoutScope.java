package com.questrail.testkit.api;

import java.time.Instant;

/**
 * Scope passed to {@link ProcessMessageHandler#handleTimeout}.
 */
public interface ProcessTimeoutScope extends ProcessScope
{
    /**
     * Returns the time at which the timeout was scheduled to occur.
     */
    Instant scheduledFor();
}
