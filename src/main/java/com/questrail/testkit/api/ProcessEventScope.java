package com.questrail.testkit.api;

import java.time.Instant;

/**
 * Scope passed to {@link ProcessMessageHandler#handleEvent}.
 */
public interface ProcessEventScope extends ProcessScope
{
    /**
     * Returns the time at which the event was recorded.
     */
    Instant recordedAt();
}
