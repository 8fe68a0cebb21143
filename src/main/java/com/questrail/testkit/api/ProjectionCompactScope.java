package com.questrail.testkit.api;

import java.time.Instant;

/**
 * Operations available to a projection while it compacts its data.
 */
public interface ProjectionCompactScope
{
    Instant now();

    void log(String format, Object... args);
}
