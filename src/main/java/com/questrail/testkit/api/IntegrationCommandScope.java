package com.questrail.testkit.api;

import java.time.Instant;

/**
 * Operations available to an integration while it handles a command.
 */
public interface IntegrationCommandScope
{
    void recordEvent(Message event);

    Instant now();

    void log(String format, Object... args);
}
