package com.questrail.testkit.fact;

import com.questrail.testkit.config.HandlerConfig;
import com.questrail.testkit.envelope.Envelope;

/**
 * Facts about the invocation of a single handler for a single envelope.
 */
public sealed interface HandlingFact extends Fact
{
    HandlerConfig handler();

    Envelope envelope();

    record Begun(HandlerConfig handler, Envelope envelope) implements HandlingFact {
    }

    record Completed(HandlerConfig handler, Envelope envelope, Exception error) implements HandlingFact {
    }

    record Skipped(HandlerConfig handler, Envelope envelope, HandlerSkipReason reason) implements HandlingFact {
    }
}
