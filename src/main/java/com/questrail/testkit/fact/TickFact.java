package com.questrail.testkit.fact;

import com.questrail.testkit.config.HandlerConfig;
import com.questrail.testkit.config.HandlerType;

import java.time.Instant;
import java.util.Map;

/**
 * Facts about engine ticks.
 */
public sealed interface TickFact extends Fact
{
    record CycleBegun(
            Instant engineTime,
            Map<HandlerType, Boolean> enabledHandlerTypes,
            Map<String, Boolean> enabledHandlers
    ) implements TickFact {
    }

    record CycleCompleted(
            Exception error,
            Map<HandlerType, Boolean> enabledHandlerTypes,
            Map<String, Boolean> enabledHandlers
    ) implements TickFact {
    }

    record Begun(HandlerConfig handler) implements TickFact {
    }

    record Completed(HandlerConfig handler, Exception error) implements TickFact {
    }

    record Skipped(HandlerConfig handler, HandlerSkipReason reason) implements TickFact {
    }
}
