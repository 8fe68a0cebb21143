package com.questrail.testkit.fact;

import com.questrail.testkit.api.Message;
import com.questrail.testkit.config.HandlerType;
import com.questrail.testkit.envelope.Envelope;

import java.time.Instant;
import java.util.Map;

/**
 * Facts about dispatch cycles and the dispatch of individual envelopes.
 */
public sealed interface DispatchFact extends Fact
{
    /**
     * The engine was asked to dispatch a message that no handler routes. Note
     * that it is unknown whether the message was intended as a command or an
     * event.
     */
    record CycleSkipped(
            Message message,
            Instant engineTime,
            Map<HandlerType, Boolean> enabledHandlerTypes,
            Map<String, Boolean> enabledHandlers
    ) implements DispatchFact {
    }

    /** A dispatch cycle started for a root envelope. */
    record CycleBegun(
            Envelope envelope,
            Instant engineTime,
            Map<HandlerType, Boolean> enabledHandlerTypes,
            Map<String, Boolean> enabledHandlers
    ) implements DispatchFact {
    }

    /**
     * A dispatch cycle finished. {@code error} is null if every handler
     * succeeded.
     */
    record CycleCompleted(
            Envelope envelope,
            Exception error,
            Map<HandlerType, Boolean> enabledHandlerTypes,
            Map<String, Boolean> enabledHandlers
    ) implements DispatchFact {
    }

    /** An envelope was taken from the dispatch queue. */
    record Begun(Envelope envelope) implements DispatchFact {
    }

    /** All consumers of an envelope have been invoked or skipped. */
    record Completed(Envelope envelope, Exception error) implements DispatchFact {
    }
}
