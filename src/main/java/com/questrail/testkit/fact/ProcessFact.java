package com.questrail.testkit.fact;

import com.questrail.testkit.api.ProcessRoot;
import com.questrail.testkit.config.ProcessConfig;
import com.questrail.testkit.envelope.Envelope;

/**
 * Facts about process instances.
 *
 * <p>{@code envelope} is always the event or timeout being handled.</p>
 */
public sealed interface ProcessFact extends Fact
{
    ProcessConfig handler();

    Envelope envelope();

    record InstanceLoaded(ProcessConfig handler, String instanceId, ProcessRoot root, Envelope envelope)
            implements ProcessFact {
    }

    /** The handler chose not to route the event to any instance. */
    record EventIgnored(ProcessConfig handler, Envelope envelope) implements ProcessFact {
    }

    record EventRoutedToEndedInstance(ProcessConfig handler, String instanceId, Envelope envelope)
            implements ProcessFact {
    }

    record TimeoutRoutedToEndedInstance(ProcessConfig handler, String instanceId, Envelope envelope)
            implements ProcessFact {
    }

    record InstanceNotFound(ProcessConfig handler, String instanceId, Envelope envelope)
            implements ProcessFact {
    }

    record InstanceBegun(ProcessConfig handler, String instanceId, ProcessRoot root, Envelope envelope)
            implements ProcessFact {
    }

    record InstanceEnded(ProcessConfig handler, String instanceId, ProcessRoot root, Envelope envelope)
            implements ProcessFact {
    }

    /** A command or timeout was produced after the instance was ended within the same call. */
    record EndingReverted(ProcessConfig handler, String instanceId, ProcessRoot root, Envelope envelope)
            implements ProcessFact {
    }

    record CommandExecuted(
            ProcessConfig handler,
            String instanceId,
            ProcessRoot root,
            Envelope envelope,
            Envelope commandEnvelope
    ) implements ProcessFact {
    }

    record TimeoutScheduled(
            ProcessConfig handler,
            String instanceId,
            ProcessRoot root,
            Envelope envelope,
            Envelope timeoutEnvelope
    ) implements ProcessFact {
    }

    record MessageLogged(
            ProcessConfig handler,
            String instanceId,
            ProcessRoot root,
            Envelope envelope,
            LogEntry entry
    ) implements ProcessFact {
    }
}
