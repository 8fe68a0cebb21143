package com.questrail.testkit.fact;

import com.questrail.testkit.api.AggregateRoot;
import com.questrail.testkit.config.AggregateConfig;
import com.questrail.testkit.envelope.Envelope;

/**
 * Facts about aggregate instances.
 *
 * <p>{@code envelope} is always the command being handled.</p>
 */
public sealed interface AggregateFact extends Fact
{
    AggregateConfig handler();

    String instanceId();

    Envelope envelope();

    /** The instance's history was replayed onto a new root. */
    record InstanceLoaded(AggregateConfig handler, String instanceId, AggregateRoot root, Envelope envelope)
            implements AggregateFact {
    }

    /** The command was routed to an instance with no history. */
    record InstanceNotFound(AggregateConfig handler, String instanceId, Envelope envelope)
            implements AggregateFact {
    }

    /** The first event was recorded on an instance that did not exist. */
    record InstanceCreated(AggregateConfig handler, String instanceId, AggregateRoot root, Envelope envelope)
            implements AggregateFact {
    }

    record InstanceDestroyed(AggregateConfig handler, String instanceId, AggregateRoot root, Envelope envelope)
            implements AggregateFact {
    }

    /** An event was recorded after the instance was destroyed within the same call. */
    record DestructionReverted(AggregateConfig handler, String instanceId, AggregateRoot root, Envelope envelope)
            implements AggregateFact {
    }

    record EventRecorded(
            AggregateConfig handler,
            String instanceId,
            AggregateRoot root,
            Envelope envelope,
            Envelope eventEnvelope
    ) implements AggregateFact {
    }

    record MessageLogged(
            AggregateConfig handler,
            String instanceId,
            AggregateRoot root,
            Envelope envelope,
            LogEntry entry
    ) implements AggregateFact {
    }
}
