package com.questrail.testkit.fact;

import com.questrail.testkit.config.IntegrationConfig;
import com.questrail.testkit.envelope.Envelope;

/**
 * Facts about integration handlers.
 */
public sealed interface IntegrationFact extends Fact
{
    IntegrationConfig handler();

    record EventRecorded(IntegrationConfig handler, Envelope envelope, Envelope eventEnvelope)
            implements IntegrationFact {
    }

    record MessageLogged(IntegrationConfig handler, Envelope envelope, LogEntry entry)
            implements IntegrationFact {
    }
}
