package com.questrail.testkit.fact;

import com.questrail.testkit.envelope.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fact observer that renders each fact as one SLF4J log line.
 *
 * <ul>
 *   <li>DEBUG: engine bookkeeping such as instance loading and skips</li>
 *   <li>INFO: cycles and every message produced by a handler</li>
 *   <li>WARN: handler and cycle errors</li>
 * </ul>
 */
public final class Slf4jFactLogger implements FactObserver {
    private static final Logger log = LoggerFactory.getLogger(Slf4jFactLogger.class);

    @Override
    public void onFact(Fact fact) {
        if (fact instanceof DispatchFact f) {
            onDispatchFact(f);
        } else if (fact instanceof HandlingFact f) {
            onHandlingFact(f);
        } else if (fact instanceof TickFact f) {
            onTickFact(f);
        } else if (fact instanceof AggregateFact f) {
            onAggregateFact(f);
        } else if (fact instanceof ProcessFact f) {
            onProcessFact(f);
        } else if (fact instanceof IntegrationFact f) {
            onIntegrationFact(f);
        } else if (fact instanceof ProjectionFact f) {
            onProjectionFact(f);
        }
    }

    private void onDispatchFact(DispatchFact fact) {
        if (fact instanceof DispatchFact.CycleSkipped f) {
            log.info("dispatch skipped, {} is not routed to any handler: {}",
                    f.message().getClass().getName(), f.message().describe());
        } else if (fact instanceof DispatchFact.CycleBegun f) {
            log.info("dispatch cycle begun at {}: {}", f.engineTime(), describe(f.envelope()));
        } else if (fact instanceof DispatchFact.CycleCompleted f) {
            if (f.error() != null) {
                log.warn("dispatch cycle {} completed with errors: {}", f.envelope().messageId(), f.error().getMessage());
            } else {
                log.info("dispatch cycle {} completed", f.envelope().messageId());
            }
        } else if (fact instanceof DispatchFact.Begun f) {
            log.debug("dispatching {}", describe(f.envelope()));
        } else if (fact instanceof DispatchFact.Completed f) {
            log.debug("dispatched {}", f.envelope().messageId());
        }
    }

    private void onHandlingFact(HandlingFact fact) {
        if (fact instanceof HandlingFact.Skipped f) {
            log.debug("{} skipped {} ({})", f.handler(), f.envelope().messageId(), f.reason());
        } else if (fact instanceof HandlingFact.Begun f) {
            log.debug("{} handling {}", f.handler(), f.envelope().messageId());
        } else if (fact instanceof HandlingFact.Completed f) {
            if (f.error() != null) {
                log.warn("{} failed to handle {}: {}", f.handler(), f.envelope().messageId(), f.error().getMessage());
            } else {
                log.debug("{} handled {}", f.handler(), f.envelope().messageId());
            }
        }
    }

    private void onTickFact(TickFact fact) {
        if (fact instanceof TickFact.CycleBegun f) {
            log.info("tick cycle begun at {}", f.engineTime());
        } else if (fact instanceof TickFact.CycleCompleted f) {
            if (f.error() != null) {
                log.warn("tick cycle completed with errors: {}", f.error().getMessage());
            } else {
                log.info("tick cycle completed");
            }
        } else if (fact instanceof TickFact.Skipped f) {
            log.debug("{} tick skipped ({})", f.handler(), f.reason());
        } else if (fact instanceof TickFact.Completed f && f.error() != null) {
            log.warn("{} tick failed: {}", f.handler(), f.error().getMessage());
        }
    }

    private void onAggregateFact(AggregateFact fact) {
        if (fact instanceof AggregateFact.EventRecorded f) {
            log.info("{} [{}] recorded {}", f.handler(), f.instanceId(), describe(f.eventEnvelope()));
        } else if (fact instanceof AggregateFact.MessageLogged f) {
            log.info("{} [{}] {}", f.handler(), f.instanceId(), f.entry().text());
        } else if (fact instanceof AggregateFact.InstanceLoaded) {
            log.debug("{} [{}] instance loaded", fact.handler(), fact.instanceId());
        } else if (fact instanceof AggregateFact.InstanceNotFound) {
            log.debug("{} [{}] instance not found", fact.handler(), fact.instanceId());
        } else if (fact instanceof AggregateFact.InstanceCreated) {
            log.debug("{} [{}] instance created", fact.handler(), fact.instanceId());
        } else if (fact instanceof AggregateFact.InstanceDestroyed) {
            log.debug("{} [{}] instance destroyed", fact.handler(), fact.instanceId());
        } else if (fact instanceof AggregateFact.DestructionReverted) {
            log.debug("{} [{}] destruction reverted", fact.handler(), fact.instanceId());
        }
    }

    private void onProcessFact(ProcessFact fact) {
        if (fact instanceof ProcessFact.CommandExecuted f) {
            log.info("{} [{}] executed {}", f.handler(), f.instanceId(), describe(f.commandEnvelope()));
        } else if (fact instanceof ProcessFact.TimeoutScheduled f) {
            log.info("{} [{}] scheduled {} for {}", f.handler(), f.instanceId(),
                    describe(f.timeoutEnvelope()), f.timeoutEnvelope().scheduledFor().orElse(null));
        } else if (fact instanceof ProcessFact.MessageLogged f) {
            log.info("{} [{}] {}", f.handler(), f.instanceId(), f.entry().text());
        } else if (fact instanceof ProcessFact.EventIgnored f) {
            log.debug("{} ignored {}", f.handler(), f.envelope().messageId());
        } else if (fact instanceof ProcessFact.EventRoutedToEndedInstance f) {
            log.debug("{} [{}] event routed to ended instance", f.handler(), f.instanceId());
        } else if (fact instanceof ProcessFact.TimeoutRoutedToEndedInstance f) {
            log.debug("{} [{}] timeout routed to ended instance", f.handler(), f.instanceId());
        } else if (fact instanceof ProcessFact.InstanceLoaded f) {
            log.debug("{} [{}] instance loaded", f.handler(), f.instanceId());
        } else if (fact instanceof ProcessFact.InstanceNotFound f) {
            log.debug("{} [{}] instance not found", f.handler(), f.instanceId());
        } else if (fact instanceof ProcessFact.InstanceBegun f) {
            log.debug("{} [{}] instance begun", f.handler(), f.instanceId());
        } else if (fact instanceof ProcessFact.InstanceEnded f) {
            log.debug("{} [{}] instance ended", f.handler(), f.instanceId());
        } else if (fact instanceof ProcessFact.EndingReverted f) {
            log.debug("{} [{}] ending reverted", f.handler(), f.instanceId());
        }
    }

    private void onIntegrationFact(IntegrationFact fact) {
        if (fact instanceof IntegrationFact.EventRecorded f) {
            log.info("{} recorded {}", f.handler(), describe(f.eventEnvelope()));
        } else if (fact instanceof IntegrationFact.MessageLogged f) {
            log.info("{} {}", f.handler(), f.entry().text());
        }
    }

    private void onProjectionFact(ProjectionFact fact) {
        if (fact instanceof ProjectionFact.CompactionBegun f) {
            log.debug("{} compaction begun", f.handler());
        } else if (fact instanceof ProjectionFact.CompactionCompleted f) {
            if (f.error() != null) {
                log.warn("{} compaction failed: {}", f.handler(), f.error().getMessage());
            } else {
                log.debug("{} compaction completed", f.handler());
            }
        } else if (fact instanceof ProjectionFact.MessageLogged f) {
            log.info("{} {}", f.handler(), f.entry().text());
        }
    }

    private static String describe(Envelope env) {
        return env.kind() + " " + env.messageId() + " " + env.messageType().getSimpleName()
                + ": " + env.message().describe();
    }
}
