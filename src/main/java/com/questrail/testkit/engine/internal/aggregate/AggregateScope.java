package com.questrail.testkit.engine.internal.aggregate;

import com.questrail.testkit.api.AggregateCommandScope;
import com.questrail.testkit.api.AggregateMessageHandler;
import com.questrail.testkit.api.AggregateRoot;
import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.MessageValidationException;
import com.questrail.testkit.api.ValidationScope;
import com.questrail.testkit.config.AggregateConfig;
import com.questrail.testkit.engine.UnexpectedBehaviorException;
import com.questrail.testkit.engine.internal.HandlerCalls;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.envelope.EventStreams;
import com.questrail.testkit.envelope.MessageIdGenerator;
import com.questrail.testkit.envelope.Origin;
import com.questrail.testkit.fact.AggregateFact;
import com.questrail.testkit.fact.FactObserver;
import com.questrail.testkit.fact.LogEntry;
import com.questrail.testkit.location.Location;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Scope passed to {@link AggregateMessageHandler#handleCommand}.
 *
 * <p>Tracks whether the instance exists as the handler records events and
 * destroys the instance, and collects the events produced by the call.</p>
 */
final class AggregateScope<R extends AggregateRoot> implements AggregateCommandScope {

    private final AggregateConfig config;
    private final AggregateMessageHandler<R> handler;
    private final String instanceId;
    private final MessageIdGenerator messageIds;
    private final EventStreams streams;
    private final FactObserver observer;
    private final Instant now;
    private final Envelope command;

    private R root;
    private boolean exists;
    private boolean destroyed;
    private int historyStart;
    private final List<Envelope> events = new ArrayList<>();

    AggregateScope(
            AggregateConfig config,
            AggregateMessageHandler<R> handler,
            String instanceId,
            MessageIdGenerator messageIds,
            EventStreams streams,
            FactObserver observer,
            Instant now,
            Envelope command,
            R root,
            boolean exists
    ) {
        this.config = config;
        this.handler = handler;
        this.instanceId = instanceId;
        this.messageIds = messageIds;
        this.streams = streams;
        this.observer = observer;
        this.now = now;
        this.command = command;
        this.root = root;
        this.exists = exists;
    }

    @Override
    public String instanceId() {
        return instanceId;
    }

    @Override
    public void recordEvent(Message event) {
        if (config.producedTypes().get(event.getClass()) != MessageKind.EVENT) {
            throw violation(String.format(
                    "recorded an event of type %s, which is not produced by this handler",
                    event.getClass().getName()));
        }

        try {
            event.validate(ValidationScope.forEvent());
        } catch (MessageValidationException e) {
            throw violation(String.format(
                    "recorded an invalid %s event: %s",
                    event.getClass().getName(), e.getMessage()));
        }

        if (!exists) {
            if (destroyed) {
                observer.onFact(new AggregateFact.DestructionReverted(config, instanceId, root, command));
            } else {
                observer.onFact(new AggregateFact.InstanceCreated(config, instanceId, root, command));
            }
            exists = true;
        }

        HandlerCalls.run(config, "AggregateRoot", "applyEvent", root, event, () -> root.applyEvent(event));

        Envelope env = command.newEvent(
                messageIds.next(),
                event,
                now,
                new Origin(config, instanceId),
                streams.next(config.identity()));

        events.add(env);

        observer.onFact(new AggregateFact.EventRecorded(config, instanceId, root, command, env));
    }

    @Override
    public void destroy() {
        if (!exists) {
            return;
        }

        root = AggregateController.newRoot(config, handler, command);
        exists = false;
        destroyed = true;
        historyStart = events.size();

        observer.onFact(new AggregateFact.InstanceDestroyed(config, instanceId, root, command));
    }

    @Override
    public void log(String format, Object... args) {
        observer.onFact(new AggregateFact.MessageLogged(config, instanceId, root, command, LogEntry.of(format, args)));
    }

    boolean exists() {
        return exists;
    }

    /**
     * True if the instance was destroyed at some point during the call, even
     * if the destruction was later reverted.
     */
    boolean wasDestroyed() {
        return destroyed;
    }

    List<Envelope> events() {
        return events;
    }

    /**
     * Returns the events recorded since the instance was last destroyed.
     */
    List<Envelope> eventsSinceDestroyed() {
        return events.subList(historyStart, events.size());
    }

    private UnexpectedBehaviorException violation(String description) {
        return new UnexpectedBehaviorException(
                config,
                "AggregateMessageHandler",
                "handleCommand",
                handler,
                command.message(),
                description,
                Location.ofCaller(2));
    }
}
