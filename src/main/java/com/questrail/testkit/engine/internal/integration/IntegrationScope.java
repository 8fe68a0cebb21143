package com.questrail.testkit.engine.internal.integration;

import com.questrail.testkit.api.IntegrationCommandScope;
import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.MessageValidationException;
import com.questrail.testkit.api.ValidationScope;
import com.questrail.testkit.config.IntegrationConfig;
import com.questrail.testkit.engine.UnexpectedBehaviorException;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.envelope.EventStreams;
import com.questrail.testkit.envelope.MessageIdGenerator;
import com.questrail.testkit.envelope.Origin;
import com.questrail.testkit.fact.FactObserver;
import com.questrail.testkit.fact.IntegrationFact;
import com.questrail.testkit.fact.LogEntry;
import com.questrail.testkit.location.Location;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

final class IntegrationScope implements IntegrationCommandScope {

    private final IntegrationConfig config;
    private final MessageIdGenerator messageIds;
    private final EventStreams streams;
    private final FactObserver observer;
    private final Instant now;
    private final Envelope command;
    private final List<Envelope> events = new ArrayList<>();

    IntegrationScope(
            IntegrationConfig config,
            MessageIdGenerator messageIds,
            EventStreams streams,
            FactObserver observer,
            Instant now,
            Envelope command
    ) {
        this.config = config;
        this.messageIds = messageIds;
        this.streams = streams;
        this.observer = observer;
        this.now = now;
        this.command = command;
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

        Envelope env = command.newEvent(
                messageIds.next(),
                event,
                now,
                new Origin(config, ""),
                streams.next(config.identity()));

        events.add(env);

        observer.onFact(new IntegrationFact.EventRecorded(config, command, env));
    }

    @Override
    public Instant now() {
        return now;
    }

    @Override
    public void log(String format, Object... args) {
        observer.onFact(new IntegrationFact.MessageLogged(config, command, LogEntry.of(format, args)));
    }

    List<Envelope> events() {
        return events;
    }

    private UnexpectedBehaviorException violation(String description) {
        return new UnexpectedBehaviorException(
                config,
                "IntegrationMessageHandler",
                "handleCommand",
                config.handler(),
                command.message(),
                description,
                Location.ofCaller(2));
    }
}
