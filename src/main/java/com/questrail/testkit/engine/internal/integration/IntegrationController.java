package com.questrail.testkit.engine.internal.integration;

import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.config.IntegrationConfig;
import com.questrail.testkit.engine.internal.Controller;
import com.questrail.testkit.engine.internal.HandlerCalls;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.envelope.EventStreams;
import com.questrail.testkit.envelope.MessageIdGenerator;
import com.questrail.testkit.fact.FactObserver;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Drives an integration message handler.
 *
 * <p>Integrations hold no state in the engine. Events recorded by the handler
 * are placed on the handler's own stream. If the handler throws a checked
 * exception its events are discarded.</p>
 */
public final class IntegrationController implements Controller {

    private final IntegrationConfig config;
    private final MessageIdGenerator messageIds;
    private final EventStreams streams;

    public IntegrationController(IntegrationConfig config, MessageIdGenerator messageIds, EventStreams streams) {
        this.config = Objects.requireNonNull(config, "config");
        this.messageIds = Objects.requireNonNull(messageIds, "messageIds");
        this.streams = Objects.requireNonNull(streams, "streams");
    }

    @Override
    public IntegrationConfig handlerConfig() {
        return config;
    }

    @Override
    public List<Envelope> tick(OperationContext ctx, FactObserver observer, Instant now) {
        return List.of();
    }

    @Override
    public List<Envelope> handle(OperationContext ctx, FactObserver observer, Instant now, Envelope env) throws Exception {
        if (env.kind() != MessageKind.COMMAND || !config.consumes(env.messageType())) {
            throw new IllegalStateException(config.identity() + " does not handle " + env.messageType().getName() + " messages");
        }

        IntegrationScope scope = new IntegrationScope(config, messageIds, streams, observer, now, env);

        HandlerCalls.runChecked(config, "IntegrationMessageHandler", "handleCommand", config.handler(), env.message(),
                () -> config.handler().handleCommand(ctx, scope, env.message()));

        return List.copyOf(scope.events());
    }

    @Override
    public void reset() {
        // no state
    }
}
