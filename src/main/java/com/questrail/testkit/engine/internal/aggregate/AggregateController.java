package com.questrail.testkit.engine.internal.aggregate;

import com.questrail.testkit.api.AggregateMessageHandler;
import com.questrail.testkit.api.AggregateRoot;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.config.AggregateConfig;
import com.questrail.testkit.engine.UnexpectedBehaviorException;
import com.questrail.testkit.engine.internal.Controller;
import com.questrail.testkit.engine.internal.HandlerCalls;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.envelope.EventStreams;
import com.questrail.testkit.envelope.MessageIdGenerator;
import com.questrail.testkit.fact.AggregateFact;
import com.questrail.testkit.fact.FactObserver;
import com.questrail.testkit.location.Location;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * AggregateController
 * =============================================================================
 * Drives an aggregate message handler.
 *
 * <h2>Per command</h2>
 * <ol>
 *   <li>route the command to an instance ID</li>
 *   <li>build a fresh root and replay the instance's history onto it</li>
 *   <li>invoke the handler with a scope that captures recorded events</li>
 *   <li>append the new events to the history, or drop the history if the
 *       instance was destroyed</li>
 * </ol>
 *
 * <p>An instance exists exactly when its history is non-empty. If an
 * instance is destroyed and re-created within one call, only the events
 * recorded after the destruction are kept, so replaying the history always
 * rebuilds the root the handler last saw.</p>
 *
 * @param <R> the aggregate root type
 */
public final class AggregateController<R extends AggregateRoot> implements Controller
{
    private static final String INTERFACE = "AggregateMessageHandler";

    private final AggregateConfig config;
    private final AggregateMessageHandler<R> handler;
    private final MessageIdGenerator messageIds;
    private final EventStreams streams;

    private final Map<String, List<Envelope>> histories = new HashMap<>();

    private AggregateController(
            AggregateConfig config,
            AggregateMessageHandler<R> handler,
            MessageIdGenerator messageIds,
            EventStreams streams
    ) {
        this.config = config;
        this.handler = handler;
        this.messageIds = messageIds;
        this.streams = streams;
    }

    public static AggregateController<?> create(
            AggregateConfig config,
            MessageIdGenerator messageIds,
            EventStreams streams
    ) {
        Objects.requireNonNull(config, "config");
        return capture(config, config.handler(), messageIds, streams);
    }

    private static <R extends AggregateRoot> AggregateController<R> capture(
            AggregateConfig config,
            AggregateMessageHandler<R> handler,
            MessageIdGenerator messageIds,
            EventStreams streams
    ) {
        return new AggregateController<>(config, handler, messageIds, streams);
    }

    @Override
    public AggregateConfig handlerConfig() {
        return config;
    }

    @Override
    public List<Envelope> tick(OperationContext ctx, FactObserver observer, Instant now) {
        return List.of();
    }

    @Override
    public List<Envelope> handle(OperationContext ctx, FactObserver observer, Instant now, Envelope env) {
        if (env.kind() != MessageKind.COMMAND || !config.consumes(env.messageType())) {
            throw new IllegalStateException(config.identity() + " does not handle " + env.messageType().getName() + " messages");
        }

        String id = HandlerCalls.call(config, INTERFACE, "routeCommandToInstance", handler, env.message(),
                () -> handler.routeCommandToInstance(env.message()));

        if (id == null || id.isEmpty()) {
            throw new UnexpectedBehaviorException(
                    config,
                    INTERFACE,
                    "routeCommandToInstance",
                    handler,
                    env.message(),
                    String.format("routed a command of type %s to an empty ID", env.messageType().getName()),
                    Location.ofMethod(handler, "routeCommandToInstance"));
        }

        List<Envelope> history = histories.get(id);
        boolean exists = history != null;
        R root = newRoot(config, handler, env);

        if (exists) {
            for (Envelope historical : history) {
                HandlerCalls.run(config, "AggregateRoot", "applyEvent", root, historical.message(),
                        () -> root.applyEvent(historical.message()));
            }
            observer.onFact(new AggregateFact.InstanceLoaded(config, id, root, env));
        } else {
            observer.onFact(new AggregateFact.InstanceNotFound(config, id, env));
        }

        AggregateScope<R> scope = new AggregateScope<>(
                config, handler, id, messageIds, streams, observer, now, env, root, exists);

        HandlerCalls.run(config, INTERFACE, "handleCommand", handler, env.message(),
                () -> handler.handleCommand(root, scope, env.message()));

        if (scope.exists()) {
            List<Envelope> updated = scope.wasDestroyed() || history == null
                    ? new ArrayList<>()
                    : history;
            updated.addAll(scope.eventsSinceDestroyed());
            histories.put(id, updated);
        } else {
            histories.remove(id);
        }

        return List.copyOf(scope.events());
    }

    @Override
    public void reset() {
        histories.clear();
    }

    static <R extends AggregateRoot> R newRoot(AggregateConfig config, AggregateMessageHandler<R> handler, Envelope env) {
        R root = HandlerCalls.call(config, INTERFACE, "newRoot", handler, env.message(), handler::newRoot);
        if (root == null) {
            throw new UnexpectedBehaviorException(
                    config,
                    INTERFACE,
                    "newRoot",
                    handler,
                    env.message(),
                    "returned a null AggregateRoot",
                    Location.ofMethod(handler, "newRoot"));
        }
        return root;
    }
}
