package com.questrail.testkit.engine.internal.process;

import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.api.ProcessMessageHandler;
import com.questrail.testkit.api.ProcessRoot;
import com.questrail.testkit.config.ProcessConfig;
import com.questrail.testkit.engine.UnexpectedBehaviorException;
import com.questrail.testkit.engine.internal.Controller;
import com.questrail.testkit.engine.internal.HandlerCalls;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.envelope.MessageIdGenerator;
import com.questrail.testkit.envelope.Origin;
import com.questrail.testkit.fact.FactObserver;
import com.questrail.testkit.fact.ProcessFact;
import com.questrail.testkit.location.Location;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ProcessController
 * =============================================================================
 * Drives a process message handler and owns its timeout queue.
 *
 * <h2>Instances</h2>
 * <p>An instance begins the first time an event is routed to it and ends when
 * the handler calls {@code end()} without reverting it in the same call.
 * Ended instance IDs are retained; events and timeouts routed to them are
 * dropped with a distinguishing fact.</p>
 *
 * <h2>Timeouts</h2>
 * <p>Pending timeouts are kept ordered by their scheduled time, with ties
 * kept in the order they were scheduled. {@link #tick} releases the prefix
 * that is due. Ending an instance cancels its pending timeouts.</p>
 *
 * @param <R> the process root type
 */
public final class ProcessController<R extends ProcessRoot> implements Controller
{
    private static final String INTERFACE = "ProcessMessageHandler";

    private final ProcessConfig config;
    private final ProcessMessageHandler<R> handler;
    private final MessageIdGenerator messageIds;

    private final Map<String, Instance<R>> instances = new HashMap<>();
    private final List<Envelope> timeouts = new ArrayList<>();

    private ProcessController(ProcessConfig config, ProcessMessageHandler<R> handler, MessageIdGenerator messageIds) {
        this.config = config;
        this.handler = handler;
        this.messageIds = messageIds;
    }

    public static ProcessController<?> create(ProcessConfig config, MessageIdGenerator messageIds) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(messageIds, "messageIds");
        return capture(config, config.handler(), messageIds);
    }

    private static <R extends ProcessRoot> ProcessController<R> capture(
            ProcessConfig config,
            ProcessMessageHandler<R> handler,
            MessageIdGenerator messageIds
    ) {
        return new ProcessController<>(config, handler, messageIds);
    }

    @Override
    public ProcessConfig handlerConfig() {
        return config;
    }

    @Override
    public List<Envelope> tick(OperationContext ctx, FactObserver observer, Instant now) {
        int due = 0;
        for (Envelope env : timeouts) {
            if (env.scheduledFor().orElseThrow().isAfter(now)) {
                break;
            }
            due++;
        }

        List<Envelope> released = new ArrayList<>(timeouts.subList(0, due));
        timeouts.subList(0, due).clear();
        return released;
    }

    @Override
    public List<Envelope> handle(OperationContext ctx, FactObserver observer, Instant now, Envelope env) throws Exception {
        if (env.kind() == MessageKind.TIMEOUT) {
            return handleTimeout(ctx, observer, now, env);
        }

        if (env.kind() != MessageKind.EVENT || !config.consumes(env.messageType())) {
            throw new IllegalStateException(config.identity() + " does not handle " + env.messageType().getName() + " messages");
        }

        return handleEvent(ctx, observer, now, env);
    }

    /**
     * Returns the number of timeouts waiting for the virtual clock.
     */
    public int pendingTimeoutCount() {
        return timeouts.size();
    }

    @Override
    public void reset() {
        instances.clear();
        timeouts.clear();
    }

    // ---------------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------------

    private List<Envelope> handleEvent(OperationContext ctx, FactObserver observer, Instant now, Envelope env) throws Exception {
        Optional<String> routed = HandlerCalls.callChecked(config, INTERFACE, "routeEventToInstance", handler, env.message(),
                () -> handler.routeEventToInstance(ctx, env.message()));

        if (routed == null || routed.isEmpty()) {
            observer.onFact(new ProcessFact.EventIgnored(config, env));
            return List.of();
        }

        String id = routed.get();
        if (id.isEmpty()) {
            throw new UnexpectedBehaviorException(
                    config,
                    INTERFACE,
                    "routeEventToInstance",
                    handler,
                    env.message(),
                    String.format("routed an event of type %s to an empty ID", env.messageType().getName()),
                    Location.ofMethod(handler, "routeEventToInstance"));
        }

        Instance<R> instance = instances.get(id);
        if (instance != null && instance.ended) {
            observer.onFact(new ProcessFact.EventRoutedToEndedInstance(config, id, env));
            return List.of();
        }

        R root = load(observer, id, instance, env);
        ProcessInstanceScope.ForEvent scope = ProcessInstanceScope.forEvent(config, id, messageIds, observer, now, env, root);

        HandlerCalls.runChecked(config, INTERFACE, "handleEvent", handler, env.message(),
                () -> handler.handleEvent(ctx, root, scope, env.message()));

        return complete(id, root, scope);
    }

    // ---------------------------------------------------------------------
    // Timeouts
    // ---------------------------------------------------------------------

    private List<Envelope> handleTimeout(OperationContext ctx, FactObserver observer, Instant now, Envelope env) throws Exception {
        Origin origin = env.origin().orElseThrow(
                () -> new IllegalStateException("timeout " + env.messageId() + " has no origin"));

        if (origin.handler() != config) {
            throw new IllegalStateException(config.identity() + " did not schedule timeout " + env.messageId());
        }

        String id = origin.instanceId();
        Instance<R> instance = instances.get(id);
        if (instance == null || instance.ended) {
            observer.onFact(new ProcessFact.TimeoutRoutedToEndedInstance(config, id, env));
            return List.of();
        }

        R root = load(observer, id, instance, env);
        ProcessInstanceScope.ForTimeout scope = ProcessInstanceScope.forTimeout(config, id, messageIds, observer, now, env, root);

        HandlerCalls.runChecked(config, INTERFACE, "handleTimeout", handler, env.message(),
                () -> handler.handleTimeout(ctx, root, scope, env.message()));

        return complete(id, root, scope);
    }

    // ---------------------------------------------------------------------
    // Shared
    // ---------------------------------------------------------------------

    private R load(FactObserver observer, String id, Instance<R> instance, Envelope env) {
        if (instance != null) {
            observer.onFact(new ProcessFact.InstanceLoaded(config, id, instance.root, env));
            return instance.root;
        }

        observer.onFact(new ProcessFact.InstanceNotFound(config, id, env));

        R root = HandlerCalls.call(config, INTERFACE, "newRoot", handler, env.message(), handler::newRoot);
        if (root == null) {
            throw new UnexpectedBehaviorException(
                    config,
                    INTERFACE,
                    "newRoot",
                    handler,
                    env.message(),
                    "returned a null ProcessRoot",
                    Location.ofMethod(handler, "newRoot"));
        }

        observer.onFact(new ProcessFact.InstanceBegun(config, id, root, env));
        return root;
    }

    /**
     * Stores the instance and returns its commands followed by its ready
     * timeouts. Ready timeouts are returned even if the instance ended, and
     * are then routed back to the ended instance.
     */
    private List<Envelope> complete(String id, R root, ProcessInstanceScope scope) {
        if (scope.ended()) {
            instances.put(id, Instance.ended());
            timeouts.removeIf(t -> t.origin().map(o -> o.instanceId().equals(id)).orElse(false));
        } else {
            instances.put(id, Instance.active(root));

            if (!scope.pendingTimeouts().isEmpty()) {
                timeouts.addAll(scope.pendingTimeouts());
                timeouts.sort((a, b) -> a.scheduledFor().orElseThrow().compareTo(b.scheduledFor().orElseThrow()));
            }
        }

        List<Envelope> produced = new ArrayList<>(scope.commands());
        produced.addAll(scope.readyTimeouts());
        return produced;
    }

    private static final class Instance<R> {
        private final R root;
        private final boolean ended;

        private Instance(R root, boolean ended) {
            this.root = root;
            this.ended = ended;
        }

        static <R> Instance<R> active(R root) {
            return new Instance<>(root, false);
        }

        static <R> Instance<R> ended() {
            return new Instance<>(null, true);
        }
    }
}
