package com.questrail.testkit.engine;

import com.questrail.testkit.api.Application;
import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.MessageValidationException;
import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.api.ValidationScope;
import com.questrail.testkit.config.AggregateConfig;
import com.questrail.testkit.config.ApplicationConfig;
import com.questrail.testkit.config.ConfigurationException;
import com.questrail.testkit.config.HandlerConfig;
import com.questrail.testkit.config.IntegrationConfig;
import com.questrail.testkit.config.ProcessConfig;
import com.questrail.testkit.config.ProjectionConfig;
import com.questrail.testkit.engine.internal.Controller;
import com.questrail.testkit.engine.internal.aggregate.AggregateController;
import com.questrail.testkit.engine.internal.integration.IntegrationController;
import com.questrail.testkit.engine.internal.process.ProcessController;
import com.questrail.testkit.engine.internal.projection.ProjectionController;
import com.questrail.testkit.engine.time.SystemWallClock;
import com.questrail.testkit.engine.time.WallClock;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.envelope.EventStreams;
import com.questrail.testkit.envelope.MessageIdGenerator;
import com.questrail.testkit.fact.DispatchFact;
import com.questrail.testkit.fact.FactObserver;
import com.questrail.testkit.fact.HandlerSkipReason;
import com.questrail.testkit.fact.HandlingFact;
import com.questrail.testkit.fact.TickFact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Engine
 * =============================================================================
 * Deterministic, in-memory engine that runs an application's message handlers
 * for testing.
 *
 * <h2>Dispatch</h2>
 * <p>{@link #dispatch} wraps a command or event in a root envelope and drains
 * a FIFO queue: each envelope is offered to every consumer of its type, and
 * the messages they produce are appended to the queue. The result is a
 * breadth-first traversal of the causal tree rooted at the dispatched
 * message.</p>
 *
 * <h2>Tick</h2>
 * <p>{@link #tick} gives every controller a chance to perform time-based work
 * (releasing due process timeouts, compacting projections) and then drains
 * whatever that work produced.</p>
 *
 * <h2>Errors</h2>
 * <p>Handler errors are recorded on the fact stream and collected into a
 * single {@link EngineException} once the queue is empty. Unchecked
 * exceptions abandon the operation immediately.</p>
 *
 * <h2>Threading</h2>
 * <p>An engine is not thread-safe. Operations must not overlap.</p>
 */
public final class Engine
{
    private static final Logger log = LoggerFactory.getLogger(Engine.class);

    private final ApplicationConfig config;
    private final Router router;
    private final List<Controller> controllers;
    private final MessageIdGenerator messageIds;
    private final EventStreams streams;
    private final List<Runnable> resetters;
    private final WallClock wallClock;
    private final EngineTiming timing;

    private Engine(Builder b, ApplicationConfig config) {
        this.config = config;
        this.messageIds = new MessageIdGenerator();
        this.streams = new EventStreams();
        this.resetters = List.copyOf(b.resetters);
        this.wallClock = b.wallClock;
        this.timing = b.timing;

        List<Controller> list = new ArrayList<>();
        for (HandlerConfig h : config.handlers()) {
            list.add(newController(h, b.compactDuringHandling));
        }
        this.controllers = List.copyOf(list);
        this.router = new Router(config, controllers);
    }

    public static Builder builder(Application app) {
        return new Builder(app);
    }

    public ApplicationConfig configuration() {
        return config;
    }

    public Router router() {
        return router;
    }

    public EngineTiming timing() {
        return timing;
    }

    public WallClock wallClock() {
        return wallClock;
    }

    /**
     * Dispatches a command or event and every message it causes.
     *
     * <p>A message whose type has no route is recorded as a skipped cycle and
     * otherwise ignored.</p>
     *
     * @throws IllegalArgumentException if the message is a timeout or fails
     *         validation, or an option names an unknown handler
     * @throws EngineException if any handler reported an error or the
     *         operation was cancelled
     */
    public void dispatch(OperationContext ctx, Message message, OperationOption... options) throws EngineException {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(message, "message");

        OperationOptions oo = OperationOptions.resolve(config, wallClock, Arrays.asList(options));
        FactObserver observer = oo.observer();

        Optional<MessageKind> kind = router.kindOf(message.getClass());
        if (kind.isEmpty()) {
            observer.onFact(new DispatchFact.CycleSkipped(
                    message, oo.now(), oo.enabledHandlerTypes(), oo.enabledHandlers()));
            return;
        }

        Envelope env;
        switch (kind.get()) {
            case COMMAND:
                validate(message, ValidationScope.forCommand());
                env = Envelope.newCommand(messageIds.next(), message, oo.now());
                break;
            case EVENT:
                validate(message, ValidationScope.forEvent());
                env = Envelope.newEvent(messageIds.next(), message, oo.now(), streams.next(config.identity()));
                break;
            default:
                throw new IllegalArgumentException(String.format(
                        "cannot dispatch %s, timeout messages can only be scheduled by processes",
                        message.getClass().getName()));
        }

        observer.onFact(new DispatchFact.CycleBegun(env, oo.now(), oo.enabledHandlerTypes(), oo.enabledHandlers()));

        Deque<Envelope> queue = new ArrayDeque<>();
        queue.add(env);

        List<Exception> errors = new ArrayList<>();
        drain(ctx, oo, queue, errors);

        EngineException error = errors.isEmpty() ? null : new EngineException(errors);
        observer.onFact(new DispatchFact.CycleCompleted(env, error, oo.enabledHandlerTypes(), oo.enabledHandlers()));

        if (error != null) {
            throw error;
        }
    }

    /**
     * Performs time-based work for every enabled handler and dispatches the
     * messages it produces.
     *
     * @throws EngineException if any handler reported an error or the
     *         operation was cancelled
     */
    public void tick(OperationContext ctx, OperationOption... options) throws EngineException {
        Objects.requireNonNull(ctx, "ctx");

        OperationOptions oo = OperationOptions.resolve(config, wallClock, Arrays.asList(options));
        FactObserver observer = oo.observer();

        observer.onFact(new TickFact.CycleBegun(oo.now(), oo.enabledHandlerTypes(), oo.enabledHandlers()));

        Deque<Envelope> queue = new ArrayDeque<>();
        List<Exception> errors = new ArrayList<>();
        boolean cancelled = false;

        for (Controller c : controllers) {
            HandlerConfig h = c.handlerConfig();

            Optional<HandlerSkipReason> skip = oo.skipReason(h);
            if (skip.isPresent()) {
                observer.onFact(new TickFact.Skipped(h, skip.get()));
                continue;
            }

            observer.onFact(new TickFact.Begun(h));

            Exception error = null;
            try {
                queue.addAll(c.tick(ctx, observer, oo.now()));
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                error = e;
                errors.add(new HandlerException(h, e));
            }

            observer.onFact(new TickFact.Completed(h, error));

            if (ctx.isCancelled()) {
                errors.add(new CancellationException("operation cancelled"));
                cancelled = true;
                break;
            }
        }

        if (!cancelled) {
            drain(ctx, oo, queue, errors);
        }

        EngineException error = errors.isEmpty() ? null : new EngineException(errors);
        observer.onFact(new TickFact.CycleCompleted(error, oo.enabledHandlerTypes(), oo.enabledHandlers()));

        if (error != null) {
            throw error;
        }
    }

    /**
     * Discards all handler state, resets message IDs and stream offsets, then
     * runs the registered resetters in registration order.
     */
    public void reset() {
        for (Controller c : controllers) {
            c.reset();
        }
        messageIds.reset();
        streams.reset();

        for (Runnable r : resetters) {
            r.run();
        }

        log.debug("engine reset: application={} handlers={} resetters={}",
                config.identity(), controllers.size(), resetters.size());
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void drain(OperationContext ctx, OperationOptions oo, Deque<Envelope> queue, List<Exception> errors) {
        FactObserver observer = oo.observer();

        while (!queue.isEmpty()) {
            Envelope env = queue.removeFirst();

            observer.onFact(new DispatchFact.Begun(env));

            List<Exception> envelopeErrors = new ArrayList<>();

            for (Controller c : router.route(env)) {
                HandlerConfig h = c.handlerConfig();

                Optional<HandlerSkipReason> skip = oo.skipReason(h);
                if (skip.isPresent()) {
                    observer.onFact(new HandlingFact.Skipped(h, env, skip.get()));
                    continue;
                }

                observer.onFact(new HandlingFact.Begun(h, env));

                List<Envelope> produced = List.of();
                Exception error = null;
                try {
                    produced = c.handle(ctx, observer, oo.now(), env);
                } catch (MessageValidationException e) {
                    // a message that passed validation when it was produced
                    error = e;
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    error = e;
                }

                observer.onFact(new HandlingFact.Completed(h, env, error));

                if (error != null) {
                    envelopeErrors.add(new HandlerException(h, error));
                } else {
                    queue.addAll(produced);
                }
            }

            Exception envelopeError = null;
            if (envelopeErrors.size() == 1) {
                envelopeError = envelopeErrors.get(0);
            } else if (!envelopeErrors.isEmpty()) {
                envelopeError = new EngineException(envelopeErrors);
            }
            observer.onFact(new DispatchFact.Completed(env, envelopeError));

            errors.addAll(envelopeErrors);

            if (ctx.isCancelled()) {
                errors.add(new CancellationException("operation cancelled"));
                return;
            }
        }
    }

    private static void validate(Message message, ValidationScope scope) {
        try {
            message.validate(scope);
        } catch (MessageValidationException e) {
            throw new IllegalArgumentException(String.format(
                    "cannot dispatch invalid %s %s: %s",
                    message.getClass().getName(), scope.kind(), e.getMessage()), e);
        }
    }

    private Controller newController(HandlerConfig h, boolean compactDuringHandling) {
        if (h instanceof AggregateConfig a) {
            return AggregateController.create(a, messageIds, streams);
        }
        if (h instanceof ProcessConfig p) {
            return ProcessController.create(p, messageIds);
        }
        if (h instanceof IntegrationConfig i) {
            return new IntegrationController(i, messageIds, streams);
        }
        if (h instanceof ProjectionConfig p) {
            return new ProjectionController(p, timing.compactionInterval(), compactDuringHandling);
        }
        throw new IllegalStateException("unsupported handler type: " + h.handlerType());
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private final Application app;
        private final List<Runnable> resetters = new ArrayList<>();
        private boolean compactDuringHandling;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private EngineTiming timing = EngineTiming.defaults();

        private Builder(Application app) {
            this.app = Objects.requireNonNull(app, "app");
        }

        /**
         * Adds a function that is called whenever the engine is reset, used to
         * reset external state the application's handlers depend on.
         */
        public Builder withResetter(Runnable resetter) {
            resetters.add(Objects.requireNonNull(resetter, "resetter"));
            return this;
        }

        /**
         * When enabled, every projection event also runs a concurrent
         * compaction of the same projection.
         */
        public Builder enableProjectionCompactionDuringHandling(boolean enabled) {
            this.compactDuringHandling = enabled;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        public Builder withTiming(EngineTiming timing) {
            this.timing = Objects.requireNonNull(timing, "timing");
            return this;
        }

        /**
         * @throws ConfigurationException if the application's configuration
         *         is invalid
         */
        public Engine build() throws ConfigurationException {
            ApplicationConfig config = ApplicationConfig.of(app);
            Engine engine = new Engine(this, config);

            log.info("engine built: application={} handlers={} compactDuringHandling={}",
                    config.identity(), config.handlers().size(), compactDuringHandling);

            return engine;
        }
    }
}
