package com.questrail.testkit;

import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.MessageValidationException;
import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.api.ValidationScope;
import com.questrail.testkit.engine.EngineCommandExecutor;
import com.questrail.testkit.engine.EngineEventRecorder;
import com.questrail.testkit.engine.OperationOption;
import com.questrail.testkit.expectation.PredicateOptions;
import com.questrail.testkit.location.Location;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Actions
 * =============================================================================
 * Factory methods for the built-in {@link Action} implementations.
 *
 * <h2>Actions</h2>
 * <ul>
 *   <li>{@link #executeCommand}: dispatch a command as if by a user</li>
 *   <li>{@link #recordEvent}: dispatch an event as if recorded elsewhere</li>
 *   <li>{@link #advanceTime}: move the virtual clock and tick the engine</li>
 *   <li>{@link #call}: run arbitrary code that uses the test's
 *       {@link Test#commandExecutor()} or {@link Test#eventRecorder()}</li>
 * </ul>
 */
public final class Actions {

    private Actions() {
    }

    /**
     * @throws IllegalArgumentException if {@code command} is null or invalid
     */
    public static Action executeCommand(Message command) {
        return dispatch("executeCommand", command, MessageKind.COMMAND);
    }

    /**
     * @throws IllegalArgumentException if {@code event} is null or invalid
     */
    public static Action recordEvent(Message event) {
        return dispatch("recordEvent", event, MessageKind.EVENT);
    }

    public static Action advanceTime(TimeAdjustment adjustment) {
        return advanceTime(adjustment, Location.ofCall());
    }

    /**
     * Runs {@code body}. Messages it dispatches through the test's executor or
     * recorder count as produced when checking expectations.
     *
     * @see TestOption#interceptCommandExecutor
     */
    public static Action call(CallBody body, CallOption... options) {
        return call(body, List.of(options), Location.ofCall());
    }

    /**
     * User code run by {@link #call}.
     */
    @FunctionalInterface
    public interface CallBody
    {
        void call() throws Exception;
    }

    // ---------------------------------------------------------------------
    // Located factories, for builders that capture their caller's location
    // ---------------------------------------------------------------------

    static Action advanceTime(TimeAdjustment adjustment, Location location) {
        if (adjustment == null) {
            throw new IllegalArgumentException("advanceTime(<null>): adjustment must not be null");
        }
        return new AdvanceTimeAction(adjustment, location);
    }

    static Action call(CallBody body, List<? extends CallOption> options, Location location) {
        if (body == null) {
            throw new IllegalArgumentException("call(<null>): function must not be null");
        }
        return new CallAction(body, CallOptions.resolve(options), location);
    }

    private static Action dispatch(String name, Message m, MessageKind kind) {
        // skip this method and the public factory
        return dispatch(name, m, kind, Location.ofCaller(2));
    }

    static Action dispatch(String name, Message m, MessageKind kind, Location location) {
        if (m == null) {
            throw new IllegalArgumentException(name + "(<null>): message must not be null");
        }

        try {
            m.validate(new ValidationScope(kind));
        } catch (MessageValidationException e) {
            throw new IllegalArgumentException(String.format(
                    "%s(%s): %s", name, m.getClass().getName(), e.getMessage()), e);
        }

        return new DispatchAction(m, kind, location);
    }

    // ---------------------------------------------------------------------
    // Implementations
    // ---------------------------------------------------------------------

    private record DispatchAction(Message message, MessageKind kind, Location location) implements Action {

        @Override
        public String caption() {
            String type = message.getClass().getName();
            return kind == MessageKind.COMMAND
                    ? String.format("executing %s command", type)
                    : String.format("recording %s event", type);
        }

        @Override
        public void run(OperationContext ctx, ActionScope scope) throws Exception {
            String verb = kind == MessageKind.COMMAND ? "execute command" : "record event";
            Class<?> type = message.getClass();

            Optional<MessageKind> configured = scope.app().kindOf(type);
            if (configured.isEmpty()) {
                throw new ActionException(String.format(
                        "cannot %s, %s is not a recognized message type", verb, type.getName()));
            }
            if (configured.get() != kind) {
                throw new ActionException(String.format(
                        "cannot %s, %s is configured as %s %s", verb, type.getName(),
                        configured.get() == MessageKind.EVENT ? "an" : "a", configured.get()));
            }

            scope.engine().dispatch(ctx, message, scope.operationOptionArray());
        }
    }

    private record AdvanceTimeAction(TimeAdjustment adjustment, Location location) implements Action {

        @Override
        public String caption() {
            return "advancing time " + adjustment.description();
        }

        @Override
        public void run(OperationContext ctx, ActionScope scope) throws Exception {
            Instant now = adjustment.step(scope.virtualClock());

            if (now.isBefore(scope.virtualClock())) {
                throw new ActionException(String.format(
                        "adjusting the clock %s would reverse time", adjustment.description()));
            }

            scope.virtualClock(now);
            scope.addOperationOption(OperationOption.withCurrentTime(now));

            scope.engine().tick(ctx, scope.operationOptionArray());
        }
    }

    private record CallAction(CallBody body, CallOptions options, Location location) implements Action {

        @Override
        public String caption() {
            return "calling user-defined function";
        }

        @Override
        public PredicateOptions configurePredicate(PredicateOptions options) {
            return options.withMatchDispatchCycleStartedFacts(true);
        }

        @Override
        public void run(OperationContext ctx, ActionScope scope) throws Exception {
            List<OperationOption> operationOptions = scope.operationOptions();
            BoundCommandExecutor executor = scope.executor();

            executor.bind(new EngineCommandExecutor(scope.engine(), () -> operationOptions));
            scope.recorder().bind(new EngineEventRecorder(scope.engine(), () -> operationOptions));

            Optional<CommandExecutorInterceptor> interceptor = options.interceptor();
            CommandExecutorInterceptor prev = interceptor.isPresent()
                    ? executor.intercept(interceptor.get())
                    : null;

            try {
                scope.testingT().log("--- CALLING USER-DEFINED FUNCTION ---");
                body.call();
            } finally {
                if (interceptor.isPresent()) {
                    executor.intercept(prev);
                }
                executor.unbind();
                scope.recorder().unbind();
            }
        }
    }
}
