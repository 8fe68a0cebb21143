package com.questrail.testkit.engine;

import com.questrail.testkit.api.EventRecorder;
import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.OperationContext;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * An {@link EventRecorder} that dispatches events through an engine.
 */
public final class EngineEventRecorder implements EventRecorder {

    private final Engine engine;
    private final Supplier<? extends List<OperationOption>> options;

    public EngineEventRecorder(Engine engine, OperationOption... options) {
        this(engine, () -> List.of(options));
    }

    public EngineEventRecorder(Engine engine, Supplier<? extends List<OperationOption>> options) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * @throws IllegalArgumentException if the message is not routed as an
     *         event
     */
    @Override
    public void recordEvent(OperationContext ctx, Message event) throws EngineException {
        Objects.requireNonNull(event, "event");

        if (engine.router().kindOf(event.getClass()).orElse(null) != MessageKind.EVENT) {
            throw new IllegalArgumentException(String.format(
                    "cannot record %s, it is not a recognized event type",
                    event.getClass().getName()));
        }

        engine.dispatch(ctx, event, options.get().toArray(new OperationOption[0]));
    }
}
