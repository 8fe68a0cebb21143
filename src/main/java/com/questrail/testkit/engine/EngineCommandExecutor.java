package com.questrail.testkit.engine;

import com.questrail.testkit.api.CommandExecutor;
import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.OperationContext;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A {@link CommandExecutor} that dispatches commands through an engine.
 *
 * <p>The options are read for every command, so callers can supply options
 * that change between calls.</p>
 */
public final class EngineCommandExecutor implements CommandExecutor {

    private final Engine engine;
    private final Supplier<? extends List<OperationOption>> options;

    public EngineCommandExecutor(Engine engine, OperationOption... options) {
        this(engine, () -> List.of(options));
    }

    public EngineCommandExecutor(Engine engine, Supplier<? extends List<OperationOption>> options) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * @throws IllegalArgumentException if the message is not routed as a
     *         command
     */
    @Override
    public void executeCommand(OperationContext ctx, Message command) throws EngineException {
        Objects.requireNonNull(command, "command");

        if (engine.router().kindOf(command.getClass()).orElse(null) != MessageKind.COMMAND) {
            throw new IllegalArgumentException(String.format(
                    "cannot execute %s, it is not a recognized command type",
                    command.getClass().getName()));
        }

        engine.dispatch(ctx, command, options.get().toArray(new OperationOption[0]));
    }
}
