package com.questrail.testkit;

import com.questrail.testkit.api.CommandExecutor;
import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.engine.EngineCommandExecutor;

/**
 * The {@link CommandExecutor} returned by {@link Test#commandExecutor()}.
 *
 * <p>It forwards to the engine only while a {@link Actions#call} action is
 * running. An installed {@link CommandExecutorInterceptor} is called instead,
 * with the engine executor as its {@code next}.</p>
 */
final class BoundCommandExecutor implements CommandExecutor {

    private EngineCommandExecutor next;
    private CommandExecutorInterceptor interceptor;

    synchronized void bind(EngineCommandExecutor next) {
        this.next = next;
    }

    synchronized void unbind() {
        this.next = null;
    }

    /**
     * Installs {@code fn}, or removes the interceptor if it is null.
     *
     * @return the previous interceptor, or null
     */
    synchronized CommandExecutorInterceptor intercept(CommandExecutorInterceptor fn) {
        CommandExecutorInterceptor prev = interceptor;
        interceptor = fn;
        return prev;
    }

    @Override
    public void executeCommand(OperationContext ctx, Message command) throws Exception {
        EngineCommandExecutor e;
        CommandExecutorInterceptor fn;
        synchronized (this) {
            e = next;
            fn = interceptor;
        }
        if (e == null) {
            throw new IllegalStateException("executeCommand(): cannot be called outside of a call action");
        }
        if (fn != null) {
            fn.intercept(ctx, command, e);
            return;
        }
        e.executeCommand(ctx, command);
    }
}
