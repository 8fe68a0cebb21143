package com.questrail.testkit.engine.internal;

import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.UnexpectedMessageException;
import com.questrail.testkit.config.HandlerConfig;
import com.questrail.testkit.engine.UnexpectedMessageFailure;

import java.util.function.Supplier;

/**
 * Invokes handler callbacks, converting {@link UnexpectedMessageException} into
 * an {@link UnexpectedMessageFailure} that names the handler and method.
 */
public final class HandlerCalls {

    private HandlerCalls() {
    }

    /**
     * A handler callback that may report a handler error.
     */
    @FunctionalInterface
    public interface Callback<T> {
        T call() throws Exception;
    }

    @FunctionalInterface
    public interface VoidCallback {
        void call() throws Exception;
    }

    public static <T> T call(
            HandlerConfig handler,
            String interfaceName,
            String method,
            Object implementation,
            Message message,
            Supplier<T> callback
    ) {
        try {
            return callback.get();
        } catch (UnexpectedMessageException e) {
            throw new UnexpectedMessageFailure(handler, interfaceName, method, implementation, message, e);
        }
    }

    public static void run(
            HandlerConfig handler,
            String interfaceName,
            String method,
            Object implementation,
            Message message,
            Runnable callback
    ) {
        call(handler, interfaceName, method, implementation, message, () -> {
            callback.run();
            return null;
        });
    }

    public static <T> T callChecked(
            HandlerConfig handler,
            String interfaceName,
            String method,
            Object implementation,
            Message message,
            Callback<T> callback
    ) throws Exception {
        try {
            return callback.call();
        } catch (UnexpectedMessageException e) {
            throw new UnexpectedMessageFailure(handler, interfaceName, method, implementation, message, e);
        }
    }

    public static void runChecked(
            HandlerConfig handler,
            String interfaceName,
            String method,
            Object implementation,
            Message message,
            VoidCallback callback
    ) throws Exception {
        callChecked(handler, interfaceName, method, implementation, message, () -> {
            callback.call();
            return null;
        });
    }
}
