package com.questrail.testkit;

import java.util.Objects;

/**
 * Installs a {@link CommandExecutorInterceptor} on the test's command
 * executor.
 *
 * <p>Passed to {@link Runner#begin} it applies for the whole test. Passed to
 * {@link Actions#call} it applies while that call runs and takes precedence
 * over the test's interceptor.</p>
 */
public final class InterceptCommandExecutor implements TestOption, CallOption {

    private final CommandExecutorInterceptor interceptor;

    InterceptCommandExecutor(CommandExecutorInterceptor interceptor) {
        this.interceptor = Objects.requireNonNull(interceptor, "interceptor");
    }

    @Override
    public void applyTo(TestOptions.Builder builder) {
        builder.interceptor(interceptor);
    }

    @Override
    public void applyTo(CallOptions.Builder builder) {
        builder.interceptor(interceptor);
    }
}
