package com.questrail.testkit;

import com.questrail.testkit.api.CommandExecutor;
import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.OperationContext;

/**
 * Replaces the behavior of the executor returned by
 * {@link Test#commandExecutor()}, for example to simulate a failure.
 *
 * <p>{@code next} executes the command as it would be executed without the
 * interceptor.</p>
 */
@FunctionalInterface
public interface CommandExecutorInterceptor
{
    void intercept(OperationContext ctx, Message command, CommandExecutor next) throws Exception;
}
