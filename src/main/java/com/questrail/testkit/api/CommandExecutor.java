package com.questrail.testkit.api;

/**
 * Executes commands on behalf of code outside of any message handler.
 */
public interface CommandExecutor
{
    void executeCommand(OperationContext ctx, Message command) throws Exception;
}
