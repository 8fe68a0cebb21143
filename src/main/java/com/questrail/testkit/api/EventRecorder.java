package com.questrail.testkit.api;

/**
 * Records events on behalf of code outside of any message handler.
 */
public interface EventRecorder
{
    void recordEvent(OperationContext ctx, Message event) throws Exception;
}
