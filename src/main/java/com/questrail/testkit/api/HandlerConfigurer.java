package com.questrail.testkit.api;

/**
 * Receives a handler's configuration.
 */
public interface HandlerConfigurer
{
    /**
     * Sets the handler's identity. Must be called exactly once.
     */
    void identity(String name, String key);

    /**
     * Declares the message routes of the handler. May be called more than once.
     */
    void routes(Route... routes);

    /**
     * Disables the handler. A disabled handler is never invoked, unless it is
     * explicitly enabled by an operation option.
     */
    void disable();
}
