package com.questrail.testkit.api;

/**
 * Integrates the application with an external system. Integrations are
 * stateless as far as the engine is concerned.
 */
public interface IntegrationMessageHandler
{
    void configure(HandlerConfigurer configurer);

    void handleCommand(OperationContext ctx, IntegrationCommandScope scope, Message command) throws Exception;
}
