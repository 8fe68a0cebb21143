package com.questrail.testkit.api;

/**
 * Receives an application's configuration.
 *
 * <p>Handlers are consulted in the order they are registered. That order
 * determines the order in which consumers of the same message are
 * invoked.</p>
 */
public interface ApplicationConfigurer
{
    void identity(String name, String key);

    void registerAggregate(AggregateMessageHandler<?> handler);

    void registerProcess(ProcessMessageHandler<?> handler);

    void registerIntegration(IntegrationMessageHandler handler);

    void registerProjection(ProjectionMessageHandler handler);
}
