package com.questrail.testkit.config;

import com.questrail.testkit.api.IntegrationMessageHandler;

/**
 * Configuration of a integration message handler.
 */
public final class IntegrationConfig extends HandlerConfig
{
    private final IntegrationMessageHandler handler;

    private IntegrationConfig(IntegrationMessageHandler handler, Collected collected) {
        super(collected);
        this.handler = handler;
    }

    public static IntegrationConfig of(IntegrationMessageHandler handler) throws ConfigurationException {
        return new IntegrationConfig(handler, collect(handler, HandlerType.INTEGRATION, handler::configure));
    }

    @Override
    public HandlerType handlerType() {
        return HandlerType.INTEGRATION;
    }

    @Override
    public IntegrationMessageHandler handler() {
        return handler;
    }
}
