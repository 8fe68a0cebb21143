package com.questrail.testkit.config;

import com.questrail.testkit.api.AggregateMessageHandler;

/**
 * Configuration of a aggregate message handler.
 */
public final class AggregateConfig extends HandlerConfig
{
    private final AggregateMessageHandler<?> handler;

    private AggregateConfig(AggregateMessageHandler<?> handler, Collected collected) {
        super(collected);
        this.handler = handler;
    }

    public static AggregateConfig of(AggregateMessageHandler<?> handler) throws ConfigurationException {
        return new AggregateConfig(handler, collect(handler, HandlerType.AGGREGATE, handler::configure));
    }

    @Override
    public HandlerType handlerType() {
        return HandlerType.AGGREGATE;
    }

    @Override
    public AggregateMessageHandler<?> handler() {
        return handler;
    }
}
