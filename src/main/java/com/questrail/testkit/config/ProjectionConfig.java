package com.questrail.testkit.config;

import com.questrail.testkit.api.ProjectionMessageHandler;

/**
 * Configuration of a projection message handler.
 */
public final class ProjectionConfig extends HandlerConfig
{
    private final ProjectionMessageHandler handler;

    private ProjectionConfig(ProjectionMessageHandler handler, Collected collected) {
        super(collected);
        this.handler = handler;
    }

    public static ProjectionConfig of(ProjectionMessageHandler handler) throws ConfigurationException {
        return new ProjectionConfig(handler, collect(handler, HandlerType.PROJECTION, handler::configure));
    }

    @Override
    public HandlerType handlerType() {
        return HandlerType.PROJECTION;
    }

    @Override
    public ProjectionMessageHandler handler() {
        return handler;
    }
}
