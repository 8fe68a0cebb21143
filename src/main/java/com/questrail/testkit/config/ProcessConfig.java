package com.questrail.testkit.config;

import com.questrail.testkit.api.ProcessMessageHandler;

/**
 * Configuration of a process message handler.
 */
public final class ProcessConfig extends HandlerConfig
{
    private final ProcessMessageHandler<?> handler;

    private ProcessConfig(ProcessMessageHandler<?> handler, Collected collected) {
        super(collected);
        this.handler = handler;
    }

    public static ProcessConfig of(ProcessMessageHandler<?> handler) throws ConfigurationException {
        return new ProcessConfig(handler, collect(handler, HandlerType.PROCESS, handler::configure));
    }

    @Override
    public HandlerType handlerType() {
        return HandlerType.PROCESS;
    }

    @Override
    public ProcessMessageHandler<?> handler() {
        return handler;
    }
}
