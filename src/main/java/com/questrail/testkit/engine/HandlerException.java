package com.questrail.testkit.engine;

import com.questrail.testkit.config.HandlerConfig;

import java.util.Objects;

/**
 * A recoverable error reported by a single handler during a dispatch or tick
 * cycle.
 */
public final class HandlerException extends Exception {

    private final HandlerConfig handler;

    public HandlerException(HandlerConfig handler, Exception cause) {
        super(handler.name() + " " + handler.handlerType() + ": " + cause.getMessage(), Objects.requireNonNull(cause, "cause"));
        this.handler = handler;
    }

    public HandlerConfig handler() {
        return handler;
    }
}
