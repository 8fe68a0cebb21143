package com.questrail.testkit.envelope;

import com.questrail.testkit.config.HandlerConfig;
import com.questrail.testkit.config.HandlerType;

import java.util.Objects;

/**
 * Describes the handler that produced a message.
 *
 * <p>{@code instanceId} is empty for messages produced by stateless
 * handlers.</p>
 */
public record Origin(HandlerConfig handler, String instanceId) {
    public Origin {
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(instanceId, "instanceId");
    }

    public HandlerType handlerType() {
        return handler.handlerType();
    }
}
