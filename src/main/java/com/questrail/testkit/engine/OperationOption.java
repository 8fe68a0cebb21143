package com.questrail.testkit.engine;

import com.questrail.testkit.config.HandlerType;
import com.questrail.testkit.fact.FactObserver;

import java.time.Instant;
import java.util.Objects;

/**
 * OperationOption
 * -----------------------------------------------------------------------------
 * Adjusts the behaviour of a single {@link Engine#dispatch} or
 * {@link Engine#tick} call.
 *
 * <p>Options are applied in order, so a later option overrides an earlier one
 * that sets the same thing. Observers are additive.</p>
 */
@FunctionalInterface
public interface OperationOption
{
    void applyTo(OperationOptions.Builder options);

    static OperationOption enableAggregates(boolean enabled) {
        return enableHandlerType(HandlerType.AGGREGATE, enabled);
    }

    static OperationOption enableProcesses(boolean enabled) {
        return enableHandlerType(HandlerType.PROCESS, enabled);
    }

    static OperationOption enableIntegrations(boolean enabled) {
        return enableHandlerType(HandlerType.INTEGRATION, enabled);
    }

    static OperationOption enableProjections(boolean enabled) {
        return enableHandlerType(HandlerType.PROJECTION, enabled);
    }

    static OperationOption enableHandlerType(HandlerType type, boolean enabled) {
        Objects.requireNonNull(type, "type");
        return o -> o.enableHandlerType(type, enabled);
    }

    /**
     * Enables or disables a specific handler by name, overriding both its
     * configuration and its handler type's setting.
     */
    static OperationOption enableHandler(String name, boolean enabled) {
        Objects.requireNonNull(name, "name");
        return o -> o.enableHandler(name, enabled);
    }

    /**
     * Sets the engine time for the operation. Defaults to the engine's wall
     * clock.
     */
    static OperationOption withCurrentTime(Instant now) {
        Objects.requireNonNull(now, "now");
        return o -> o.currentTime(now);
    }

    static OperationOption withObserver(FactObserver observer) {
        Objects.requireNonNull(observer, "observer");
        return o -> o.addObserver(observer);
    }
}
