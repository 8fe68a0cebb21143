package com.questrail.testkit.config;

import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.RouteType;

import java.util.EnumSet;
import java.util.Set;

/**
 * The four kinds of message handler.
 *
 * <p>Each type carries the route types it may declare and the ones it must
 * declare at least once.</p>
 */
public enum HandlerType
{
    AGGREGATE("aggregate",
            EnumSet.of(RouteType.HANDLES_COMMAND, RouteType.RECORDS_EVENT),
            EnumSet.of(RouteType.HANDLES_COMMAND, RouteType.RECORDS_EVENT)),

    PROCESS("process",
            EnumSet.of(RouteType.HANDLES_EVENT, RouteType.EXECUTES_COMMAND, RouteType.SCHEDULES_TIMEOUT),
            EnumSet.of(RouteType.HANDLES_EVENT, RouteType.EXECUTES_COMMAND)),

    INTEGRATION("integration",
            EnumSet.of(RouteType.HANDLES_COMMAND, RouteType.RECORDS_EVENT),
            EnumSet.of(RouteType.HANDLES_COMMAND)),

    PROJECTION("projection",
            EnumSet.of(RouteType.HANDLES_EVENT),
            EnumSet.of(RouteType.HANDLES_EVENT));

    private final String label;
    private final Set<RouteType> allowedRoutes;
    private final Set<RouteType> requiredRoutes;

    HandlerType(String label, Set<RouteType> allowedRoutes, Set<RouteType> requiredRoutes) {
        this.label = label;
        this.allowedRoutes = allowedRoutes;
        this.requiredRoutes = requiredRoutes;
    }

    public Set<RouteType> allowedRoutes() {
        return EnumSet.copyOf(allowedRoutes);
    }

    public Set<RouteType> requiredRoutes() {
        return EnumSet.copyOf(requiredRoutes);
    }

    /**
     * Returns true if handlers of this type may produce messages of the given
     * kind.
     */
    public boolean isProducerOf(MessageKind kind) {
        return allowedRoutes.stream().anyMatch(r -> r.isOutbound() && r.kind() == kind);
    }

    /**
     * Returns true if handlers of this type may consume messages of the given
     * kind.
     */
    public boolean isConsumerOf(MessageKind kind) {
        return allowedRoutes.stream().anyMatch(r -> r.isInbound() && r.kind() == kind);
    }

    @Override
    public String toString() {
        return label;
    }
}
