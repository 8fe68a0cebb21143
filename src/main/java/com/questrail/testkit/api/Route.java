package com.questrail.testkit.api;

import java.util.Objects;

/**
 * A single message route declared by a handler.
 *
 * <pre>{@code
 * c.routes(
 *     Route.handlesCommand(OpenAccount.class),
 *     Route.recordsEvent(AccountOpened.class));
 * }</pre>
 */
public record Route(RouteType type, Class<? extends Message> messageType) {
    public Route {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(messageType, "messageType");
    }

    public static Route handlesCommand(Class<? extends Message> type) {
        return new Route(RouteType.HANDLES_COMMAND, type);
    }

    public static Route recordsEvent(Class<? extends Message> type) {
        return new Route(RouteType.RECORDS_EVENT, type);
    }

    public static Route handlesEvent(Class<? extends Message> type) {
        return new Route(RouteType.HANDLES_EVENT, type);
    }

    public static Route executesCommand(Class<? extends Message> type) {
        return new Route(RouteType.EXECUTES_COMMAND, type);
    }

    public static Route schedulesTimeout(Class<? extends Message> type) {
        return new Route(RouteType.SCHEDULES_TIMEOUT, type);
    }

    public MessageKind kind() {
        return type.kind();
    }

    @Override
    public String toString() {
        return type.name().toLowerCase() + "(" + messageType.getName() + ")";
    }
}
