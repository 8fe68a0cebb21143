package com.questrail.testkit.api;

/**
 * The five kinds of route a handler may declare.
 */
public enum RouteType
{
    HANDLES_COMMAND(MessageKind.COMMAND, true, false),
    RECORDS_EVENT(MessageKind.EVENT, false, true),
    HANDLES_EVENT(MessageKind.EVENT, true, false),
    EXECUTES_COMMAND(MessageKind.COMMAND, false, true),

    /** A process both schedules and later handles its own timeouts. */
    SCHEDULES_TIMEOUT(MessageKind.TIMEOUT, true, true);

    private final MessageKind kind;
    private final boolean inbound;
    private final boolean outbound;

    RouteType(MessageKind kind, boolean inbound, boolean outbound) {
        this.kind = kind;
        this.inbound = inbound;
        this.outbound = outbound;
    }

    public MessageKind kind() {
        return kind;
    }

    public boolean isInbound() {
        return inbound;
    }

    public boolean isOutbound() {
        return outbound;
    }
}
