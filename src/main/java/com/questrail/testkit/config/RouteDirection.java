package com.questrail.testkit.config;

/**
 * Direction of a message relative to a handler.
 */
public enum RouteDirection
{
    /** The handler consumes the message. */
    INBOUND,

    /** The handler produces the message. */
    OUTBOUND
}
