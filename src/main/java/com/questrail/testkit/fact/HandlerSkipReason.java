package com.questrail.testkit.fact;

/**
 * Why a handler was not invoked for a message or tick.
 */
public enum HandlerSkipReason
{
    /** All handlers of the handler's type are disabled. */
    HANDLER_TYPE_DISABLED("handler type disabled"),

    /** The handler was disabled by an operation option. */
    INDIVIDUAL_HANDLER_DISABLED("handler disabled"),

    /** The handler disabled itself in its configuration. */
    INDIVIDUAL_HANDLER_DISABLED_BY_CONFIGURATION("handler disabled by configuration");

    private final String description;

    HandlerSkipReason(String description) {
        this.description = description;
    }

    @Override
    public String toString() {
        return description;
    }
}
