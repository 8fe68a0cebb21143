package com.questrail.testkit.api;

/**
 * MessageKind
 * -----------------------------------------------------------------------------
 * The three kinds of message an application exchanges.
 *
 * <p>A message type has exactly one kind within an application. The kind is
 * not part of the Java type; it is established by the routes the
 * application's handlers declare.</p>
 */
public enum MessageKind
{
    /** A request to change the state of the application. */
    COMMAND("command"),

    /** A record of something that has happened. */
    EVENT("event"),

    /** A self-addressed, deferred message for a process instance. */
    TIMEOUT("timeout");

    private final String label;

    MessageKind(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
