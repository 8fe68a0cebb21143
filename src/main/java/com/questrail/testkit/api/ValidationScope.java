package com.questrail.testkit.api;

import java.util.Objects;

/**
 * Context passed to {@link Message#validate(ValidationScope)}.
 *
 * <p>The scope tells the message which kind it is being validated as, so a
 * message may apply different rules when executed as a command than when
 * recorded as an event.</p>
 */
public record ValidationScope(MessageKind kind) {
    public ValidationScope {
        Objects.requireNonNull(kind, "kind");
    }

    public static ValidationScope forCommand() {
        return new ValidationScope(MessageKind.COMMAND);
    }

    public static ValidationScope forEvent() {
        return new ValidationScope(MessageKind.EVENT);
    }

    public static ValidationScope forTimeout() {
        return new ValidationScope(MessageKind.TIMEOUT);
    }
}
