package com.questrail.testkit.api;

/**
 * Message
 * -----------------------------------------------------------------------------
 * Marker for every application-defined message.
 *
 * <p>The message <em>type</em> is its runtime class. Messages should be
 * immutable and should implement {@code equals()} by value; records are the
 * natural fit.</p>
 */
public interface Message
{
    /**
     * Checks that the message is well-formed.
     *
     * @param scope the kind-specific validation context
     * @throws MessageValidationException if the message is invalid
     */
    default void validate(ValidationScope scope) {
    }

    /**
     * Returns a short human-readable description of the message.
     */
    default String describe() {
        return toString();
    }
}
