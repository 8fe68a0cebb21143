package com.questrail.testkit.expectation;

import com.questrail.testkit.api.Message;

import java.util.Objects;

/**
 * Decides whether two messages are equal for the purposes of an expectation.
 */
@FunctionalInterface
public interface MessageComparator
{
    /**
     * Compares messages with {@link Object#equals}.
     */
    MessageComparator DEFAULT = Objects::equals;

    boolean equal(Message a, Message b);
}
