package com.questrail.testkit.expectation;

import com.questrail.testkit.api.Message;

/**
 * A user-supplied test applied to produced messages of type {@code T}.
 */
@FunctionalInterface
public interface MessageMatcher<T extends Message>
{
    MatchResult match(T message);
}
