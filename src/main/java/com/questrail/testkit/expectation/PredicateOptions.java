package com.questrail.testkit.expectation;

import java.util.Objects;

/**
 * Values that dictate how a predicate behaves.
 *
 * @param comparator                     compares expected and produced messages
 * @param matchDispatchCycleStartedFacts when true, messages dispatched directly
 *                                       by the test also count as produced;
 *                                       otherwise only messages produced by
 *                                       handlers are matched
 */
public record PredicateOptions(
        MessageComparator comparator,
        boolean matchDispatchCycleStartedFacts
) {
    public PredicateOptions {
        Objects.requireNonNull(comparator, "comparator");
    }

    public static PredicateOptions defaults() {
        return new PredicateOptions(MessageComparator.DEFAULT, false);
    }

    public PredicateOptions withComparator(MessageComparator comparator) {
        return new PredicateOptions(comparator, matchDispatchCycleStartedFacts);
    }

    public PredicateOptions withMatchDispatchCycleStartedFacts(boolean match) {
        return new PredicateOptions(comparator, match);
    }
}
