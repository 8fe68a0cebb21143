package com.questrail.testkit.expectation;

/**
 * Expectation
 * =============================================================================
 * Describes criteria that an action is expected to meet.
 *
 * <p>An expectation is a reusable description. Each time it is checked a new
 * {@link Predicate} is built from it, which observes the facts produced by
 * the action and decides whether the criteria were met.</p>
 */
public interface Expectation
{
    /**
     * Returns a caption for the expectation, such as
     * "to record a specific 'OrderPlaced' event".
     */
    String caption();

    /**
     * Returns a new predicate that checks this expectation.
     *
     * @throws ExpectationException if the expectation can never be met by
     *         the application under test
     */
    Predicate predicate(PredicateScope scope) throws ExpectationException;
}
