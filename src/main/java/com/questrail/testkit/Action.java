package com.questrail.testkit;

import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.expectation.PredicateOptions;
import com.questrail.testkit.location.Location;

/**
 * Action
 * =============================================================================
 * Something a test does to change the state of the engine or application.
 *
 * <p>Built-in actions are created by {@link Actions}.</p>
 */
public interface Action
{
    /**
     * Returns a description of the action, such as "executing
     * 'OpenAccount' command", used in log output and report headings.
     */
    String caption();

    /**
     * Returns the location at which the action was created.
     */
    Location location();

    /**
     * Adjusts the options used to build the predicate of an expectation
     * checked against this action.
     */
    default PredicateOptions configurePredicate(PredicateOptions options) {
        return options;
    }

    /**
     * Performs the action.
     *
     * @throws Exception if the action could not be performed; the test fails
     */
    void run(OperationContext ctx, ActionScope scope) throws Exception;
}
