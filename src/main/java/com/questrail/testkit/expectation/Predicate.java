package com.questrail.testkit.expectation;

import com.questrail.testkit.fact.FactObserver;
import com.questrail.testkit.report.Report;

/**
 * Tests whether a single action satisfies an {@link Expectation}.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link #onFact} for every fact produced by the action</li>
 *   <li>{@link #done()} once, after the action completes</li>
 *   <li>{@link #report} any number of times</li>
 * </ol>
 */
public interface Predicate extends FactObserver
{
    /**
     * Returns true if the expectation has been met. The value may change as
     * facts arrive, but is fixed once {@link #done()} returns.
     */
    boolean ok();

    void done();

    Report report(ReportContext ctx);
}
