package com.questrail.testkit.expectation;

import com.questrail.testkit.fact.Fact;
import com.questrail.testkit.report.Report;

/**
 * Inverts a child expectation.
 */
final class NotExpectation implements Expectation {

    private final Expectation child;

    NotExpectation(Expectation child) {
        this.child = child;
    }

    @Override
    public String caption() {
        return "not " + child.caption();
    }

    @Override
    public Predicate predicate(PredicateScope scope) throws ExpectationException {
        Predicate p = child.predicate(scope);

        return new Predicate() {
            @Override
            public void onFact(Fact fact) {
                p.onFact(fact);
            }

            @Override
            public boolean ok() {
                return !p.ok();
            }

            @Override
            public void done() {
                p.done();
            }

            @Override
            public Report report(ReportContext ctx) {
                Report r = p.report(ctx.invert());
                return new Report(ctx.treeOk(), ok(), "do not " + r.criteria());
            }
        };
    }
}
