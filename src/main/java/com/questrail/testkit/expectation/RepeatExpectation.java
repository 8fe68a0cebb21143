package com.questrail.testkit.expectation;

import com.questrail.testkit.fact.Fact;
import com.questrail.testkit.report.Report;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Passes if every one of {@code n} expectations built by a factory passes.
 * Only the first failing iteration is shown in the report.
 */
final class RepeatExpectation implements Expectation {

    private final String criteria;
    private final int count;
    private final IntFunction<Expectation> factory;

    RepeatExpectation(String criteria, int count, IntFunction<Expectation> factory) {
        this.criteria = criteria;
        this.count = count;
        this.factory = factory;
    }

    @Override
    public String caption() {
        return "to " + criteria;
    }

    @Override
    public Predicate predicate(PredicateScope scope) throws ExpectationException {
        List<Predicate> children = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            Expectation e = factory.apply(i);
            if (e == null) {
                throw new ExpectationException(String.format(
                        "on iteration %d: factory returned a null expectation", i));
            }

            try {
                children.add(e.predicate(scope));
            } catch (ExpectationException ex) {
                throw new ExpectationException(String.format("on iteration %d: %s", i, ex.getMessage()), ex);
            }
        }

        return new RepeatPredicate(children);
    }

    private final class RepeatPredicate implements Predicate {

        private final List<Predicate> children;

        RepeatPredicate(List<Predicate> children) {
            this.children = children;
        }

        @Override
        public void onFact(Fact fact) {
            for (Predicate c : children) {
                c.onFact(fact);
            }
        }

        @Override
        public boolean ok() {
            for (Predicate c : children) {
                if (!c.ok()) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public void done() {
            for (Predicate c : children) {
                c.done();
            }
        }

        @Override
        public Report report(ReportContext ctx) {
            int failures = 0;
            int shown = 0;
            Report first = null;

            for (int i = 0; i < children.size(); i++) {
                Predicate c = children.get(i);
                if (c.ok()) {
                    continue;
                }

                failures++;
                if (first == null) {
                    shown = i;
                    first = c.report(ctx);
                }
            }

            Report rep = new Report(ctx.treeOk(), failures == 0, criteria);

            if (first != null) {
                rep.append(first);
                rep.outcome(String.format(
                        "%d of %d iteration(s) failed, iteration #%d shown",
                        failures, children.size(), shown));
            }

            return rep;
        }
    }
}
