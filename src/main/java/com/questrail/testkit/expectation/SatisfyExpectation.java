package com.questrail.testkit.expectation;

import com.questrail.testkit.fact.Fact;
import com.questrail.testkit.report.Report;
import com.questrail.testkit.report.ReportSection;

import java.util.List;
import java.util.function.Consumer;

/**
 * Runs a user-supplied function against the facts produced by an action once
 * the action completes.
 */
final class SatisfyExpectation implements Expectation {

    private static final StackWalker WALKER = StackWalker.getInstance();

    private final String criteria;
    private final Consumer<SatisfyT> body;

    SatisfyExpectation(String criteria, Consumer<SatisfyT> body) {
        this.criteria = criteria;
        this.body = body;
    }

    @Override
    public String caption() {
        return "to " + criteria;
    }

    @Override
    public Predicate predicate(PredicateScope scope) {
        return new SatisfyPredicate(new SatisfyT(criteria, scope.options()));
    }

    private final class SatisfyPredicate implements Predicate {

        private final SatisfyT t;

        SatisfyPredicate(SatisfyT t) {
            this.t = t;
        }

        @Override
        public void onFact(Fact fact) {
            t.add(fact);
        }

        @Override
        public boolean ok() {
            return t.skipped() || !t.failed();
        }

        @Override
        public void done() {
            t.caller(WALKER.walk(s -> s.findFirst().map(SatisfyT::key).orElse("")));

            try {
                body.accept(t);
            } catch (SatisfyT.Abort e) {
                // stopped by failNow(), fatal() or skip()
            } finally {
                t.close();
            }
        }

        @Override
        public Report report(ReportContext ctx) {
            Report rep = new Report(ctx.treeOk(), ok(), criteria);

            if (t.skipped()) {
                rep.outcome("the expectation was skipped");
            } else if (t.failed()) {
                rep.outcome("the expectation failed");
            }

            rep.explanation(t.explanation());

            List<String> messages = t.messages();
            if (!messages.isEmpty()) {
                ReportSection s = rep.section(Sections.LOG_MESSAGES);
                for (String m : messages) {
                    s.append("%s", m);
                }
            }

            return rep;
        }
    }
}
