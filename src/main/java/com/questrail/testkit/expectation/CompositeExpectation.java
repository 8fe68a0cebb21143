package com.questrail.testkit.expectation;

import com.questrail.testkit.fact.Fact;
import com.questrail.testkit.report.Report;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Combines child expectations under a rule that decides, from the number of
 * children that passed, whether the composite passed.
 */
final class CompositeExpectation implements Expectation {

    private final String caption;
    private final String criteria;
    private final List<Expectation> children;
    private final boolean invertsChildren;
    private final IntFunction<Verdict> rule;

    CompositeExpectation(
            String caption,
            String criteria,
            List<Expectation> children,
            boolean invertsChildren,
            IntFunction<Verdict> rule
    ) {
        this.caption = caption;
        this.criteria = criteria;
        this.children = List.copyOf(children);
        this.invertsChildren = invertsChildren;
        this.rule = rule;
    }

    static Expectation allOf(List<Expectation> children) {
        int n = requireChildren("allOf", children);
        if (n == 1) {
            return children.get(0);
        }

        return new CompositeExpectation(
                String.format("to meet %d expectations", n),
                "all of",
                children,
                false,
                passed -> passed == n
                        ? Verdict.pass()
                        : Verdict.fail(String.format("%d of the expectations failed", n - passed)));
    }

    static Expectation anyOf(List<Expectation> children) {
        int n = requireChildren("anyOf", children);
        if (n == 1) {
            return children.get(0);
        }

        return new CompositeExpectation(
                String.format("to meet at least one of %d expectations", n),
                "any of",
                children,
                false,
                passed -> passed > 0
                        ? Verdict.pass()
                        : Verdict.fail(String.format("all %d of the expectations failed", n)));
    }

    static Expectation noneOf(List<Expectation> children) {
        int n = requireChildren("noneOf", children);

        String caption = n == 1
                ? "not " + children.get(0).caption()
                : String.format("not to meet any of %d expectations", n);

        return new CompositeExpectation(
                caption,
                "none of",
                children,
                true,
                passed -> {
                    if (passed == 0) {
                        return Verdict.pass();
                    }
                    if (n == 1) {
                        return Verdict.fail("the sub-assertion passed unexpectedly");
                    }
                    return Verdict.fail(String.format("%d of the expectations passed unexpectedly", passed));
                });
    }

    private static int requireChildren(String name, List<Expectation> children) {
        if (children.isEmpty()) {
            throw new IllegalArgumentException(name + "(): at least one child expectation must be provided");
        }
        for (Expectation c : children) {
            if (c == null) {
                throw new IllegalArgumentException(name + "(): child expectations must not be null");
            }
        }
        return children.size();
    }

    @Override
    public String caption() {
        return caption;
    }

    @Override
    public Predicate predicate(PredicateScope scope) throws ExpectationException {
        List<Predicate> predicates = new ArrayList<>(children.size());
        for (Expectation c : children) {
            predicates.add(c.predicate(scope));
        }
        return new CompositePredicate(predicates);
    }

    record Verdict(boolean ok, String outcome) {
        static Verdict pass() {
            return new Verdict(true, "");
        }

        static Verdict fail(String outcome) {
            return new Verdict(false, outcome);
        }
    }

    private final class CompositePredicate implements Predicate {

        private final List<Predicate> children;

        CompositePredicate(List<Predicate> children) {
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
            return verdict().ok();
        }

        @Override
        public void done() {
            for (Predicate c : children) {
                c.done();
            }
        }

        @Override
        public Report report(ReportContext ctx) {
            Verdict v = verdict();

            Report rep = new Report(ctx.treeOk(), v.ok(), criteria).outcome(v.outcome());

            ReportContext childCtx = invertsChildren ? ctx.invert() : ctx;
            for (Predicate c : children) {
                rep.append(c.report(childCtx));
            }

            return rep;
        }

        private Verdict verdict() {
            int passed = 0;
            for (Predicate c : children) {
                if (c.ok()) {
                    passed++;
                }
            }
            return rule.apply(passed);
        }
    }
}
