package com.questrail.testkit.expectation;

import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.envelope.Origin;
import com.questrail.testkit.fact.Fact;
import com.questrail.testkit.report.Report;
import com.questrail.testkit.report.ReportSection;
import com.questrail.testkit.report.TextDiff;

import java.util.Optional;

/**
 * Passes if a message equal to the expected message is produced with the
 * expected kind. A "like" expectation instead passes for any message that is
 * a {@link MessageSuperset superset} of the expected one.
 *
 * <p>On failure the report describes the most similar message that was
 * produced, ranked by {@link TypeDistance}, and shows a diff against it.</p>
 */
final class MessageExpectation implements Expectation {

    private final Message expected;
    private final MessageKind kind;
    private final boolean like;

    MessageExpectation(Message expected, MessageKind kind, boolean like) {
        this.expected = expected;
        this.kind = kind;
        this.like = like;
    }

    @Override
    public String caption() {
        return "to " + criteria();
    }

    private String criteria() {
        String format = like
                ? "<produce> a <message> that is a superset of a specific '%s' <message>"
                : "<produce> a specific '%s' <message>";
        return Inflect.sprintf(kind, format, expected.getClass().getName());
    }

    @Override
    public Predicate predicate(PredicateScope scope) throws ExpectationException {
        KindGuard.check(scope, expected.getClass(), kind);
        return new MessagePredicate(scope.options());
    }

    private final class MessagePredicate implements Predicate {

        private final MessageComparator comparator;
        private final MessageTracker tracker;

        private boolean ok;
        private Envelope bestMatch;
        private int bestMatchDistance = TypeDistance.UNRELATED;

        MessagePredicate(PredicateOptions options) {
            this.comparator = options.comparator();
            this.tracker = new MessageTracker(kind, options);
        }

        @Override
        public void onFact(Fact fact) {
            if (ok) {
                return;
            }

            Optional<Envelope> env = tracker.onFact(fact);
            env.ifPresent(this::messageProduced);
        }

        private void messageProduced(Envelope env) {
            boolean matches = like
                    ? MessageSuperset.isSuperset(env.message(), expected)
                    : comparator.equal(env.message(), expected);

            if (!matches) {
                int distance = TypeDistance.measure(expected.getClass(), env.messageType());
                if (distance < bestMatchDistance) {
                    bestMatch = env;
                    bestMatchDistance = distance;
                }
                return;
            }

            bestMatch = env;
            bestMatchDistance = TypeDistance.IDENTICAL;
            ok = true;
        }

        @Override
        public boolean ok() {
            return ok;
        }

        @Override
        public void done() {
        }

        @Override
        public Report report(ReportContext ctx) {
            Report rep = new Report(ctx.treeOk(), ok, criteria());

            if (ok || ctx.treeOk() || ctx.inverted()) {
                return rep;
            }

            if (bestMatch == null) {
                tracker.reportNoMatch(rep);
                return rep;
            }

            ReportSection s = rep.section(Sections.SUGGESTIONS);
            Optional<Origin> origin = bestMatch.origin();

            if (bestMatchDistance == TypeDistance.IDENTICAL) {
                if (origin.isEmpty()) {
                    rep.explanation(Inflect.sprint(kind, "a similar <message> was <produced> via a <dispatcher>"));
                } else {
                    rep.explanation(Inflect.sprintf(
                            kind,
                            "a similar <message> was <produced> by the '%s' %s message handler",
                            origin.get().handler().name(),
                            origin.get().handlerType()));
                }

                s.appendListItem("check the content of the message");
            } else {
                if (origin.isEmpty()) {
                    rep.explanation(Inflect.sprint(kind, "a <message> of a similar type was <produced> via a <dispatcher>"));
                } else {
                    rep.explanation(Inflect.sprintf(
                            kind,
                            "a <message> of a similar type was <produced> by the '%s' %s message handler",
                            origin.get().handler().name(),
                            origin.get().handlerType()));
                }

                s.appendListItem("check the message type, is it the intended subtype?");
            }

            rep.section(Sections.MESSAGE_DIFF).appendRaw(
                    TextDiff.diff(expected.describe(), bestMatch.message().describe()));

            return rep;
        }
    }
}
