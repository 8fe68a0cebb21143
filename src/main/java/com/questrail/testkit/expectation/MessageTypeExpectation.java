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
 * Passes if any message of the expected type is produced with the expected
 * kind.
 */
final class MessageTypeExpectation implements Expectation {

    private final Class<? extends Message> expected;
    private final MessageKind kind;

    MessageTypeExpectation(Class<? extends Message> expected, MessageKind kind) {
        this.expected = expected;
        this.kind = kind;
    }

    @Override
    public String caption() {
        return Inflect.sprintf(kind, "to <produce> any '%s' <message>", expected.getName());
    }

    @Override
    public Predicate predicate(PredicateScope scope) throws ExpectationException {
        KindGuard.check(scope, expected, kind);
        return new MessageTypePredicate(scope.options());
    }

    private final class MessageTypePredicate implements Predicate {

        private final MessageTracker tracker;

        private boolean ok;
        private Envelope bestMatch;
        private int bestMatchDistance = TypeDistance.UNRELATED;

        MessageTypePredicate(PredicateOptions options) {
            this.tracker = new MessageTracker(kind, options);
        }

        @Override
        public void onFact(Fact fact) {
            if (ok) {
                return;
            }

            tracker.onFact(fact).ifPresent(this::messageProduced);
        }

        private void messageProduced(Envelope env) {
            int distance = TypeDistance.measure(expected, env.messageType());

            if (distance < bestMatchDistance) {
                bestMatch = env;
                bestMatchDistance = distance;
            }

            if (distance == TypeDistance.IDENTICAL && env.kind() == kind) {
                ok = true;
            }
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
            Report rep = new Report(ctx.treeOk(), ok, Inflect.sprintf(
                    kind,
                    "<produce> any '%s' <message>",
                    expected.getName()));

            if (ok || ctx.treeOk() || ctx.inverted()) {
                return rep;
            }

            if (bestMatch == null) {
                tracker.reportNoMatch(rep);
            } else if (bestMatch.kind() == kind) {
                reportExpectedKind(rep);
            } else {
                reportUnexpectedKind(rep);
            }

            return rep;
        }

        private void reportExpectedKind(Report rep) {
            ReportSection s = rep.section(Sections.SUGGESTIONS);
            Optional<Origin> origin = bestMatch.origin();

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

            appendDiff(rep);
        }

        private void reportUnexpectedKind(Report rep) {
            ReportSection s = rep.section(Sections.SUGGESTIONS);
            Optional<Origin> origin = bestMatch.origin();
            MessageKind actual = bestMatch.kind();

            if (origin.isEmpty()) {
                s.appendListItem(Inflect.sprint(
                        actual,
                        "verify that a <message> of this type was intended to be <produced> via a <dispatcher>"));
            } else {
                s.appendListItem(Inflect.sprintf(
                        actual,
                        "verify that the '%s' %s message handler intended to <produce> a <message> of this type",
                        origin.get().handler().name(),
                        origin.get().handlerType()));
            }

            if (kind == MessageKind.COMMAND) {
                s.appendListItem("verify that toExecuteCommandOfType() is the correct expectation, did you mean toRecordEventOfType()?");
            } else {
                s.appendListItem("verify that toRecordEventOfType() is the correct expectation, did you mean toExecuteCommandOfType()?");
            }

            if (bestMatchDistance == TypeDistance.IDENTICAL) {
                if (origin.isEmpty()) {
                    rep.explanation(Inflect.sprint(
                            actual,
                            "a message of this type was <produced> as a <message> via a <dispatcher>"));
                } else {
                    rep.explanation(Inflect.sprintf(
                            actual,
                            "a message of this type was <produced> as a <message> by the '%s' %s message handler",
                            origin.get().handler().name(),
                            origin.get().handlerType()));
                }
                return;
            }

            if (origin.isEmpty()) {
                rep.explanation(Inflect.sprint(
                        actual,
                        "a message of a similar type was <produced> as a <message> via a <dispatcher>"));
            } else {
                rep.explanation(Inflect.sprintf(
                        actual,
                        "a message of a similar type was <produced> as a <message> by the '%s' %s message handler",
                        origin.get().handler().name(),
                        origin.get().handlerType()));
            }

            s.appendListItem("check the message type, is it the intended subtype?");

            appendDiff(rep);
        }

        private void appendDiff(Report rep) {
            rep.section(Sections.MESSAGE_TYPE_DIFF).appendRaw(
                    TextDiff.diff(expected.getName(), bestMatch.messageType().getName()));
        }
    }
}
