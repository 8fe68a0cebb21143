package com.questrail.testkit.expectation;

import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.fact.Fact;
import com.questrail.testkit.location.Location;
import com.questrail.testkit.report.Report;
import com.questrail.testkit.report.ReportSection;

import java.util.ArrayList;
import java.util.List;

/**
 * MessageMatchExpectation
 * -----------------------------------------------------------------------------
 * Applies a {@link MessageMatcher} to the messages of the expected kind.
 *
 * <h2>Modes</h2>
 * <ul>
 *   <li><b>non-exhaustive</b>: passes as soon as one message matches</li>
 *   <li><b>exhaustive</b>: passes if no message fails to match. Messages of
 *       a type other than {@code T} count as failures.</li>
 * </ul>
 *
 * <p>Failures are grouped by message type and reason in the report.</p>
 */
final class MessageMatchExpectation<T extends Message> implements Expectation {

    private final Class<T> type;
    private final MessageMatcher<T> matcher;
    private final MessageKind kind;
    private final boolean exhaustive;
    private final Location location;

    MessageMatchExpectation(
            Class<T> type,
            MessageMatcher<T> matcher,
            MessageKind kind,
            boolean exhaustive,
            Location location
    ) {
        this.type = type;
        this.matcher = matcher;
        this.kind = kind;
        this.exhaustive = exhaustive;
        this.location = location;
    }

    @Override
    public String caption() {
        return "to " + criteria();
    }

    @Override
    public Predicate predicate(PredicateScope scope) {
        return new MessageMatchPredicate(scope.options());
    }

    private String criteria() {
        if (exhaustive) {
            return Inflect.sprintf(kind, "only <produce> <messages> that match the predicate near %s", location);
        }
        return Inflect.sprintf(kind, "<produce> a <message> that matches the predicate near %s", location);
    }

    private final class MessageMatchPredicate implements Predicate {

        private final MessageTracker tracker;
        private final List<FailedMatch> failures = new ArrayList<>();

        private int matched;
        private int ignored;
        private boolean ok;

        MessageMatchPredicate(PredicateOptions options) {
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
            if (env.kind() != kind) {
                return;
            }

            MatchResult result;
            if (type.isInstance(env.message())) {
                result = matcher.match(type.cast(env.message()));
                if (result == null) {
                    throw new IllegalStateException("message matcher near " + location + " returned null");
                }
            } else if (exhaustive) {
                result = MatchResult.mismatch("predicate function expected " + type.getName());
            } else {
                result = MatchResult.ignored();
            }

            switch (result.status()) {
                case MATCHED:
                    matched++;
                    if (!exhaustive) {
                        ok = true;
                        failures.clear();
                    }
                    return;
                case IGNORED:
                    ignored++;
                    return;
                default:
                    recordFailure(env.messageType(), result.reason());
            }
        }

        private void recordFailure(Class<?> messageType, String reason) {
            for (FailedMatch f : failures) {
                if (f.messageType == messageType && f.reason.equals(reason)) {
                    f.count++;
                    return;
                }
            }
            failures.add(new FailedMatch(messageType, reason));
        }

        @Override
        public boolean ok() {
            return ok;
        }

        @Override
        public void done() {
            if (exhaustive && failures.isEmpty()) {
                ok = true;
            }
        }

        @Override
        public Report report(ReportContext ctx) {
            Report rep = new Report(ctx.treeOk(), ok, criteria());

            if (ok || ctx.treeOk() || ctx.inverted()) {
                return rep;
            }

            if (!failures.isEmpty()) {
                ReportSection s = rep.section(Sections.FAILED_MATCHES);
                for (FailedMatch f : failures) {
                    if (f.count > 1) {
                        s.appendListItem("%s: %s (repeated %d times)", f.messageType.getName(), f.reason, f.count);
                    } else {
                        s.appendListItem("%s: %s", f.messageType.getName(), f.reason);
                    }
                }
            }

            ReportSection suggestions = rep.section(Sections.SUGGESTIONS);
            if (ignored > 0) {
                suggestions.appendListItem(
                        "verify the logic within the predicate function, it ignored %s",
                        Inflect.sprintf(kind, "%d <messages>", ignored));
            } else if (!failures.isEmpty()) {
                suggestions.appendListItem("verify the logic within the predicate function");
            }

            tracker.reportNoMatch(rep);

            if (exhaustive) {
                int relevant = tracker.produced() - ignored;
                String summary = matched == 0
                        ? String.format("none of the %d", relevant)
                        : String.format("only %d of %d", matched, relevant);

                rep.explanation(Inflect.sprintf(kind, "%s relevant <messages> matched the predicate", summary));
            }

            return rep;
        }
    }

    private static final class FailedMatch {
        private final Class<?> messageType;
        private final String reason;
        private int count = 1;

        private FailedMatch(Class<?> messageType, String reason) {
            this.messageType = messageType;
            this.reason = reason;
        }
    }
}
