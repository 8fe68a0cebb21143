package com.questrail.testkit.expectation;

import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.config.HandlerConfig;
import com.questrail.testkit.config.HandlerType;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.fact.AggregateFact;
import com.questrail.testkit.fact.DispatchFact;
import com.questrail.testkit.fact.Fact;
import com.questrail.testkit.fact.HandlingFact;
import com.questrail.testkit.fact.IntegrationFact;
import com.questrail.testkit.fact.ProcessFact;
import com.questrail.testkit.fact.TickFact;
import com.questrail.testkit.report.Report;
import com.questrail.testkit.report.ReportSection;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MessageTracker
 * -----------------------------------------------------------------------------
 * Keeps track of the handlers engaged by an action and the messages they
 * produce, on behalf of the message-related predicates.
 *
 * <p>The tracker also builds the part of a failure report that explains why
 * no candidate message was found at all.</p>
 */
final class MessageTracker {

    private final MessageKind kind;
    private final PredicateOptions options;

    private boolean cycleBegun;
    private int total;
    private int produced;
    private final Map<String, HandlerType> engaged = new LinkedHashMap<>();
    private final Map<HandlerType, Boolean> enabled = new EnumMap<>(HandlerType.class);

    MessageTracker(MessageKind kind, PredicateOptions options) {
        this.kind = kind;
        this.options = options;
    }

    /**
     * Updates the tracker's state and returns the envelope of the message the
     * fact reports as produced, if any.
     */
    Optional<Envelope> onFact(Fact f) {
        if (f instanceof DispatchFact.CycleBegun x) {
            beginCycle(x.enabledHandlerTypes());
            if (options.matchDispatchCycleStartedFacts()) {
                messageProduced(x.envelope().kind());
                return Optional.of(x.envelope());
            }
        } else if (f instanceof TickFact.CycleBegun x) {
            beginCycle(x.enabledHandlerTypes());
        } else if (f instanceof HandlingFact.Begun x) {
            engage(x.handler());
        } else if (f instanceof AggregateFact.EventRecorded x) {
            messageProduced(x.eventEnvelope().kind());
            return Optional.of(x.eventEnvelope());
        } else if (f instanceof IntegrationFact.EventRecorded x) {
            messageProduced(x.eventEnvelope().kind());
            return Optional.of(x.eventEnvelope());
        } else if (f instanceof ProcessFact.CommandExecuted x) {
            messageProduced(x.commandEnvelope().kind());
            return Optional.of(x.commandEnvelope());
        }

        return Optional.empty();
    }

    MessageKind kind() {
        return kind;
    }

    PredicateOptions options() {
        return options;
    }

    /**
     * The number of messages of the expected kind that were produced.
     */
    int produced() {
        return produced;
    }

    /**
     * Explains a failure in which no message resembling the expected one was
     * produced.
     */
    void reportNoMatch(Report rep) {
        ReportSection s = rep.section(Sections.SUGGESTIONS);

        boolean allDisabled = true;
        List<String> relevant = new ArrayList<>();

        if (cycleBegun) {
            for (HandlerType t : HandlerType.values()) {
                if (!t.isProducerOf(kind)) {
                    continue;
                }

                relevant.add(t.toString());

                if (enabled.getOrDefault(t, true)) {
                    allDisabled = false;
                } else {
                    s.appendListItem("enable %s handlers using the enableHandlerType() option", t);
                }
            }

            if (!options.matchDispatchCycleStartedFacts()) {
                if (allDisabled) {
                    rep.explanation("no relevant handler types were enabled");
                    return;
                }

                if (engaged.isEmpty()) {
                    rep.explanation(String.format(
                            "no relevant handlers (%s) were engaged",
                            String.join(" or ", relevant)));
                    s.appendListItem("check the application's routing configuration");
                    return;
                }
            }
        }

        if (total == 0) {
            rep.explanation("no messages were produced at all");
        } else if (produced == 0) {
            rep.explanation(Inflect.sprint(kind, "no <messages> were <produced> at all"));
        } else if (options.matchDispatchCycleStartedFacts()) {
            rep.explanation(Inflect.sprint(kind, "nothing <produced> a matching <message>"));
        } else {
            rep.explanation(Inflect.sprint(kind, "none of the engaged handlers <produced> a matching <message>"));
        }

        for (Map.Entry<String, HandlerType> e : engaged.entrySet()) {
            s.appendListItem("verify the logic within the '%s' %s message handler", e.getKey(), e.getValue());
        }

        if (options.matchDispatchCycleStartedFacts()) {
            s.appendListItem(Inflect.sprint(kind, "verify the logic within the code that uses the <dispatcher>"));
        }
    }

    private void beginCycle(Map<HandlerType, Boolean> types) {
        cycleBegun = true;
        enabled.clear();
        enabled.putAll(types);
    }

    private void engage(HandlerConfig handler) {
        if (handler.handlerType().isProducerOf(kind)) {
            engaged.putIfAbsent(handler.name(), handler.handlerType());
        }
    }

    private void messageProduced(MessageKind k) {
        total++;
        if (k == kind) {
            produced++;
        }
    }
}
