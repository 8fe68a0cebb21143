package com.questrail.testkit.expectation;

import com.questrail.testkit.api.MessageKind;

import java.util.Optional;

/**
 * Rejects expectations on message types that could never be produced with
 * the expected kind.
 */
final class KindGuard {

    private KindGuard() {
    }

    static void check(PredicateScope s, Class<?> type, MessageKind expected) throws ExpectationException {
        Optional<MessageKind> actual = s.app().kindOf(type);

        if (actual.isEmpty()) {
            throw new ExpectationException(Inflect.sprintf(
                    expected,
                    "a <message> of type %s can never be <produced>, the application does not use this message type",
                    type.getName()));
        }

        if (actual.get() != expected) {
            throw new ExpectationException(Inflect.sprintf(
                    expected,
                    "%s is a %s, it can never be <produced> as a <message>",
                    type.getName(), actual.get()));
        }

        if (!s.options().matchDispatchCycleStartedFacts() && !s.app().isProduced(type)) {
            throw new ExpectationException(Inflect.sprintf(
                    expected,
                    "no handlers <produce> <messages> of type %s, it is only ever consumed",
                    type.getName()));
        }
    }
}
