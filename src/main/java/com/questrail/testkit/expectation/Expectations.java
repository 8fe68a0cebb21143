package com.questrail.testkit.expectation;

import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.MessageValidationException;
import com.questrail.testkit.api.ValidationScope;
import com.questrail.testkit.location.Location;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntFunction;

/**
 * Expectations
 * =============================================================================
 * Factory methods for every built-in {@link Expectation}.
 *
 * <p>All factories fail fast: a null argument, an empty description or an
 * invalid expected message throws immediately rather than producing an
 * expectation that cannot pass.</p>
 *
 * <h2>Message expectations</h2>
 * <ul>
 *   <li>{@link #toExecuteCommand} / {@link #toRecordEvent}: a specific message</li>
 *   <li>{@link #toRecordEventLike}: an event that contains a partial message</li>
 *   <li>{@link #toExecuteCommandOfType} / {@link #toRecordEventOfType}: any
 *       message of a type</li>
 *   <li>the {@code ...Matching} variants: messages accepted by a
 *       {@link MessageMatcher}</li>
 * </ul>
 *
 * <h2>Combinators</h2>
 * <p>{@link #allOf}, {@link #anyOf}, {@link #noneOf}, {@link #not} and
 * {@link #toRepeatedly} build expectations from other expectations.
 * {@link #toSatisfy} runs arbitrary user code against the recorded facts.</p>
 */
public final class Expectations {

    private Expectations() {
    }

    // ---------------------------------------------------------------------
    // Specific messages
    // ---------------------------------------------------------------------

    public static Expectation toExecuteCommand(Message command) {
        return messageExpectation("toExecuteCommand", command, MessageKind.COMMAND);
    }

    public static Expectation toRecordEvent(Message event) {
        return messageExpectation("toRecordEvent", event, MessageKind.EVENT);
    }

    /**
     * Passes if an event is recorded that is a superset of {@code event}.
     * Components of {@code event} that are null, zero, false or empty are
     * ignored, so the comparison behaves like {@link #toRecordEvent} on the
     * components that were given.
     *
     * <p>{@code event} is not validated, as it is expected to be partially
     * complete.</p>
     */
    public static Expectation toRecordEventLike(Message event) {
        if (event == null) {
            throw new IllegalArgumentException("toRecordEventLike(<null>): message must not be null");
        }
        return new MessageExpectation(event, MessageKind.EVENT, true);
    }

    // ---------------------------------------------------------------------
    // Message types
    // ---------------------------------------------------------------------

    public static Expectation toExecuteCommandOfType(Class<? extends Message> type) {
        if (type == null) {
            throw new IllegalArgumentException("toExecuteCommandOfType(): type must not be null");
        }
        return new MessageTypeExpectation(type, MessageKind.COMMAND);
    }

    public static Expectation toRecordEventOfType(Class<? extends Message> type) {
        if (type == null) {
            throw new IllegalArgumentException("toRecordEventOfType(): type must not be null");
        }
        return new MessageTypeExpectation(type, MessageKind.EVENT);
    }

    // ---------------------------------------------------------------------
    // Matchers
    // ---------------------------------------------------------------------

    /**
     * Passes if at least one command of type {@code T} is accepted by
     * {@code matcher}.
     */
    public static <T extends Message> Expectation toExecuteCommandMatching(Class<T> type, MessageMatcher<T> matcher) {
        return matchExpectation("toExecuteCommandMatching", type, matcher, MessageKind.COMMAND, false);
    }

    /**
     * Passes unless some executed command is rejected by {@code matcher}.
     * Commands of a type other than {@code T} are rejected.
     */
    public static <T extends Message> Expectation toOnlyExecuteCommandsMatching(Class<T> type, MessageMatcher<T> matcher) {
        return matchExpectation("toOnlyExecuteCommandsMatching", type, matcher, MessageKind.COMMAND, true);
    }

    /**
     * Passes if at least one event of type {@code T} is accepted by
     * {@code matcher}.
     */
    public static <T extends Message> Expectation toRecordEventMatching(Class<T> type, MessageMatcher<T> matcher) {
        return matchExpectation("toRecordEventMatching", type, matcher, MessageKind.EVENT, false);
    }

    /**
     * Passes unless some recorded event is rejected by {@code matcher}.
     * Events of a type other than {@code T} are rejected.
     */
    public static <T extends Message> Expectation toOnlyRecordEventsMatching(Class<T> type, MessageMatcher<T> matcher) {
        return matchExpectation("toOnlyRecordEventsMatching", type, matcher, MessageKind.EVENT, true);
    }

    // ---------------------------------------------------------------------
    // Combinators
    // ---------------------------------------------------------------------

    public static Expectation allOf(Expectation... children) {
        return CompositeExpectation.allOf(children(children));
    }

    public static Expectation anyOf(Expectation... children) {
        return CompositeExpectation.anyOf(children(children));
    }

    public static Expectation noneOf(Expectation... children) {
        return CompositeExpectation.noneOf(children(children));
    }

    public static Expectation not(Expectation child) {
        Objects.requireNonNull(child, "child");
        return new NotExpectation(child);
    }

    /**
     * Builds {@code n} expectations with {@code factory}, passing the
     * iteration number starting at zero, and requires all of them to pass.
     *
     * @param description an imperative phrase such as "debit a customer"
     */
    public static Expectation toRepeatedly(String description, int n, IntFunction<Expectation> factory) {
        if (factory == null) {
            throw new IllegalArgumentException(String.format(
                    "toRepeatedly(\"%s\", %d, <null>): function must not be null", description, n));
        }
        if (n < 1) {
            throw new IllegalArgumentException(String.format(
                    "toRepeatedly(\"%s\", %d, <func>): n must be 1 or greater", description, n));
        }
        if (description == null || description.isEmpty()) {
            throw new IllegalArgumentException(String.format(
                    "toRepeatedly(\"\", %d, <func>): description must not be empty", n));
        }
        return new RepeatExpectation(description, n, factory);
    }

    /**
     * Calls {@code body} after the action completes to check arbitrary
     * criteria against the facts it produced.
     *
     * @param description an imperative phrase such as "update the read model"
     */
    public static Expectation toSatisfy(String description, Consumer<SatisfyT> body) {
        if (body == null) {
            throw new IllegalArgumentException(String.format(
                    "toSatisfy(\"%s\", <null>): function must not be null", description));
        }
        if (description == null || description.isEmpty()) {
            throw new IllegalArgumentException("toSatisfy(\"\", <func>): description must not be empty");
        }
        return new SatisfyExpectation(description, body);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private static Expectation messageExpectation(String name, Message m, MessageKind kind) {
        if (m == null) {
            throw new IllegalArgumentException(name + "(<null>): message must not be null");
        }

        try {
            m.validate(new ValidationScope(kind));
        } catch (MessageValidationException e) {
            throw new IllegalArgumentException(String.format(
                    "%s(%s): %s", name, m.getClass().getName(), e.getMessage()), e);
        }

        return new MessageExpectation(m, kind, false);
    }

    private static <T extends Message> Expectation matchExpectation(
            String name,
            Class<T> type,
            MessageMatcher<T> matcher,
            MessageKind kind,
            boolean exhaustive
    ) {
        if (type == null) {
            throw new IllegalArgumentException(name + "(<null>, ...): type must not be null");
        }
        if (matcher == null) {
            throw new IllegalArgumentException(name + "(" + type.getName() + ", <null>): function must not be null");
        }

        // skip this method and the public factory that called it
        return new MessageMatchExpectation<>(type, matcher, kind, exhaustive, Location.ofCaller(2));
    }

    private static List<Expectation> children(Expectation[] children) {
        List<Expectation> list = Arrays.asList(children);
        for (Expectation e : list) {
            Objects.requireNonNull(e, "child expectation");
        }
        return list;
    }
}
