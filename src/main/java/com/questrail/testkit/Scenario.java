package com.questrail.testkit;

import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.expectation.PredicateOptions;
import com.questrail.testkit.location.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scenario
 * =============================================================================
 * A reusable sequence of actions that prepares several tests with the same
 * initial state.
 *
 * <p>Scenarios are immutable. Each builder method returns a new scenario with
 * one more action, so a shared scenario can be extended differently by each
 * test. {@link #scenario(String)} on an existing scenario starts a nested
 * scenario that keeps the actions so far.</p>
 *
 * <pre>{@code
 * Scenario openAccounts = Scenario.of("when there are open accounts")
 *         .executeCommand(new OpenAccount("A1", "Anna"))
 *         .executeCommand(new OpenAccount("B1", "Bob"));
 *
 * openAccounts.scenario("when one account is funded")
 *         .executeCommand(new Deposit("A1", 500))
 *         .prepare(test);
 * }</pre>
 *
 * <p>A scenario is also an {@link Action}, so it can be passed to
 * {@link Test#prepare} or {@link Test#expect} like any other action.</p>
 */
public final class Scenario implements Action {

    private final List<String> captions;
    private final List<Action> actions;
    private final Location location;

    private Scenario(List<String> captions, List<Action> actions, Location location) {
        this.captions = captions;
        this.actions = actions;
        this.location = location;
    }

    /**
     * Starts a new scenario.
     *
     * @throws IllegalArgumentException if {@code caption} is null or empty
     */
    public static Scenario of(String caption) {
        return new Scenario(List.of(checkCaption(caption)), List.of(), Location.ofCall());
    }

    /**
     * Starts a nested scenario that begins with this scenario's actions.
     */
    public Scenario scenario(String caption) {
        List<String> c = new ArrayList<>(captions);
        c.add(checkCaption(caption));
        return new Scenario(Collections.unmodifiableList(c), actions, Location.ofCall());
    }

    public Scenario executeCommand(Message command) {
        return then(Actions.dispatch("executeCommand", command, MessageKind.COMMAND, Location.ofCall()));
    }

    public Scenario recordEvent(Message event) {
        return then(Actions.dispatch("recordEvent", event, MessageKind.EVENT, Location.ofCall()));
    }

    public Scenario advanceTime(TimeAdjustment adjustment) {
        return then(Actions.advanceTime(adjustment, Location.ofCall()));
    }

    public Scenario call(Actions.CallBody body, CallOption... options) {
        return then(Actions.call(body, List.of(options), Location.ofCall()));
    }

    /**
     * Performs the scenario's actions within {@code test}, logging its
     * captions first.
     */
    public void prepare(Test test) {
        TestingT t = test.testingT();
        t.helper();

        t.log("=== SCENARIO ===");
        for (String c : captions) {
            t.log(" • " + c);
        }

        test.prepare(actions.toArray(new Action[0]));
    }

    public List<String> captions() {
        return captions;
    }

    public List<Action> actions() {
        return actions;
    }

    // ---------------------------------------------------------------------
    // Action
    // ---------------------------------------------------------------------

    @Override
    public String caption() {
        return String.join(" / ", captions);
    }

    @Override
    public Location location() {
        return location;
    }

    @Override
    public PredicateOptions configurePredicate(PredicateOptions options) {
        for (Action a : actions) {
            options = a.configurePredicate(options);
        }
        return options;
    }

    /**
     * Runs each action in turn and stops at the first failure, which is
     * reported against the failing action.
     */
    @Override
    public void run(OperationContext ctx, ActionScope scope) throws Exception {
        for (Action a : actions) {
            scope.testingT().log(String.format("--- %s ---", a.caption()));
            try {
                a.run(ctx, scope);
            } catch (RuntimeException | InterruptedException e) {
                throw e;
            } catch (Exception e) {
                throw new ActionException(String.format("%s near %s: %s", a.caption(), a.location(), e.getMessage()), e);
            }
        }
    }

    private Scenario then(Action a) {
        List<Action> next = new ArrayList<>(actions);
        next.add(a);
        return new Scenario(captions, Collections.unmodifiableList(next), location);
    }

    private static String checkCaption(String caption) {
        if (caption == null || caption.isEmpty()) {
            throw new IllegalArgumentException("scenario(): caption must not be empty");
        }
        return caption;
    }
}
