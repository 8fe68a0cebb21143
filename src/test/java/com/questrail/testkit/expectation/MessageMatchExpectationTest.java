package com.questrail.testkit.expectation;

import com.questrail.testkit.Runner;
import com.questrail.testkit.TestOption;
import com.questrail.testkit.config.HandlerType;
import com.questrail.testkit.fixtures.ExampleApp;
import com.questrail.testkit.fixtures.Messages.CommandA;
import com.questrail.testkit.fixtures.Messages.CommandB;
import com.questrail.testkit.fixtures.Messages.EventA;
import com.questrail.testkit.fixtures.Messages.EventB;
import com.questrail.testkit.fixtures.RecordingTestingT;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.questrail.testkit.Actions.executeCommand;
import static com.questrail.testkit.expectation.Expectations.toExecuteCommandMatching;
import static com.questrail.testkit.expectation.Expectations.toOnlyExecuteCommandsMatching;
import static com.questrail.testkit.expectation.Expectations.toOnlyRecordEventsMatching;
import static com.questrail.testkit.expectation.Expectations.toRecordEventMatching;
import static org.junit.jupiter.api.Assertions.*;

/**
 * MessageMatchExpectationTest
 * -----------------------------------------------------------------------------
 * The matcher-based expectations, in both their "any" and "only" forms.
 */
class MessageMatchExpectationTest {

    private Runner runner;
    private RecordingTestingT t;

    @BeforeEach
    void setUp() throws Exception {
        runner = Runner.create(ExampleApp.create());
        t = new RecordingTestingT();
    }

    private static MatchResult valueIs(String actual, String expected) {
        return actual.equals(expected)
                ? MatchResult.matched()
                : MatchResult.mismatch("value is " + actual);
    }

    @Test
    void passesWhenAnyMessageMatches() {
        runner.begin(t).expect(
                executeCommand(new CommandA("v")),
                toRecordEventMatching(EventA.class, e -> valueIs(e.value(), "v")));

        assertFalse(t.failed());
    }

    @Test
    void captionNamesTheMatcherLocation() {
        Expectation e = toExecuteCommandMatching(CommandB.class, c -> MatchResult.matched());

        assertTrue(e.caption().startsWith("to execute a command that matches the predicate near "), e.caption());
        assertTrue(e.caption().contains("MessageMatchExpectationTest"), e.caption());
    }

    @Test
    void failedMatchesAreListed() {
        runner.begin(t).expect(
                executeCommand(new CommandA("v")),
                toRecordEventMatching(EventA.class, e -> valueIs(e.value(), "w")));

        assertTrue(t.failed());

        String report = t.lastReport();
        assertTrue(report.contains("FAILED MATCHES"), report);
        assertTrue(report.contains("• " + EventA.class.getName() + ": value is v"), report);
        assertTrue(report.contains("• verify the logic within the predicate function"), report);
    }

    @Test
    void onlyFormPassesWhenNothingIsProduced() {
        runner.begin(t, TestOption.enableHandlerType(HandlerType.AGGREGATE, false)).expect(
                executeCommand(new CommandA("v")),
                toOnlyRecordEventsMatching(EventA.class, e -> MatchResult.mismatch("unreachable")));

        assertFalse(t.failed());
    }

    @Test
    void onlyFormRejectsMessagesOfOtherTypes() {
        runner.begin(t, TestOption.enableHandlerType(HandlerType.INTEGRATION, true)).expect(
                executeCommand(new CommandA("v")),
                toOnlyRecordEventsMatching(EventA.class, e -> MatchResult.matched()));

        assertTrue(t.failed());

        String report = t.lastReport();
        assertTrue(report.contains(EventB.class.getName() + ": predicate function expected " + EventA.class.getName()), report);
        assertTrue(report.contains("only 1 of 2 relevant events matched the predicate"), report);
    }

    @Test
    void onlyFormSummarisesFailures() {
        runner.begin(t).expect(
                executeCommand(new CommandA("v")),
                toOnlyExecuteCommandsMatching(CommandB.class, c -> MatchResult.mismatch("always")));

        String report = t.lastReport();
        assertTrue(report.contains("none of the 1 relevant commands matched the predicate"), report);
        assertTrue(report.contains("• " + CommandB.class.getName() + ": always"), report);
    }

    @Test
    void ignoredMessagesAreReported() {
        runner.begin(t).expect(
                executeCommand(new CommandA("v")),
                toRecordEventMatching(EventA.class, e -> MatchResult.ignored()));

        String report = t.lastReport();
        assertTrue(report.contains("• verify the logic within the predicate function, it ignored 1 event"), report);
    }

    @Test
    void factoriesRejectNulls() {
        assertThrows(IllegalArgumentException.class, () -> toRecordEventMatching(null, e -> MatchResult.matched()));
        assertThrows(IllegalArgumentException.class, () -> toRecordEventMatching(EventA.class, null));
    }

    @Test
    void mismatchNeedsAReason() {
        assertThrows(IllegalArgumentException.class, () -> MatchResult.mismatch(""));
    }
}
