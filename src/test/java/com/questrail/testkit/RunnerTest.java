package com.questrail.testkit;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.questrail.testkit.config.HandlerType;
import com.questrail.testkit.fact.DispatchFact;
import com.questrail.testkit.fact.FactBuffer;
import com.questrail.testkit.fact.HandlerSkipReason;
import com.questrail.testkit.fact.HandlingFact;
import com.questrail.testkit.fact.Slf4jFactLogger;
import com.questrail.testkit.fixtures.ExampleApp;
import com.questrail.testkit.fixtures.Messages.CommandA;
import com.questrail.testkit.fixtures.Messages.CommandB;
import com.questrail.testkit.fixtures.Messages.EventB;
import com.questrail.testkit.fixtures.RecordingTestingT;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.questrail.testkit.Actions.call;
import static com.questrail.testkit.Actions.executeCommand;
import static com.questrail.testkit.engine.OperationOption.withObserver;
import static com.questrail.testkit.expectation.Expectations.toExecuteCommand;
import static com.questrail.testkit.expectation.Expectations.toRecordEvent;
import static org.junit.jupiter.api.Assertions.*;

/**
 * RunnerTest
 * -----------------------------------------------------------------------------
 * Beginning tests, test options and the prepare/expect flow.
 */
class RunnerTest {

    private static final Instant T0 = Instant.parse("2020-01-01T00:00:00Z");

    private final AtomicInteger resets = new AtomicInteger();

    private Runner runner;
    private RecordingTestingT t;
    private FactBuffer buf;

    @BeforeEach
    void setUp() throws Exception {
        runner = Runner.create(ExampleApp.create(), b -> b
                .withResetter(resets::incrementAndGet)
                .withWallClock(() -> T0));
        t = new RecordingTestingT();
        buf = new FactBuffer();
    }

    private com.questrail.testkit.Test begin(TestOption... options) {
        TestOption[] all = new TestOption[options.length + 1];
        all[0] = TestOption.withOperationOption(withObserver(buf));
        System.arraycopy(options, 0, all, 1, options.length);
        return runner.begin(t, all);
    }

    // ------------------------------------------------------------------
    // Beginning a test
    // ------------------------------------------------------------------

    @Test
    void eachTestResetsTheEngine() {
        runner.begin(t);
        runner.begin(t);

        assertEquals(2, resets.get());
    }

    @Test
    void virtualClockStartsAtTheWallClockTime() {
        begin().prepare(executeCommand(new CommandA("v")));

        assertEquals(T0, buf.factsOfType(DispatchFact.CycleBegun.class).get(0).engineTime());
    }

    @Test
    void startTimeOptionSetsTheVirtualClock() {
        Instant start = Instant.parse("2030-06-01T12:00:00Z");

        begin(TestOption.startTime(start)).prepare(executeCommand(new CommandA("v")));

        assertEquals(start, buf.factsOfType(DispatchFact.CycleBegun.class).get(0).engineTime());
    }

    @Test
    void integrationsAndProjectionsAreDisabledByDefault() {
        begin().prepare(executeCommand(new CommandA("v")));

        List<HandlingFact.Skipped> skipped = buf.factsOfType(HandlingFact.Skipped.class);
        assertEquals(1, skipped.size());
        assertEquals("<integration>", skipped.get(0).handler().name());
        assertEquals(HandlerSkipReason.HANDLER_TYPE_DISABLED, skipped.get(0).reason());
    }

    @Test
    void handlerTypesCanBeEnabled() {
        begin(TestOption.enableHandlerType(HandlerType.INTEGRATION, true))
                .expect(executeCommand(new CommandA("v")), toRecordEvent(new EventB("v")));

        assertFalse(t.failed());
    }

    @Test
    void handlersCanBeEnabledAndDisabledByName() {
        begin().enableHandlers("<integration>")
                .expect(executeCommand(new CommandA("v")), toRecordEvent(new EventB("v")));
        assertFalse(t.failed());

        RecordingTestingT t2 = new RecordingTestingT();
        runner.begin(t2)
                .disableHandlers("<process>")
                .expect(executeCommand(new CommandA("v")), toExecuteCommand(new CommandB("v")));
        assertTrue(t2.failed());
    }

    @Test
    void verboseOptionLogsFacts() {
        Logger logger = (Logger) LoggerFactory.getLogger(Slf4jFactLogger.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);

        try {
            runner.begin(t).prepare(executeCommand(new CommandA("v")));
            assertTrue(appender.list.isEmpty());

            runner.begin(t, TestOption.verbose(true)).prepare(executeCommand(new CommandA("v")));
            assertFalse(appender.list.isEmpty());
        } finally {
            logger.detachAppender(appender);
            appender.stop();
        }
    }

    // ------------------------------------------------------------------
    // prepare / expect
    // ------------------------------------------------------------------

    @Test
    void prepareLogsEachAction() {
        begin().prepare(executeCommand(new CommandA("a")), executeCommand(new CommandA("b")));

        assertEquals(2, buf.factsOfType(DispatchFact.CycleBegun.class).size());
        assertTrue(t.logged("--- executing " + CommandA.class.getName() + " command ---"));
        assertFalse(t.failed());
    }

    @Test
    void prepareStopsAtTheFirstFailedAction() {
        begin().prepare(
                call(() -> {
                    throw new IOException("boom");
                }),
                executeCommand(new CommandA("v")));

        assertTrue(t.failed());
        assertTrue(t.loggedContaining("calling user-defined function near RunnerTest.java:"));
        assertTrue(t.loggedContaining(": boom"));
        assertTrue(buf.factsOfType(DispatchFact.CycleBegun.class).isEmpty());
    }

    @Test
    void expectLogsTheActionAndExpectation() {
        begin().expect(executeCommand(new CommandA("v")), toExecuteCommand(new CommandB("v")));

        assertTrue(t.logged(String.format(
                "--- expect [executing %s command] to execute a specific '%s' command ---",
                CommandA.class.getName(), CommandB.class.getName())));
        assertFalse(t.failed());
    }

    @Test
    void failedActionProducesNoReport() {
        begin().expect(call(() -> {
            throw new IOException("boom");
        }), toExecuteCommand(new CommandB("v")));

        assertTrue(t.failed());
        assertThrows(IllegalStateException.class, t::lastReport);
    }

    @Test
    void uncheckedExceptionsFromUserCodePropagate() {
        com.questrail.testkit.Test test = begin();

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> test.prepare(call(() -> {
            throw new IllegalStateException("bug");
        })));

        assertEquals("bug", e.getMessage());
        assertFalse(t.failed());
    }

    @Test
    void fatalStopsTheTestWithTheDefaultTestingT() {
        RecordingTestingT stopping = new RecordingTestingT().stopOnFatal();

        TestFailedError e = assertThrows(TestFailedError.class, () -> runner.begin(stopping).prepare(call(() -> {
            throw new IOException("boom");
        })));

        assertTrue(e.getMessage().endsWith(": boom"));
    }
}
