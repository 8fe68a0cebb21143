package com.questrail.testkit;

import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.fixtures.ExampleApp;
import com.questrail.testkit.fixtures.Messages.CommandA;
import com.questrail.testkit.fixtures.Messages.EventA;
import com.questrail.testkit.fixtures.RecordingTestingT;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static com.questrail.testkit.Actions.call;
import static com.questrail.testkit.TestOption.interceptCommandExecutor;
import static com.questrail.testkit.expectation.Expectations.toRecordEvent;
import static org.junit.jupiter.api.Assertions.*;

/**
 * InterceptCommandExecutorTest
 * -----------------------------------------------------------------------------
 * Interceptors installed on the test's command executor for a whole test or
 * for a single call.
 */
class InterceptCommandExecutorTest {

    private final OperationContext ctx = OperationContext.background();

    private Runner runner;
    private RecordingTestingT t;
    private List<String> intercepted;

    @BeforeEach
    void setUp() throws Exception {
        runner = Runner.create(ExampleApp.create());
        t = new RecordingTestingT();
        intercepted = new ArrayList<>();
    }

    @Test
    void testInterceptorReplacesExecution() {
        com.questrail.testkit.Test test = runner.begin(t, interceptCommandExecutor((c, m, next) ->
                intercepted.add(m.describe())));

        test.expect(
                call(() -> test.commandExecutor().executeCommand(ctx, new CommandA("v"))),
                toRecordEvent(new EventA("v")));

        assertTrue(t.failed());
        assertEquals(List.of(new CommandA("v").describe()), intercepted);
    }

    @Test
    void interceptorMayForwardToTheEngine() {
        com.questrail.testkit.Test test = runner.begin(t, interceptCommandExecutor((c, m, next) -> {
            intercepted.add(m.describe());
            next.executeCommand(c, m);
        }));

        test.expect(
                call(() -> test.commandExecutor().executeCommand(ctx, new CommandA("v"))),
                toRecordEvent(new EventA("v")));

        assertFalse(t.failed());
        assertEquals(1, intercepted.size());
    }

    @Test
    void interceptorCanSimulateFailures() {
        com.questrail.testkit.Test test = runner.begin(t, interceptCommandExecutor((c, m, next) -> {
            throw new IOException("<executor unavailable>");
        }));

        List<Exception> seen = new ArrayList<>();
        test.prepare(call(() -> {
            try {
                test.commandExecutor().executeCommand(ctx, new CommandA("v"));
            } catch (IOException e) {
                seen.add(e);
            }
        }));

        assertFalse(t.failed());
        assertEquals(1, seen.size());
        assertEquals("<executor unavailable>", seen.get(0).getMessage());
    }

    @Test
    void callInterceptorAppliesOnlyDuringTheCall() {
        com.questrail.testkit.Test test = runner.begin(t, interceptCommandExecutor((c, m, next) ->
                intercepted.add("test")));

        test.prepare(
                call(() -> test.commandExecutor().executeCommand(ctx, new CommandA("v")),
                        interceptCommandExecutor((c, m, next) -> intercepted.add("call"))),
                call(() -> test.commandExecutor().executeCommand(ctx, new CommandA("v"))));

        assertEquals(List.of("call", "test"), intercepted);
    }

    @Test
    void interceptedExecutorIsStillUnboundOutsideOfCall() {
        com.questrail.testkit.Test test = runner.begin(t, interceptCommandExecutor((c, m, next) ->
                intercepted.add("test")));

        assertThrows(IllegalStateException.class, () -> test.commandExecutor().executeCommand(ctx, new CommandA("v")));
        assertTrue(intercepted.isEmpty());
    }

    @Test
    void nullInterceptorIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> interceptCommandExecutor(null));

        assertEquals("interceptCommandExecutor(<null>): function must not be null", e.getMessage());
    }
}
