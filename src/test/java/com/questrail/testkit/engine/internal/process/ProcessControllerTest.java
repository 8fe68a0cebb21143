package com.questrail.testkit.engine.internal.process;

import com.questrail.testkit.api.Identity;
import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.config.ApplicationConfig;
import com.questrail.testkit.config.ProcessConfig;
import com.questrail.testkit.engine.Engine;
import com.questrail.testkit.engine.UnexpectedBehaviorException;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.envelope.EventStreams;
import com.questrail.testkit.envelope.MessageIdGenerator;
import com.questrail.testkit.fact.FactBuffer;
import com.questrail.testkit.fact.ProcessFact;
import com.questrail.testkit.fixtures.ApplicationStub;
import com.questrail.testkit.fixtures.Messages.CommandA;
import com.questrail.testkit.fixtures.Messages.CommandB;
import com.questrail.testkit.fixtures.Messages.EventA;
import com.questrail.testkit.fixtures.Messages.TimeoutA;
import com.questrail.testkit.fixtures.ProcessStub;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.questrail.testkit.api.Route.executesCommand;
import static com.questrail.testkit.api.Route.handlesEvent;
import static com.questrail.testkit.api.Route.schedulesTimeout;
import static com.questrail.testkit.engine.OperationOption.withCurrentTime;
import static com.questrail.testkit.engine.OperationOption.withObserver;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ProcessControllerTest
 * -----------------------------------------------------------------------------
 * Timeout queue and instance lifecycle for process handlers.
 */
class ProcessControllerTest {

    private static final Instant T0 = Instant.parse("2020-01-01T00:00:00Z");

    private final OperationContext ctx = OperationContext.background();

    private ProcessStub process;
    private FactBuffer buf;

    @BeforeEach
    void setUp() {
        process = new ProcessStub("<process>", "<process-key>")
                .routes(handlesEvent(EventA.class), executesCommand(CommandA.class), schedulesTimeout(TimeoutA.class));
        buf = new FactBuffer();
    }

    private ProcessController<?> controller() throws Exception {
        ApplicationConfig app = ApplicationConfig.of(new ApplicationStub().process(process));
        ProcessConfig config = (ProcessConfig) app.handlerByName("<process>").orElseThrow();
        return ProcessController.create(config, new MessageIdGenerator());
    }

    private final EventStreams streams = new EventStreams();

    private Envelope event(String value) {
        return Envelope.newEvent("<id>", new EventA(value), T0, streams.next(new Identity("<app>", "<app-key>")));
    }

    private static List<String> values(List<Envelope> envelopes) {
        return envelopes.stream()
                .map(e -> ((TimeoutA) e.message()).value())
                .collect(Collectors.toList());
    }

    // ------------------------------------------------------------------
    // Timeout queue
    // ------------------------------------------------------------------

    @Test
    void tickReleasesOnlyDueTimeoutsInScheduleOrder() throws Exception {
        process.onEvent((c, root, s, m) -> {
            s.scheduleTimeout(new TimeoutA("+20"), T0.plusSeconds(20));
            s.scheduleTimeout(new TimeoutA("+10"), T0.plusSeconds(10));
            s.scheduleTimeout(new TimeoutA("+10 again"), T0.plusSeconds(10));
        });
        ProcessController<?> controller = controller();

        List<Envelope> produced = controller.handle(ctx, buf, T0, event("a"));
        assertTrue(produced.isEmpty());
        assertEquals(3, controller.pendingTimeoutCount());

        assertEquals(List.of(), controller.tick(ctx, buf, T0.plusSeconds(9)));
        assertEquals(List.of("+10", "+10 again"), values(controller.tick(ctx, buf, T0.plusSeconds(10))));
        assertEquals(1, controller.pendingTimeoutCount());
        assertEquals(List.of("+20"), values(controller.tick(ctx, buf, T0.plusSeconds(60))));
        assertEquals(0, controller.pendingTimeoutCount());
    }

    @Test
    void commandsAreProducedBeforeReadyTimeouts() throws Exception {
        process.onEvent((c, root, s, m) -> {
            s.scheduleTimeout(new TimeoutA("now"), T0);
            s.executeCommand(new CommandA("cmd"));
        });
        ProcessController<?> controller = controller();

        List<Envelope> produced = controller.handle(ctx, buf, T0, event("a"));

        assertEquals(2, produced.size());
        assertEquals(new CommandA("cmd"), produced.get(0).message());
        assertEquals(new TimeoutA("now"), produced.get(1).message());
        assertEquals(0, controller.pendingTimeoutCount());
    }

    @Test
    void endingAnInstanceCancelsItsPendingTimeouts() throws Exception {
        process.onEvent((c, root, s, m) -> {
            if (((EventA) m).value().equals("schedule")) {
                s.scheduleTimeout(new TimeoutA("t"), T0.plusSeconds(10));
            } else {
                s.end();
            }
        });
        ProcessController<?> controller = controller();

        controller.handle(ctx, buf, T0, event("schedule"));
        assertEquals(1, controller.pendingTimeoutCount());

        controller.handle(ctx, buf, T0, event("end"));
        assertEquals(0, controller.pendingTimeoutCount());
    }

    @Test
    void readyTimeoutsAreProducedEvenIfTheInstanceEnds() throws Exception {
        process.onEvent((c, root, s, m) -> {
            s.executeCommand(new CommandA("cmd"));
            s.scheduleTimeout(new TimeoutA("now"), T0);
            s.scheduleTimeout(new TimeoutA("later"), T0.plusSeconds(10));
            s.end();
        });
        ProcessController<?> controller = controller();

        List<Envelope> produced = controller.handle(ctx, buf, T0, event("a"));

        assertEquals(2, produced.size());
        assertEquals(new CommandA("cmd"), produced.get(0).message());
        assertEquals(new TimeoutA("now"), produced.get(1).message());
        assertEquals(0, controller.pendingTimeoutCount());
    }

    @Test
    void resetDiscardsInstancesAndTimeouts() throws Exception {
        process.onEvent((c, root, s, m) -> s.scheduleTimeout(new TimeoutA("t"), T0.plusSeconds(10)));
        ProcessController<?> controller = controller();

        controller.handle(ctx, buf, T0, event("a"));
        controller.reset();
        buf.clear();
        controller.handle(ctx, buf, T0, event("a"));

        assertEquals(1, controller.pendingTimeoutCount());
        assertTrue(buf.hasFactOfType(ProcessFact.InstanceNotFound.class));
    }

    // ------------------------------------------------------------------
    // Lifecycle through the engine
    // ------------------------------------------------------------------

    @Test
    void timeoutForAnInstanceEndedEarlierInTheCycleIsDropped() throws Exception {
        List<String> handled = new ArrayList<>();
        process.onEvent((c, root, s, m) -> {
                    s.scheduleTimeout(new TimeoutA("first"), s.now());
                    s.scheduleTimeout(new TimeoutA("second"), s.now());
                })
                .onTimeout((c, root, s, m) -> {
                    handled.add(((TimeoutA) m).value());
                    s.end();
                });
        Engine engine = Engine.builder(new ApplicationStub().process(process)).build();

        engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0), withObserver(buf));

        assertEquals(List.of("first"), handled);
        assertEquals(1, buf.factsOfType(ProcessFact.TimeoutRoutedToEndedInstance.class).size());
    }

    @Test
    void readyTimeoutScheduledBeforeEndingIsRoutedToTheEndedInstance() throws Exception {
        List<String> handled = new ArrayList<>();
        process.onEvent((c, root, s, m) -> {
                    s.scheduleTimeout(new TimeoutA("now"), s.now());
                    s.end();
                })
                .onTimeout((c, root, s, m) -> handled.add(((TimeoutA) m).value()));
        Engine engine = Engine.builder(new ApplicationStub().process(process)).build();

        engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0), withObserver(buf));

        assertTrue(handled.isEmpty());
        List<ProcessFact.TimeoutRoutedToEndedInstance> routed =
                buf.factsOfType(ProcessFact.TimeoutRoutedToEndedInstance.class);
        assertEquals(1, routed.size());
        assertEquals(new TimeoutA("now"), routed.get(0).envelope().message());
    }

    @Test
    void rootIsKeptBetweenCalls() throws Exception {
        process.onEvent((c, root, s, m) -> root.seen().add(m));
        Engine engine = Engine.builder(new ApplicationStub().process(process)).build();

        engine.dispatch(ctx, new EventA("1"), withCurrentTime(T0), withObserver(buf));
        engine.dispatch(ctx, new EventA("2"), withCurrentTime(T0), withObserver(buf));

        ProcessFact.InstanceLoaded loaded = buf.factsOfType(ProcessFact.InstanceLoaded.class).get(0);
        assertEquals(List.of(new EventA("1"), new EventA("2")), ((ProcessStub.Root) loaded.root()).seen());
    }

    @Test
    void executingAnUnroutedCommandIsUnexpectedBehavior() throws Exception {
        process.onEvent((c, root, s, m) -> s.executeCommand(new CommandB("b")));
        Engine engine = Engine.builder(new ApplicationStub().process(process)).build();

        UnexpectedBehaviorException e = assertThrows(UnexpectedBehaviorException.class, () ->
                engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0)));

        assertEquals("handleEvent", e.method());
        assertTrue(e.description().contains("not produced by this handler"));
    }

    @Test
    void schedulingAnInvalidTimeoutIsUnexpectedBehavior() throws Exception {
        process.onEvent((c, root, s, m) -> s.scheduleTimeout(new TimeoutA("<invalid>"), s.now()));
        Engine engine = Engine.builder(new ApplicationStub().process(process)).build();

        UnexpectedBehaviorException e = assertThrows(UnexpectedBehaviorException.class, () ->
                engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0)));

        assertTrue(e.description().startsWith("scheduled an invalid"));
    }

    @Test
    void emptyInstanceIdIsUnexpectedBehavior() throws Exception {
        process.routeWith((c, m) -> Optional.of(""));
        Engine engine = Engine.builder(new ApplicationStub().process(process)).build();

        UnexpectedBehaviorException e = assertThrows(UnexpectedBehaviorException.class, () ->
                engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0)));

        assertEquals("routeEventToInstance", e.method());
    }
}
