package com.questrail.testkit.engine;

import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.api.UnexpectedMessageException;
import com.questrail.testkit.config.ConfigurationException;
import com.questrail.testkit.config.HandlerConfig;
import com.questrail.testkit.engine.internal.projection.CheckpointConflictException;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.envelope.EventStreams;
import com.questrail.testkit.fact.AggregateFact;
import com.questrail.testkit.fact.DispatchFact;
import com.questrail.testkit.fact.Fact;
import com.questrail.testkit.fact.FactBuffer;
import com.questrail.testkit.fact.HandlerSkipReason;
import com.questrail.testkit.fact.HandlingFact;
import com.questrail.testkit.fact.ProcessFact;
import com.questrail.testkit.fact.TickFact;
import com.questrail.testkit.fixtures.AggregateStub;
import com.questrail.testkit.fixtures.ApplicationStub;
import com.questrail.testkit.fixtures.IntegrationStub;
import com.questrail.testkit.fixtures.Messages.CommandA;
import com.questrail.testkit.fixtures.Messages.CommandB;
import com.questrail.testkit.fixtures.Messages.EventA;
import com.questrail.testkit.fixtures.Messages.EventB;
import com.questrail.testkit.fixtures.Messages.TimeoutA;
import com.questrail.testkit.fixtures.Messages.Unrouted;
import com.questrail.testkit.fixtures.ProcessStub;
import com.questrail.testkit.fixtures.ProjectionStub;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static com.questrail.testkit.api.Route.executesCommand;
import static com.questrail.testkit.api.Route.handlesCommand;
import static com.questrail.testkit.api.Route.handlesEvent;
import static com.questrail.testkit.api.Route.recordsEvent;
import static com.questrail.testkit.api.Route.schedulesTimeout;
import static com.questrail.testkit.engine.OperationOption.enableHandler;
import static com.questrail.testkit.engine.OperationOption.enableIntegrations;
import static com.questrail.testkit.engine.OperationOption.withCurrentTime;
import static com.questrail.testkit.engine.OperationOption.withObserver;
import static org.junit.jupiter.api.Assertions.*;

/**
 * EngineTest
 * -----------------------------------------------------------------------------
 * End-to-end behaviour of dispatch and tick cycles across all four handler
 * types.
 *
 * <p>The application wires an aggregate that records EventA for CommandA, a
 * process that reacts to EventA, an integration that handles CommandB and a
 * projection of EventA and EventB.</p>
 */
class EngineTest {

    private static final Instant T0 = Instant.parse("2020-01-01T00:00:00Z");

    private final OperationContext ctx = OperationContext.background();

    private AggregateStub aggregate;
    private ProcessStub process;
    private IntegrationStub integration;
    private ProjectionStub projection;
    private FactBuffer buf;

    @BeforeEach
    void setUp() {
        aggregate = new AggregateStub("<aggregate>", "<aggregate-key>")
                .routes(handlesCommand(CommandA.class), recordsEvent(EventA.class))
                .onCommand((root, s, m) -> s.recordEvent(new EventA(((CommandA) m).value())));

        process = new ProcessStub("<process>", "<process-key>")
                .routes(handlesEvent(EventA.class), executesCommand(CommandB.class), schedulesTimeout(TimeoutA.class));

        integration = new IntegrationStub("<integration>", "<integration-key>")
                .routes(handlesCommand(CommandB.class), recordsEvent(EventB.class));

        projection = new ProjectionStub("<projection>", "<projection-key>")
                .routes(handlesEvent(EventA.class), handlesEvent(EventB.class));

        buf = new FactBuffer();
    }

    private Engine engine() throws ConfigurationException {
        return Engine.builder(new ApplicationStub()
                        .aggregate(aggregate)
                        .process(process)
                        .integration(integration)
                        .projection(projection))
                .build();
    }

    private static List<Class<?>> types(List<? extends Fact> facts) {
        return facts.stream().map(Object::getClass).collect(Collectors.toList());
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    @Test
    void commandHandledByAggregateProducesCausalFactSequence() throws Exception {
        Engine engine = engine();

        engine.dispatch(ctx, new CommandA("v"), withCurrentTime(T0), withObserver(buf),
                OperationOption.enableProcesses(false), OperationOption.enableProjections(false));

        assertEquals(List.of(
                DispatchFact.CycleBegun.class,
                DispatchFact.Begun.class,
                HandlingFact.Begun.class,
                AggregateFact.InstanceNotFound.class,
                AggregateFact.InstanceCreated.class,
                AggregateFact.EventRecorded.class,
                HandlingFact.Completed.class,
                DispatchFact.Completed.class,
                DispatchFact.Begun.class,
                HandlingFact.Skipped.class,
                HandlingFact.Skipped.class,
                DispatchFact.Completed.class,
                DispatchFact.CycleCompleted.class
        ), types(buf.facts()));

        AggregateFact.EventRecorded recorded = buf.factsOfType(AggregateFact.EventRecorded.class).get(0);
        Envelope event = recorded.eventEnvelope();
        assertEquals(new EventA("v"), event.message());
        assertEquals(0, event.eventStreamOffset());
        assertEquals(EventStreams.streamIdOf(aggregate(engine).identity()), event.eventStreamId());
        assertEquals("<instance>", event.origin().orElseThrow().instanceId());

        DispatchFact.CycleCompleted done = buf.factsOfType(DispatchFact.CycleCompleted.class).get(0);
        assertNull(done.error());
    }

    @Test
    void everyEnvelopeIsCorrelatedWithTheRoot() throws Exception {
        process.onEvent((c, root, s, m) -> s.executeCommand(new CommandB("b")));
        integration.onCommand((c, s, m) -> s.recordEvent(new EventB("b")));
        Engine engine = engine();

        engine.dispatch(ctx, new CommandA("a"), withCurrentTime(T0), withObserver(buf));

        List<Envelope> envelopes = buf.factsOfType(DispatchFact.Begun.class).stream()
                .map(DispatchFact.Begun::envelope)
                .collect(Collectors.toList());

        assertEquals(4, envelopes.size());
        Envelope root = envelopes.get(0);
        assertTrue(root.isRoot());

        for (int i = 1; i < envelopes.size(); i++) {
            Envelope child = envelopes.get(i);
            assertEquals(root.messageId(), child.correlationId());
            assertEquals(envelopes.get(i - 1).messageId(), child.causationId());
        }

        assertEquals(List.of(new EventA("a"), new EventB("b")), projection.applied());
    }

    @Test
    void eventsRecordedByTheSameHandlerShareADenseStream() throws Exception {
        Engine engine = engine();

        engine.dispatch(ctx, new CommandA("1"), withCurrentTime(T0), withObserver(buf));
        engine.dispatch(ctx, new CommandA("2"), withCurrentTime(T0), withObserver(buf));
        engine.dispatch(ctx, new EventA("3"), withCurrentTime(T0), withObserver(buf));

        List<Envelope> events = buf.factsOfType(AggregateFact.EventRecorded.class).stream()
                .map(AggregateFact.EventRecorded::eventEnvelope)
                .collect(Collectors.toList());

        assertEquals(events.get(0).eventStreamId(), events.get(1).eventStreamId());
        assertEquals(0, events.get(0).eventStreamOffset());
        assertEquals(1, events.get(1).eventStreamOffset());

        Envelope direct = buf.factsOfType(DispatchFact.CycleBegun.class).get(2).envelope();
        assertEquals(EventStreams.streamIdOf(engine.configuration().identity()), direct.eventStreamId());
        assertEquals(0, direct.eventStreamOffset());
    }

    @Test
    void unroutableMessageEmitsOnlyASkippedCycle() throws Exception {
        Engine engine = engine();

        engine.dispatch(ctx, new Unrouted("x"), withCurrentTime(T0), withObserver(buf));

        assertEquals(List.of(DispatchFact.CycleSkipped.class), types(buf.facts()));
    }

    @Test
    void invalidMessageIsRejected() throws Exception {
        Engine engine = engine();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
                engine.dispatch(ctx, new CommandA("<invalid>"), withObserver(buf)));

        assertTrue(e.getMessage().contains("cannot dispatch invalid"));
        assertTrue(buf.facts().isEmpty());
    }

    @Test
    void timeoutCannotBeDispatchedDirectly() throws Exception {
        Engine engine = engine();

        assertThrows(IllegalArgumentException.class, () -> engine.dispatch(ctx, new TimeoutA("t")));
    }

    @Test
    void unknownHandlerNameInOptionsIsRejected() throws Exception {
        Engine engine = engine();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
                engine.dispatch(ctx, new CommandA("a"), enableHandler("<missing>", true)));

        assertEquals("the '<app>' application does not have a handler named '<missing>'", e.getMessage());
    }

    // ------------------------------------------------------------------
    // Skipping
    // ------------------------------------------------------------------

    @Test
    void disabledHandlersAreSkippedWithTheirReason() throws Exception {
        projection.disabled();
        process.onEvent((c, root, s, m) -> s.executeCommand(new CommandB("b")));
        Engine engine = engine();

        engine.dispatch(ctx, new CommandA("a"), withCurrentTime(T0), withObserver(buf),
                enableIntegrations(false), enableHandler("<process>", true));

        List<HandlingFact.Skipped> skipped = buf.factsOfType(HandlingFact.Skipped.class);
        assertEquals(2, skipped.size());

        assertEquals("<projection>", skipped.get(0).handler().name());
        assertEquals(HandlerSkipReason.INDIVIDUAL_HANDLER_DISABLED_BY_CONFIGURATION, skipped.get(0).reason());

        assertEquals("<integration>", skipped.get(1).handler().name());
        assertEquals(HandlerSkipReason.HANDLER_TYPE_DISABLED, skipped.get(1).reason());
    }

    @Test
    void handlerOptionTakesPrecedenceOverConfigurationAndType() throws Exception {
        projection.disabled();
        Engine engine = engine();

        engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0), withObserver(buf),
                OperationOption.enableProjections(false),
                enableHandler("<projection>", true),
                enableHandler("<process>", false));

        assertEquals(List.of(new EventA("a")), projection.applied());

        List<HandlingFact.Skipped> skipped = buf.factsOfType(HandlingFact.Skipped.class);
        assertEquals(1, skipped.size());
        assertEquals(HandlerSkipReason.INDIVIDUAL_HANDLER_DISABLED, skipped.get(0).reason());
    }

    // ------------------------------------------------------------------
    // Processes and time
    // ------------------------------------------------------------------

    @Test
    void timeoutIsDeliveredOnceTheClockReachesIt() throws Exception {
        process.onEvent((c, root, s, m) -> s.scheduleTimeout(new TimeoutA("t"), s.now().plusSeconds(10)));
        Engine engine = engine();

        engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0), withObserver(buf));

        assertEquals(List.of(
                ProcessFact.InstanceNotFound.class,
                ProcessFact.InstanceBegun.class,
                ProcessFact.TimeoutScheduled.class
        ), types(buf.factsOfType(ProcessFact.class)));

        buf.clear();
        engine.tick(ctx, withCurrentTime(T0.plusSeconds(5)), withObserver(buf));
        assertFalse(buf.hasFactOfType(DispatchFact.Begun.class));

        buf.clear();
        engine.tick(ctx, withCurrentTime(T0.plusSeconds(10)), withObserver(buf));

        Envelope timeout = buf.factsOfType(DispatchFact.Begun.class).get(0).envelope();
        assertEquals(new TimeoutA("t"), timeout.message());
        assertEquals(T0.plusSeconds(10), timeout.scheduledFor().orElseThrow());
        assertTrue(buf.hasFactOfType(ProcessFact.InstanceLoaded.class));
        assertTrue(buf.hasFactOfType(TickFact.CycleCompleted.class));
    }

    @Test
    void timeoutScheduledForNowIsDeliveredInTheSameCycle() throws Exception {
        List<String> delivered = new ArrayList<>();
        process.onEvent((c, root, s, m) -> s.scheduleTimeout(new TimeoutA("now"), s.now()))
                .onTimeout((c, root, s, m) -> delivered.add(((TimeoutA) m).value()));
        Engine engine = engine();

        engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0));

        assertEquals(List.of("now"), delivered);
    }

    @Test
    void timeoutsAreDeliveredInScheduleOrder() throws Exception {
        List<String> delivered = new ArrayList<>();
        process.onEvent((c, root, s, m) -> {
                    s.scheduleTimeout(new TimeoutA("late"), s.now().plusSeconds(20));
                    s.scheduleTimeout(new TimeoutA("early"), s.now().plusSeconds(10));
                    s.scheduleTimeout(new TimeoutA("early-2"), s.now().plusSeconds(10));
                })
                .onTimeout((c, root, s, m) -> delivered.add(((TimeoutA) m).value()));
        Engine engine = engine();

        engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0));
        engine.tick(ctx, withCurrentTime(T0.plusSeconds(30)));

        assertEquals(List.of("early", "early-2", "late"), delivered);
    }

    @Test
    void endedProcessReceivesNoFurtherMessages() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        process.onEvent((c, root, s, m) -> {
                    calls.incrementAndGet();
                    s.scheduleTimeout(new TimeoutA("t"), s.now().plusSeconds(10));
                    s.end();
                })
                .onTimeout((c, root, s, m) -> fail("timeout delivered to ended instance"));
        Engine engine = engine();

        engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0), withObserver(buf));
        engine.dispatch(ctx, new EventA("b"), withCurrentTime(T0), withObserver(buf));
        engine.tick(ctx, withCurrentTime(T0.plusSeconds(60)), withObserver(buf));

        assertEquals(1, calls.get());
        assertEquals(1, buf.factsOfType(ProcessFact.InstanceEnded.class).size());
        assertEquals(1, buf.factsOfType(ProcessFact.EventRoutedToEndedInstance.class).size());
        assertFalse(buf.hasFactOfType(ProcessFact.TimeoutRoutedToEndedInstance.class));
    }

    @Test
    void executingACommandAfterEndingRevertsTheEnd() throws Exception {
        process.onEvent((c, root, s, m) -> {
            s.end();
            s.end();
            s.executeCommand(new CommandB("b"));
        });
        Engine engine = engine();

        engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0), withObserver(buf));
        buf.clear();
        engine.dispatch(ctx, new EventA("b"), withCurrentTime(T0), withObserver(buf));

        assertTrue(buf.hasFactOfType(ProcessFact.InstanceLoaded.class));
        assertFalse(buf.hasFactOfType(ProcessFact.EventRoutedToEndedInstance.class));
    }

    @Test
    void eventsNotRoutedToAnInstanceAreIgnored() throws Exception {
        process.routeWith((c, m) -> Optional.empty());
        Engine engine = engine();

        engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0), withObserver(buf));

        assertTrue(buf.hasFactOfType(ProcessFact.EventIgnored.class));
        assertFalse(buf.hasFactOfType(ProcessFact.InstanceBegun.class));
    }

    // ------------------------------------------------------------------
    // Projections
    // ------------------------------------------------------------------

    @Test
    void projectionSkipsEventsBeforeItsCheckpoint() throws Exception {
        Engine engine = engine();

        engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0));
        assertEquals(1, projection.applied().size());

        // offsets restart but the projection keeps its own checkpoints
        engine.reset();
        engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0), withObserver(buf));

        assertEquals(1, projection.applied().size());
        assertTrue(buf.factsOfType(HandlingFact.Completed.class).stream()
                .noneMatch(f -> f.handler().name().equals("<projection>") && f.error() != null));
    }

    @Test
    void projectionReturningTheWrongCheckpointFailsTheDispatch() throws Exception {
        projection.skewCheckpoints(1);
        Engine engine = engine();

        EngineException e = assertThrows(EngineException.class, () ->
                engine.dispatch(ctx, new EventA("a"), withCurrentTime(T0), withObserver(buf)));

        assertEquals(1, e.errors().size());
        HandlerException he = (HandlerException) e.errors().get(0);
        assertEquals("<projection>", he.handler().name());
        assertTrue(he.getCause() instanceof CheckpointConflictException);
        assertTrue(he.getMessage().contains("expected 1"));
    }

    // ------------------------------------------------------------------
    // Errors
    // ------------------------------------------------------------------

    @Test
    void handlerErrorsAreAccumulatedAndTheQueueIsDrained() throws Exception {
        process.onEvent((c, root, s, m) -> {
            throw new Exception("<error>");
        });
        Engine engine = engine();

        EngineException e = assertThrows(EngineException.class, () ->
                engine.dispatch(ctx, new CommandA("a"), withCurrentTime(T0), withObserver(buf)));

        assertEquals(1, e.errors().size());
        assertEquals("<process> process: <error>", e.errors().get(0).getMessage());
        assertEquals(List.of(new EventA("a")), projection.applied());

        DispatchFact.CycleCompleted done = buf.factsOfType(DispatchFact.CycleCompleted.class).get(0);
        assertSame(e, done.error());
    }

    @Test
    void recordingAnEventProducedByAnotherHandlerIsUnexpectedBehavior() throws Exception {
        aggregate.onCommand((root, s, m) -> s.recordEvent(new EventB("b")));
        Engine engine = engine();

        UnexpectedBehaviorException e = assertThrows(UnexpectedBehaviorException.class, () ->
                engine.dispatch(ctx, new CommandA("a"), withCurrentTime(T0)));

        assertEquals("<aggregate>", e.handler().name());
        assertEquals("handleCommand", e.method());
        assertTrue(e.description().contains("not produced by this handler"));
    }

    @Test
    void recordingAnInvalidEventIsUnexpectedBehavior() throws Exception {
        aggregate.onCommand((root, s, m) -> s.recordEvent(new EventA("<invalid>")));
        Engine engine = engine();

        UnexpectedBehaviorException e = assertThrows(UnexpectedBehaviorException.class, () ->
                engine.dispatch(ctx, new CommandA("a"), withCurrentTime(T0)));

        assertTrue(e.description().startsWith("recorded an invalid"));
    }

    @Test
    void unexpectedMessageSentinelIsEnriched() throws Exception {
        aggregate.onCommand((root, s, m) -> {
            throw new UnexpectedMessageException();
        });
        Engine engine = engine();

        UnexpectedMessageFailure e = assertThrows(UnexpectedMessageFailure.class, () ->
                engine.dispatch(ctx, new CommandA("a"), withCurrentTime(T0)));

        assertEquals("<aggregate>", e.handler().name());
        assertEquals("handleCommand", e.method());
        assertEquals(new CommandA("a"), e.unexpectedMessage());
        assertTrue(e.throwLocation().function().contains("EngineTest"));
    }

    // ------------------------------------------------------------------
    // Determinism, reset and cancellation
    // ------------------------------------------------------------------

    @Test
    void resetReplaysProduceIdenticalFactStreams() throws Exception {
        process.onEvent((c, root, s, m) -> {
            s.executeCommand(new CommandB("b"));
            s.scheduleTimeout(new TimeoutA("t"), s.now().plusSeconds(1));
        });
        integration.onCommand((c, s, m) -> s.recordEvent(new EventB("b")));
        AtomicInteger resets = new AtomicInteger();

        Engine engine = Engine.builder(new ApplicationStub()
                        .aggregate(aggregate)
                        .process(process)
                        .integration(integration))
                .withResetter(resets::incrementAndGet)
                .build();

        List<String> first = run(engine);
        engine.reset();
        List<String> second = run(engine);

        assertEquals(first, second);
        assertEquals(1, resets.get());
    }

    private List<String> run(Engine engine) throws Exception {
        FactBuffer b = new FactBuffer();
        engine.dispatch(ctx, new CommandA("a"), withCurrentTime(T0), withObserver(b));
        engine.tick(ctx, withCurrentTime(T0.plusSeconds(1)), withObserver(b));

        List<String> out = new ArrayList<>();
        for (Fact f : b.facts()) {
            StringBuilder s = new StringBuilder(f.getClass().getName());
            if (f instanceof DispatchFact.Begun d) {
                Envelope e = d.envelope();
                s.append(' ').append(e.messageId())
                        .append(' ').append(e.causationId())
                        .append(' ').append(e.correlationId())
                        .append(' ').append(e.message());
                e.streamPosition().ifPresent(p -> s.append(' ').append(p));
            }
            out.add(s.toString());
        }
        return out;
    }

    @Test
    void cancellationStopsTheDrainAfterTheCurrentEnvelope() throws Exception {
        OperationContext cancellable = OperationContext.cancellable();
        AtomicInteger integrationCalls = new AtomicInteger();
        process.onEvent((c, root, s, m) -> {
            s.executeCommand(new CommandB("b"));
            c.cancel();
        });
        integration.onCommand((c, s, m) -> integrationCalls.incrementAndGet());
        Engine engine = engine();

        EngineException e = assertThrows(EngineException.class, () ->
                engine.dispatch(cancellable, new CommandA("a"), withCurrentTime(T0), withObserver(buf)));

        assertTrue(e.errors().get(e.errors().size() - 1) instanceof CancellationException);
        assertEquals(0, integrationCalls.get());
        assertEquals(2, buf.factsOfType(DispatchFact.Begun.class).size());
    }

    @Test
    void tickVisitsEveryHandlerInRegistrationOrder() throws Exception {
        Engine engine = engine();

        engine.tick(ctx, withCurrentTime(T0), withObserver(buf), enableIntegrations(false));

        List<String> begun = buf.factsOfType(TickFact.Begun.class).stream()
                .map(f -> f.handler().name())
                .collect(Collectors.toList());
        List<TickFact.Skipped> skipped = buf.factsOfType(TickFact.Skipped.class);

        assertEquals(List.of("<aggregate>", "<process>", "<projection>"), begun);
        assertEquals(1, skipped.size());
        assertEquals("<integration>", skipped.get(0).handler().name());
    }

    private static HandlerConfig aggregate(Engine engine) {
        return engine.configuration().handlerByName("<aggregate>").orElseThrow();
    }
}
