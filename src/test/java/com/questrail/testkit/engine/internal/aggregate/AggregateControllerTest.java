package com.questrail.testkit.engine.internal.aggregate;

import com.questrail.testkit.api.Message;
import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.engine.Engine;
import com.questrail.testkit.engine.UnexpectedBehaviorException;
import com.questrail.testkit.fact.AggregateFact;
import com.questrail.testkit.fact.FactBuffer;
import com.questrail.testkit.fixtures.AggregateStub;
import com.questrail.testkit.fixtures.ApplicationStub;
import com.questrail.testkit.fixtures.Messages.CommandA;
import com.questrail.testkit.fixtures.Messages.EventA;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.questrail.testkit.api.Route.handlesCommand;
import static com.questrail.testkit.api.Route.recordsEvent;
import static com.questrail.testkit.engine.OperationOption.withCurrentTime;
import static com.questrail.testkit.engine.OperationOption.withObserver;
import static org.junit.jupiter.api.Assertions.*;

/**
 * AggregateControllerTest
 * -----------------------------------------------------------------------------
 * Instance lifecycle and history replay for aggregates.
 *
 * <p>The command's value selects what the handler does: "record", "destroy",
 * "destroy-record" or "record-destroy".</p>
 */
class AggregateControllerTest {

    private static final Instant T0 = Instant.parse("2020-01-01T00:00:00Z");

    private final OperationContext ctx = OperationContext.background();

    private AggregateStub aggregate;
    private List<List<Message>> seenBeforeHandling;
    private FactBuffer buf;

    @BeforeEach
    void setUp() {
        seenBeforeHandling = new ArrayList<>();
        buf = new FactBuffer();

        aggregate = new AggregateStub("<aggregate>", "<aggregate-key>")
                .routes(handlesCommand(CommandA.class), recordsEvent(EventA.class))
                .onCommand((root, s, m) -> {
                    seenBeforeHandling.add(List.copyOf(root.applied()));

                    switch (((CommandA) m).value()) {
                        case "record":
                            s.recordEvent(new EventA(s.instanceId()));
                            break;
                        case "destroy":
                            s.destroy();
                            break;
                        case "destroy-record":
                            s.destroy();
                            s.recordEvent(new EventA("after"));
                            break;
                        case "record-destroy":
                            s.recordEvent(new EventA("before"));
                            s.destroy();
                            break;
                        default:
                            break;
                    }
                });
    }

    private Engine engine() throws Exception {
        return Engine.builder(new ApplicationStub().aggregate(aggregate)).build();
    }

    private void dispatch(Engine engine, String value) throws Exception {
        engine.dispatch(ctx, new CommandA(value), withCurrentTime(T0), withObserver(buf));
    }

    // ------------------------------------------------------------------
    // History
    // ------------------------------------------------------------------

    @Test
    void historyIsReplayedOntoAFreshRoot() throws Exception {
        Engine engine = engine();

        dispatch(engine, "record");
        dispatch(engine, "record");
        dispatch(engine, "none");

        assertEquals(List.of(
                List.of(),
                List.of(new EventA("<instance>")),
                List.of(new EventA("<instance>"), new EventA("<instance>"))
        ), seenBeforeHandling);

        assertEquals(1, buf.factsOfType(AggregateFact.InstanceNotFound.class).size());
        assertEquals(2, buf.factsOfType(AggregateFact.InstanceLoaded.class).size());
    }

    @Test
    void commandThatRecordsNothingDoesNotCreateTheInstance() throws Exception {
        Engine engine = engine();

        dispatch(engine, "none");
        dispatch(engine, "none");

        assertEquals(2, buf.factsOfType(AggregateFact.InstanceNotFound.class).size());
        assertFalse(buf.hasFactOfType(AggregateFact.InstanceCreated.class));
    }

    @Test
    void instancesAreKeptApart() throws Exception {
        aggregate.routeWith(m -> ((CommandA) m).value().equals("record") ? "<a>" : "<b>");
        Engine engine = engine();

        dispatch(engine, "record");
        dispatch(engine, "none");

        assertEquals(List.of(List.of(), List.of()), seenBeforeHandling);
    }

    // ------------------------------------------------------------------
    // Destruction
    // ------------------------------------------------------------------

    @Test
    void destroyedInstanceStartsOverWithNoHistory() throws Exception {
        Engine engine = engine();

        dispatch(engine, "record");
        dispatch(engine, "destroy");
        dispatch(engine, "none");

        assertEquals(List.of(), seenBeforeHandling.get(2));
        assertEquals(1, buf.factsOfType(AggregateFact.InstanceDestroyed.class).size());
        assertEquals(2, buf.factsOfType(AggregateFact.InstanceNotFound.class).size());
    }

    @Test
    void destroyingAMissingInstanceHasNoEffect() throws Exception {
        Engine engine = engine();

        dispatch(engine, "destroy");

        assertFalse(buf.hasFactOfType(AggregateFact.InstanceDestroyed.class));
    }

    @Test
    void recordingAfterDestroyRevertsTheDestructionAndKeepsOnlyLaterEvents() throws Exception {
        Engine engine = engine();

        dispatch(engine, "record");
        dispatch(engine, "destroy-record");
        dispatch(engine, "none");

        assertEquals(1, buf.factsOfType(AggregateFact.DestructionReverted.class).size());
        assertEquals(List.of(new EventA("after")), seenBeforeHandling.get(2));
    }

    @Test
    void eventsRecordedBeforeDestroyAreStillDispatched() throws Exception {
        Engine engine = engine();

        dispatch(engine, "record-destroy");
        dispatch(engine, "none");

        assertEquals(1, buf.factsOfType(AggregateFact.EventRecorded.class).size());
        assertEquals(List.of(), seenBeforeHandling.get(1));
    }

    @Test
    void rootPassedAfterDestroyIsNew() throws Exception {
        List<AggregateStub.Root> roots = new ArrayList<>();
        aggregate.onCommand((root, s, m) -> {
            s.recordEvent(new EventA("x"));
            s.destroy();
            s.recordEvent(new EventA("y"));
        });
        Engine engine = engine();

        dispatch(engine, "any");

        for (AggregateFact.EventRecorded f : buf.factsOfType(AggregateFact.EventRecorded.class)) {
            roots.add((AggregateStub.Root) f.root());
        }
        assertNotSame(roots.get(0), roots.get(1));
        assertEquals(List.of(new EventA("y")), roots.get(1).applied());
    }

    // ------------------------------------------------------------------
    // Misbehaviour and reset
    // ------------------------------------------------------------------

    @Test
    void nullRootIsUnexpectedBehavior() throws Exception {
        aggregate.newRootWith(() -> null);
        Engine engine = engine();

        UnexpectedBehaviorException e = assertThrows(UnexpectedBehaviorException.class, () -> dispatch(engine, "record"));

        assertEquals("newRoot", e.method());
        assertEquals("returned a null AggregateRoot", e.description());
    }

    @Test
    void emptyInstanceIdIsUnexpectedBehavior() throws Exception {
        aggregate.routeWith(m -> "");
        Engine engine = engine();

        UnexpectedBehaviorException e = assertThrows(UnexpectedBehaviorException.class, () -> dispatch(engine, "record"));

        assertEquals("routeCommandToInstance", e.method());
        assertTrue(e.description().contains("empty ID"));
    }

    @Test
    void resetForgetsEveryInstance() throws Exception {
        Engine engine = engine();

        dispatch(engine, "record");
        engine.reset();
        dispatch(engine, "none");

        assertEquals(List.of(), seenBeforeHandling.get(1));
    }
}
