package com.questrail.testkit.engine.internal.projection;

import com.questrail.testkit.api.MessageKind;
import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.api.ProjectionMessageHandler;
import com.questrail.testkit.config.ProjectionConfig;
import com.questrail.testkit.engine.internal.Controller;
import com.questrail.testkit.engine.internal.HandlerCalls;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.fact.Fact;
import com.questrail.testkit.fact.FactObserver;
import com.questrail.testkit.fact.ProjectionFact;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * ProjectionController
 * =============================================================================
 * Drives a projection message handler.
 *
 * <h2>Checkpoints</h2>
 * <p>The controller holds no checkpoints of its own. It asks the handler for
 * the stream's checkpoint before each event, skips events at offsets the
 * handler has already passed, and rejects any returned checkpoint other than
 * {@code offset + 1} with a {@link CheckpointConflictException}.</p>
 *
 * <h2>Compaction</h2>
 * <p>{@link #tick} compacts once per compaction interval of engine time. When
 * compaction during handling is enabled, each event also starts a compaction
 * on another thread that overlaps the call to {@code handleEvent}. Messages
 * logged by that compaction are held until it finishes and are then emitted
 * on the calling thread, between the begin and completed facts.</p>
 */
public final class ProjectionController implements Controller
{
    private static final String INTERFACE = "ProjectionMessageHandler";

    private final ProjectionConfig config;
    private final ProjectionMessageHandler handler;
    private final Duration compactionInterval;
    private final boolean compactDuringHandling;

    private Instant lastCompaction;

    public ProjectionController(ProjectionConfig config, Duration compactionInterval, boolean compactDuringHandling) {
        this.config = Objects.requireNonNull(config, "config");
        this.handler = config.handler();
        this.compactionInterval = Objects.requireNonNull(compactionInterval, "compactionInterval");
        this.compactDuringHandling = compactDuringHandling;
    }

    @Override
    public ProjectionConfig handlerConfig() {
        return config;
    }

    @Override
    public List<Envelope> tick(OperationContext ctx, FactObserver observer, Instant now) throws Exception {
        if (lastCompaction != null && Duration.between(lastCompaction, now).compareTo(compactionInterval) < 0) {
            return List.of();
        }

        lastCompaction = now;

        observer.onFact(new ProjectionFact.CompactionBegun(config));

        Exception error = null;
        try {
            handler.compact(ctx, ProjectionScope.forCompaction(config, observer, now));
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            error = e;
        }

        observer.onFact(new ProjectionFact.CompactionCompleted(config, error));

        if (error != null) {
            throw error;
        }
        return List.of();
    }

    @Override
    public List<Envelope> handle(OperationContext ctx, FactObserver observer, Instant now, Envelope env) throws Exception {
        if (env.kind() != MessageKind.EVENT || !config.consumes(env.messageType())) {
            throw new IllegalStateException(config.identity() + " does not handle " + env.messageType().getName() + " messages");
        }

        String streamId = env.eventStreamId();
        long offset = env.eventStreamOffset();

        long checkpoint = HandlerCalls.callChecked(config, INTERFACE, "checkpointOffset", handler, env.message(),
                () -> handler.checkpointOffset(ctx, streamId));

        if (checkpoint > offset) {
            return List.of();
        }

        CompletableFuture<Exception> compaction = null;
        Queue<Fact> compactionFacts = new ConcurrentLinkedQueue<>();
        if (compactDuringHandling) {
            observer.onFact(new ProjectionFact.CompactionBegun(config));
            compaction = CompletableFuture.supplyAsync(() -> compact(ctx, compactionFacts::add, now));
        }

        ProjectionScope scope = ProjectionScope.forEvent(config, observer, now, env, checkpoint);

        Exception handleError = null;
        try {
            long next = HandlerCalls.callChecked(config, INTERFACE, "handleEvent", handler, env.message(),
                    () -> handler.handleEvent(ctx, scope, env.message()));
            if (next != offset + 1) {
                handleError = new CheckpointConflictException(config.name(), streamId, offset + 1, next);
            }
        } catch (RuntimeException e) {
            if (compaction != null) {
                finishCompaction(observer, compaction, compactionFacts);
            }
            throw e;
        } catch (Exception e) {
            handleError = e;
        }

        Exception compactError = null;
        if (compaction != null) {
            compactError = finishCompaction(observer, compaction, compactionFacts);
            if (compactError instanceof UncheckedCompactionFailure failure) {
                throw failure.getCause();
            }
        }

        if (handleError != null) {
            throw handleError;
        }
        if (compactError != null) {
            throw compactError;
        }
        return List.of();
    }

    @Override
    public void reset() {
        lastCompaction = null;
    }

    /**
     * Waits for a concurrent compaction, then emits the facts it buffered and
     * its completed fact on the calling thread. Returns the compaction error,
     * if any.
     */
    private Exception finishCompaction(FactObserver observer, CompletableFuture<Exception> compaction, Queue<Fact> buffered) {
        Exception error = compaction.join();
        buffered.forEach(observer::onFact);

        Exception reported = error instanceof UncheckedCompactionFailure failure ? failure.getCause() : error;
        observer.onFact(new ProjectionFact.CompactionCompleted(config, reported));
        return error;
    }

    /**
     * Runs on the compaction thread. Returns the handler error, if any.
     */
    private Exception compact(OperationContext ctx, FactObserver observer, Instant now) {
        try {
            handler.compact(ctx, ProjectionScope.forCompaction(config, observer, now));
            return null;
        } catch (RuntimeException e) {
            return new UncheckedCompactionFailure(e);
        } catch (Exception e) {
            return e;
        }
    }

    /**
     * Carries an unchecked exception from the compaction thread back to the
     * calling thread, where it is rethrown as is.
     */
    private static final class UncheckedCompactionFailure extends Exception {
        UncheckedCompactionFailure(RuntimeException cause) {
            super(cause);
        }

        @Override
        public synchronized RuntimeException getCause() {
            return (RuntimeException) super.getCause();
        }
    }
}
