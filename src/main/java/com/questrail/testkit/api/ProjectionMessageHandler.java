package com.questrail.testkit.api;

/**
 * ProjectionMessageHandler
 * -----------------------------------------------------------------------------
 * Builds a read model from events, tracking progress with a per-stream
 * checkpoint offset.
 *
 * <h2>Checkpoints</h2>
 * <p>The checkpoint offset is the offset of the next event the projection
 * expects on a stream. {@link #handleEvent} must return the new checkpoint,
 * which is always the event's offset plus one; the engine rejects any other
 * value.</p>
 *
 * <h2>Compaction</h2>
 * <p>{@link #compact} may run concurrently with {@link #handleEvent} when the
 * engine is configured to do so.</p>
 */
public interface ProjectionMessageHandler
{
    void configure(HandlerConfigurer configurer);

    long checkpointOffset(OperationContext ctx, String streamId) throws Exception;

    long handleEvent(OperationContext ctx, ProjectionEventScope scope, Message event) throws Exception;

    void compact(OperationContext ctx, ProjectionCompactScope scope) throws Exception;
}
