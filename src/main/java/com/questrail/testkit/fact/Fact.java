package com.questrail.testkit.fact;

/**
 * Fact
 * =============================================================================
 * A record of one observable step taken by the engine.
 *
 * <p>Facts are the engine's only output besides produced messages. Every
 * variant carries enough context (handler, envelopes, instance ID, error, skip
 * reason) for an observer to reason about what happened without access to the
 * engine's internals.</p>
 *
 * <h2>Groups</h2>
 * <ul>
 *   <li>{@link DispatchFact}: dispatch cycles and per-envelope dispatch</li>
 *   <li>{@link HandlingFact}: per-handler handling of an envelope</li>
 *   <li>{@link TickFact}: tick cycles and per-handler ticks</li>
 *   <li>{@link AggregateFact}, {@link ProcessFact}, {@link IntegrationFact},
 *       {@link ProjectionFact}: handler-specific steps</li>
 * </ul>
 */
public sealed interface Fact
        permits DispatchFact, HandlingFact, TickFact, AggregateFact, ProcessFact, IntegrationFact, ProjectionFact
{
}
