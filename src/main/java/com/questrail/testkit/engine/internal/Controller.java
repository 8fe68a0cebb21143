package com.questrail.testkit.engine.internal;

import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.config.HandlerConfig;
import com.questrail.testkit.envelope.Envelope;
import com.questrail.testkit.fact.FactObserver;

import java.time.Instant;
import java.util.List;

/**
 * Controller
 * =============================================================================
 * Drives a single handler on behalf of the engine.
 *
 * <p>There is one controller per registered handler. A controller owns the
 * handler's in-memory state (instance histories, process roots, pending
 * timeouts, compaction bookkeeping) and translates engine envelopes into
 * handler callbacks.</p>
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>checked exceptions are handler errors; the engine records them and
 *       carries on</li>
 *   <li>unchecked exceptions are contract violations and abandon the current
 *       operation</li>
 * </ul>
 */
public interface Controller
{
    HandlerConfig handlerConfig();

    /**
     * Performs time-based work and returns any envelopes that are now ready
     * to be dispatched.
     */
    List<Envelope> tick(OperationContext ctx, FactObserver observer, Instant now) throws Exception;

    /**
     * Handles an envelope and returns the envelopes it produced, in the order
     * they were produced.
     */
    List<Envelope> handle(OperationContext ctx, FactObserver observer, Instant now, Envelope envelope) throws Exception;

    /**
     * Discards all state held by the controller.
     */
    void reset();
}
