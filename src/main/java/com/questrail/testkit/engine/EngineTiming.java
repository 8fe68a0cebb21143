package com.questrail.testkit.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * EngineTiming
 * -----------------------------------------------------------------------------
 * Intervals that govern time-based engine behaviour.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>tickInterval</b>: real time between ticks when the engine is
 *       driven by {@link EngineRunner}.</li>
 *   <li><b>compactionInterval</b>: engine (virtual) time between projection
 *       compactions performed by {@link Engine#tick}.</li>
 * </ul>
 */
public record EngineTiming(
        Duration tickInterval,
        Duration compactionInterval
) {
    public EngineTiming {
        Objects.requireNonNull(tickInterval, "tickInterval");
        Objects.requireNonNull(compactionInterval, "compactionInterval");

        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        if (compactionInterval.isNegative()) {
            throw new IllegalArgumentException("compactionInterval must be non-negative");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>tickInterval: 250ms</li>
     *   <li>compactionInterval: 1h</li>
     * </ul>
     */
    public static EngineTiming defaults() {
        return new EngineTiming(
                Duration.ofMillis(250),
                Duration.ofHours(1)
        );
    }
}
