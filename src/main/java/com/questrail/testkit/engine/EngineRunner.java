package com.questrail.testkit.engine;

import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.engine.time.MonotonicClock;
import com.questrail.testkit.engine.time.SystemMonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * EngineRunner
 * =============================================================================
 * Ticks an engine repeatedly in real time until the operation context is
 * cancelled.
 *
 * <p>{@link #run} uses the engine's wall clock for each tick.
 * {@link #runTimeScaled} instead derives the engine time from the real time
 * elapsed since the loop started, multiplied by a scale factor and added to
 * an epoch. A factor of 60 makes one real second pass as one engine
 * minute.</p>
 *
 * <p>Both loops return only by throwing: {@link CancellationException} when
 * the context is cancelled, or {@link EngineException} when a tick fails.</p>
 */
public final class EngineRunner
{
    private static final Logger log = LoggerFactory.getLogger(EngineRunner.class);

    private final Engine engine;
    private final MonotonicClock clock;

    public EngineRunner(Engine engine) {
        this(engine, SystemMonotonicClock.INSTANCE);
    }

    public EngineRunner(Engine engine, MonotonicClock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Ticks the engine every {@code interval}. A zero interval selects the
     * engine's default tick interval.
     */
    public void run(OperationContext ctx, Duration interval, OperationOption... options)
            throws EngineException, InterruptedException {
        Duration every = effectiveInterval(interval);

        log.info("runner started: application={} interval={}", engine.configuration().identity(), every);

        try {
            while (true) {
                engine.tick(ctx, options);
                pause(ctx, every);
            }
        } finally {
            log.info("runner stopped: application={}", engine.configuration().identity());
        }
    }

    /**
     * Ticks the engine every {@code interval} with the engine time set to
     * {@code epoch + elapsed * factor}.
     */
    public void runTimeScaled(
            OperationContext ctx,
            Duration interval,
            double factor,
            Instant epoch,
            OperationOption... options
    ) throws EngineException, InterruptedException {
        Objects.requireNonNull(epoch, "epoch");
        if (!(factor > 0)) {
            throw new IllegalArgumentException("factor must be positive");
        }

        Duration every = effectiveInterval(interval);
        long start = clock.nowNanos();

        log.info("runner started: application={} interval={} factor={} epoch={}",
                engine.configuration().identity(), every, factor, epoch);

        try {
            while (true) {
                long elapsed = clock.nowNanos() - start;
                Instant now = epoch.plusNanos((long) (elapsed * factor));

                List<OperationOption> opts = new ArrayList<>(Arrays.asList(options));
                opts.add(OperationOption.withCurrentTime(now));

                engine.tick(ctx, opts.toArray(new OperationOption[0]));
                pause(ctx, every);
            }
        } finally {
            log.info("runner stopped: application={}", engine.configuration().identity());
        }
    }

    private Duration effectiveInterval(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must be non-negative");
        }
        return interval.isZero() ? engine.timing().tickInterval() : interval;
    }

    private static void pause(OperationContext ctx, Duration interval) throws InterruptedException {
        if (ctx.await(interval)) {
            throw new CancellationException("operation cancelled");
        }
    }
}
