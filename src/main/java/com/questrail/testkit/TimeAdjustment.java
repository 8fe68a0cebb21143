package com.questrail.testkit;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * A change to a test's virtual clock, applied by {@link Actions#advanceTime}.
 */
public interface TimeAdjustment
{
    /**
     * Returns a description of the adjustment, such as "by 3s".
     */
    String description();

    /**
     * Returns the time after the adjustment is applied to {@code before}.
     */
    Instant step(Instant before);

    /**
     * Moves the clock to a specific time. Applying it fails if {@code t} is
     * before the current time.
     */
    static TimeAdjustment toTime(Instant t) {
        Objects.requireNonNull(t, "t");
        return new TimeAdjustment() {
            @Override
            public String description() {
                return "to " + DateTimeFormatter.ISO_INSTANT.format(t);
            }

            @Override
            public Instant step(Instant before) {
                return t;
            }
        };
    }

    /**
     * Moves the clock forward by {@code d}.
     *
     * @throws IllegalArgumentException if {@code d} is negative
     */
    static TimeAdjustment byDuration(Duration d) {
        Objects.requireNonNull(d, "d");
        if (d.isNegative()) {
            throw new IllegalArgumentException(String.format(
                    "byDuration(%s): duration must not be negative", Durations.format(d)));
        }
        return new TimeAdjustment() {
            @Override
            public String description() {
                return "by " + Durations.format(d);
            }

            @Override
            public Instant step(Instant before) {
                return before.plus(d);
            }
        };
    }
}
