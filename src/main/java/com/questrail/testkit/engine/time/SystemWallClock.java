package com.questrail.testkit.engine.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Default {@link WallClock} implementation backed by {@link Instant#now()}.
 *
 * <h2>Warning</h2>
 * <p>Tests that need reproducible fact streams should pass an explicit
 * current time to each operation instead of relying on this clock.</p>
 */
public enum SystemWallClock implements WallClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
