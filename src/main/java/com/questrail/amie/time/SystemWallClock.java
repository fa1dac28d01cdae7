package com.questrail.amie.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} implementation backed by {@link Instant#now()}.
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>Returns the current wall-clock time as an {@link Instant}</li>
 *   <li>May jump forward or backward due to NTP or manual adjustments</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>This implementation is thread-safe. {@link Instant#now()} is inherently
 * safe for concurrent access.</p>
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
