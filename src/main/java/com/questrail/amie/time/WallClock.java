package com.questrail.amie.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of the current wall-clock time used to stamp packets that are
 * created without an explicit date.
 *
 * <p>
 * Packet construction never reads {@link Instant#now()} directly. Callers that
 * need reproducible packet dates (tests, replay tooling) supply their own
 * implementation.
 * </p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
