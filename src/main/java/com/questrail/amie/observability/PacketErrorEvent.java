package com.questrail.amie.observability;

import java.time.Instant;

/**
 * Record representing a failure in the envelope codec.
 */
public record PacketErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
