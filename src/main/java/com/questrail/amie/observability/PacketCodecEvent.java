package com.questrail.amie.observability;

import java.time.Instant;

/**
 * Record describing one packet passing through the envelope codec.
 */
public record PacketCodecEvent(
    Instant timestamp,
    String packetType,
    String packetId,
    String inReplyToId
) {
    public boolean isReply() {
        return inReplyToId != null;
    }
}
