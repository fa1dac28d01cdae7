package com.questrail.amie.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PacketObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jPacketObservabilitySink implements PacketObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPacketObservabilitySink.class);

    @Override
    public void onEncoded(PacketCodecEvent event) {
        if (event.isReply()) {
            log.debug("Encoded {} packet {} (reply to {})",
                event.packetType(), event.packetId(), event.inReplyToId());
        } else {
            log.debug("Encoded {} packet {}", event.packetType(), event.packetId());
        }
    }

    @Override
    public void onDecoded(PacketCodecEvent event) {
        if (event.isReply()) {
            log.debug("Decoded {} packet {} (reply to {})",
                event.packetType(), event.packetId(), event.inReplyToId());
        } else {
            log.debug("Decoded {} packet {}", event.packetType(), event.packetId());
        }
    }

    @Override
    public void onError(PacketErrorEvent event) {
        log.warn("AMIE packet codec error: {}", event.message(), event.cause());
    }
}
