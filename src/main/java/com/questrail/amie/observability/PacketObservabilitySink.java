package com.questrail.amie.observability;

/**
 * Receives packet codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface PacketObservabilitySink {
    /**
     * Called after a packet has been written to an envelope.
     * @param event the packet that was encoded
     */
    void onEncoded(PacketCodecEvent event);

    /**
     * Called after an envelope has been turned into a packet.
     * @param event the packet that was decoded
     */
    void onDecoded(PacketCodecEvent event);

    /**
     * Called when an envelope cannot be decoded or a packet cannot be encoded.
     * @param event the error event
     */
    void onError(PacketErrorEvent event);
}
