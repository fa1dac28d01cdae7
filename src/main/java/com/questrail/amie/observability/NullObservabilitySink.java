package com.questrail.amie.observability;

/**
 * No-op implementation of PacketObservabilitySink.
 */
public final class NullObservabilitySink implements PacketObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onEncoded(PacketCodecEvent event) {}

    @Override
    public void onDecoded(PacketCodecEvent event) {}

    @Override
    public void onError(PacketErrorEvent event) {}
}
