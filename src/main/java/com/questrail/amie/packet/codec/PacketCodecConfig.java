package com.questrail.amie.packet.codec;

import com.questrail.amie.observability.NullObservabilitySink;
import com.questrail.amie.observability.PacketObservabilitySink;
import com.questrail.amie.time.SystemWallClock;
import com.questrail.amie.time.WallClock;

import java.util.Objects;

/**
 * Configuration for {@link PacketCodec}.
 *
 * @param clock             stamps decoded packets whose header carries no date,
 *                          and observability events
 * @param prettyPrint       indent JSON output
 * @param observabilitySink receives encode/decode events
 */
public record PacketCodecConfig(
    WallClock clock,
    boolean prettyPrint,
    PacketObservabilitySink observabilitySink
) {
    public PacketCodecConfig {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public static PacketCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private WallClock clock = SystemWallClock.INSTANCE;
        private boolean prettyPrint = false;
        private PacketObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withPrettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }

        public Builder withObservabilitySink(PacketObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public PacketCodecConfig build() {
            return new PacketCodecConfig(clock, prettyPrint, observabilitySink);
        }
    }
}
