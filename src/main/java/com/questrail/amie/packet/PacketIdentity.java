package com.questrail.amie.packet;

import com.questrail.amie.time.SystemWallClock;
import com.questrail.amie.time.WallClock;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Identity and linkage metadata handed to a packet at construction.
 *
 * @param packetId  the packet id; {@code null} if it will be assigned later
 * @param date      the packet date
 * @param inReplyTo the packet this one answers
 */
public record PacketIdentity(
        String packetId,
        OffsetDateTime date,
        ReplyTo inReplyTo
) {
    public PacketIdentity {
        Objects.requireNonNull(date, "date");
        inReplyTo = inReplyTo == null ? ReplyTo.none() : inReplyTo;
    }

    /**
     * Identity with the given id, dated now by the system clock, answering nothing.
     */
    public static PacketIdentity of(String packetId) {
        return builder().packetId(packetId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String packetId;
        private OffsetDateTime date;
        private ReplyTo inReplyTo = ReplyTo.none();
        private WallClock clock = SystemWallClock.INSTANCE;

        /**
         * Sets the packet id. Non-text ids are converted with {@link String#valueOf(Object)}.
         */
        public Builder packetId(Object packetId) {
            this.packetId = packetId == null ? null : String.valueOf(packetId);
            return this;
        }

        public Builder date(OffsetDateTime date) {
            this.date = date;
            return this;
        }

        public Builder inReplyTo(ReplyTo inReplyTo) {
            this.inReplyTo = inReplyTo == null ? ReplyTo.none() : inReplyTo;
            return this;
        }

        /**
         * Sets the reply linkage from an untyped value; see {@link ReplyTo#from(Object)}.
         */
        public Builder inReplyTo(Object inReplyTo) {
            this.inReplyTo = ReplyTo.from(inReplyTo);
            return this;
        }

        /**
         * Sets the clock consulted when no explicit date is given.
         */
        public Builder clock(WallClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public PacketIdentity build() {
            OffsetDateTime effectiveDate = date != null
                    ? date
                    : clock.now().atOffset(ZoneOffset.UTC);
            return new PacketIdentity(packetId, effectiveDate, inReplyTo);
        }
    }
}
