package com.questrail.amie.packet;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;

/**
 * ReplyTo
 * ============================================================================
 * Reply linkage supplied when a packet is constructed.
 *
 * <p>
 * A packet either answers nothing ({@link Unset}), answers a packet known only
 * by its id ({@link ById}), or answers a packet instance at hand
 * ({@link ByPacket}). The linkage is reduced to a plain id string once, when
 * the packet is built; see {@link #packetId()}.
 * </p>
 *
 * <p>
 * Values arriving from untyped sources (decoded envelopes, scripting glue)
 * are normalized through {@link #from(Object)}.
 * </p>
 */
public sealed interface ReplyTo permits ReplyTo.Unset, ReplyTo.ById, ReplyTo.ByPacket
{
    /**
     * Returns the id of the packet being answered, or {@code null} if unset.
     */
    String packetId();

    static ReplyTo none() {
        return Unset.INSTANCE;
    }

    static ReplyTo id(String packetId) {
        return packetId == null || packetId.isEmpty() ? Unset.INSTANCE : new ById(packetId);
    }

    static ReplyTo packet(Packet packet) {
        return new ByPacket(packet);
    }

    /**
     * Normalizes an untyped reply reference.
     *
     * <p>Checked in order:</p>
     * <ol>
     *   <li>{@code null} → {@link Unset}</li>
     *   <li>{@link ReplyTo} → itself</li>
     *   <li>text → {@link ById}; empty text → {@link Unset}</li>
     *   <li>integral number → {@link ById} with its decimal text</li>
     *   <li>{@link Packet} → {@link ByPacket}</li>
     *   <li>envelope-shaped map with {@code header.packet_id} → {@link ById}</li>
     * </ol>
     *
     * @throws IllegalArgumentException for any other shape
     */
    static ReplyTo from(Object raw) {
        if (raw == null) {
            return Unset.INSTANCE;
        }
        if (raw instanceof ReplyTo replyTo) {
            return replyTo;
        }
        if (raw instanceof CharSequence text) {
            return text.length() == 0 ? Unset.INSTANCE : new ById(text.toString());
        }
        if (raw instanceof Integer || raw instanceof Long
                || raw instanceof Short || raw instanceof Byte
                || raw instanceof BigInteger) {
            return new ById(raw.toString());
        }
        if (raw instanceof Packet packet) {
            return new ByPacket(packet);
        }
        if (raw instanceof Map<?, ?> envelope
                && envelope.get("header") instanceof Map<?, ?> header
                && header.get("packet_id") != null) {
            return new ById(String.valueOf(header.get("packet_id")));
        }
        throw new IllegalArgumentException(
                "Cannot derive a reply reference from " + raw.getClass().getName());
    }

    /**
     * No reply linkage.
     */
    final class Unset implements ReplyTo {
        static final Unset INSTANCE = new Unset();

        private Unset() {
        }

        @Override
        public String packetId() {
            return null;
        }

        @Override
        public String toString() {
            return "ReplyTo.Unset";
        }
    }

    /**
     * Linkage to a packet known by id.
     */
    record ById(String id) implements ReplyTo {
        public ById {
            Objects.requireNonNull(id, "id");
        }

        @Override
        public String packetId() {
            return id;
        }
    }

    /**
     * Linkage to a packet instance. The id is read when the linkage is resolved,
     * so a source packet whose id is still unassigned yields {@code null}.
     */
    record ByPacket(Packet packet) implements ReplyTo {
        public ByPacket {
            Objects.requireNonNull(packet, "packet");
        }

        @Override
        public String packetId() {
            return packet.packetId();
        }
    }
}
