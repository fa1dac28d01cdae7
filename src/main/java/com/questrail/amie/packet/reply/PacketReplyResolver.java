package com.questrail.amie.packet.reply;

import com.questrail.amie.packet.Packet;
import com.questrail.amie.packet.PacketIdentity;
import com.questrail.amie.packet.PacketInvalidTypeException;
import com.questrail.amie.packet.PacketInvalidTypeException.Reason;
import com.questrail.amie.packet.ReplyTo;
import com.questrail.amie.packet.registry.PacketType;
import com.questrail.amie.packet.registry.PacketTypeRegistry;
import com.questrail.amie.time.SystemWallClock;
import com.questrail.amie.time.WallClock;

import java.util.List;
import java.util.Objects;

/**
 * PacketReplyResolver
 * ============================================================================
 * Determines and builds the reply to a received packet.
 *
 * <h2>Resolution rules</h2>
 * <ol>
 *   <li>A requested type with {@code force} set is resolved directly, skipping
 *       all compatibility checks.</li>
 *   <li>A source type with no expected replies cannot be answered.</li>
 *   <li>A source type with several expected replies needs a requested type.</li>
 *   <li>A requested type must be one of the expected replies.</li>
 *   <li>Otherwise the requested type, or the single expected reply, is used.</li>
 * </ol>
 *
 * <p>
 * Most AMIE packets expect exactly one reply, so {@code replyPacket(source)}
 * is the common call:
 * </p>
 * <pre>{@code
 * Packet notify = resolver.replyPacket(receivedRequest);
 * }</pre>
 */
public final class PacketReplyResolver
{
    private final PacketTypeRegistry registry;
    private final WallClock clock;

    public PacketReplyResolver(PacketTypeRegistry registry) {
        this(registry, SystemWallClock.INSTANCE);
    }

    public PacketReplyResolver(PacketTypeRegistry registry, WallClock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Resolves the reply type without building a packet.
     *
     * @param source     the packet being answered
     * @param packetType requested reply type, or {@code null}
     * @param force      skip compatibility checks when a type is requested
     * @throws PacketInvalidTypeException if no permissible reply type can be determined
     */
    public PacketType<?> replyType(Packet source, String packetType, boolean force) {
        Objects.requireNonNull(source, "source");

        if (packetType != null && force) {
            return registry.lookup(packetType);
        }

        List<String> expected = source.expectedReplies();
        if (expected.isEmpty()) {
            throw new PacketInvalidTypeException(Reason.NO_REPLY_EXPECTED, source.packetType(),
                    "Packet type '" + source.packetType() + "' does not expect a reply");
        }
        if (expected.size() > 1 && packetType == null) {
            throw new PacketInvalidTypeException(Reason.AMBIGUOUS_REPLY, source.packetType(),
                    "Packet type '" + source.packetType() + "' has more than one expected"
                            + " response. Specify a packet type for the reply");
        }
        if (packetType != null && !expected.contains(packetType)) {
            throw new PacketInvalidTypeException(Reason.UNEXPECTED_REPLY, packetType,
                    "'" + packetType + "' is not an expected reply for packet type '"
                            + source.packetType() + "'");
        }
        return registry.lookup(packetType != null ? packetType : expected.get(0));
    }

    /**
     * Builds the single expected reply, without a packet id.
     */
    public Packet replyPacket(Packet source) {
        return replyPacket(source, null, null, false);
    }

    /**
     * Builds the single expected reply with the given packet id.
     */
    public Packet replyPacket(Packet source, String packetId) {
        return replyPacket(source, packetId, null, false);
    }

    /**
     * Builds a reply of the requested type, which must be an expected reply.
     */
    public Packet replyPacket(Packet source, String packetId, String packetType) {
        return replyPacket(source, packetId, packetType, false);
    }

    /**
     * Builds a reply whose {@code inReplyToId} is the source packet's id.
     *
     * @param source     the packet being answered
     * @param packetId   id of the new packet; may be {@code null} and assigned later
     * @param packetType requested reply type, or {@code null}
     * @param force      create the requested type even if it is not an expected reply
     * @throws PacketInvalidTypeException if no permissible reply type can be determined
     */
    public Packet replyPacket(Packet source, String packetId, String packetType, boolean force) {
        PacketType<?> type = replyType(source, packetType, force);
        PacketIdentity identity = PacketIdentity.builder()
                .packetId(packetId)
                .inReplyTo(ReplyTo.id(source.packetId()))
                .clock(clock)
                .build();
        return type.create(identity);
    }
}
