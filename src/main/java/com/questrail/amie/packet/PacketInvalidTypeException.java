package com.questrail.amie.packet;

import java.util.Objects;

/**
 * Raised when a packet type identifier cannot be resolved, or when a reply
 * packet is requested with a type the source packet does not permit.
 *
 * <p>{@link #reason()} and {@link #typeName()} let callers react without
 * parsing the message text.</p>
 */
public final class PacketInvalidTypeException extends AmiePacketException
{
    /**
     * Classification of the failed type resolution.
     */
    public enum Reason {
        /** No registered packet type matches the identifier. */
        UNKNOWN_TYPE,
        /** The source packet type declares no permitted replies. */
        NO_REPLY_EXPECTED,
        /** Several replies are permitted and no type was requested. */
        AMBIGUOUS_REPLY,
        /** The requested type is not among the permitted replies. */
        UNEXPECTED_REPLY
    }

    private final Reason reason;
    private final String typeName;

    public PacketInvalidTypeException(Reason reason, String typeName, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.typeName = typeName;
    }

    public static PacketInvalidTypeException unknownType(Object typeName) {
        return new PacketInvalidTypeException(
                Reason.UNKNOWN_TYPE,
                String.valueOf(typeName),
                "No packet type matches provided '" + typeName + "'"
        );
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Returns the offending type identifier. For {@link Reason#NO_REPLY_EXPECTED}
     * and {@link Reason#AMBIGUOUS_REPLY} this is the source packet's type; for the
     * other reasons it is the identifier that failed to resolve.
     */
    public String typeName() {
        return typeName;
    }
}
