package com.questrail.amie.packet;

import java.util.Objects;

/**
 * Raised when a packet fails validation, typically because a required field
 * has no value and the packet is not a reply.
 */
public final class PacketInvalidDataException extends AmiePacketException
{
    private final String fieldName;

    public PacketInvalidDataException(String fieldName, String message) {
        super(message);
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
    }

    public PacketInvalidDataException(String fieldName, String message, Throwable cause) {
        super(message, cause);
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
    }

    public static PacketInvalidDataException missingField(String fieldName) {
        return new PacketInvalidDataException(
                fieldName, "Missing required data field: \"" + fieldName + "\"");
    }

    /**
     * Returns the name of the field that failed validation.
     */
    public String fieldName() {
        return fieldName;
    }
}
