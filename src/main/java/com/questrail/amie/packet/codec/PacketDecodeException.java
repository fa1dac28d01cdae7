package com.questrail.amie.packet.codec;

import com.questrail.amie.packet.AmiePacketException;

/**
 * Indicates that an envelope could not be translated into a packet because
 * its structure is malformed.
 *
 * This typically reflects:
 * <ul>
 *   <li>Text that is not a JSON object</li>
 *   <li>A missing or non-object {@code header}</li>
 *   <li>A missing packet type identifier</li>
 *   <li>A {@code body} that is not an object</li>
 * </ul>
 *
 * An envelope that is well formed but names an unregistered type raises
 * {@link com.questrail.amie.packet.PacketInvalidTypeException} instead.
 */
public final class PacketDecodeException extends AmiePacketException
{
    public PacketDecodeException(String message) {
        super(message);
    }

    public PacketDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
