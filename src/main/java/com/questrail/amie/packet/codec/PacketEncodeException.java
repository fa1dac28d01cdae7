package com.questrail.amie.packet.codec;

import com.questrail.amie.packet.AmiePacketException;

/**
 * Indicates that a packet's envelope could not be written as JSON, usually
 * because an additional data value has no JSON representation.
 */
public final class PacketEncodeException extends AmiePacketException
{
    public PacketEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
