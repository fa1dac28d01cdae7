package com.questrail.amie.packet;

/**
 * Base class for AMIE packet related exceptions.
 *
 * <p>Every failure raised by the packet model, the type registry, the reply
 * resolver or the envelope codec derives from this type, so transport layers
 * can catch a single root while still branching on the concrete subclass.
 */
public abstract class AmiePacketException extends RuntimeException
{
    protected AmiePacketException(String message) {
        super(message);
    }

    protected AmiePacketException(String message, Throwable cause) {
        super(message, cause);
    }
}
