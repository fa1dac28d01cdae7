package com.questrail.amie.packet.registry;

import com.questrail.amie.packet.Packet;
import com.questrail.amie.packet.PacketIdentity;

/**
 * Creates empty instances of one concrete packet type, typically a
 * constructor reference such as {@code RequestProjectCreate::new}.
 */
@FunctionalInterface
public interface PacketFactory<P extends Packet>
{
    P create(PacketIdentity identity);
}
