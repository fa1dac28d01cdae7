package com.questrail.amie.packet.registry;

import java.util.List;

/**
 * Service interface through which packet type declarations reach the default
 * registry.
 *
 * <p>
 * Implementations are discovered with {@link java.util.ServiceLoader} and must
 * be listed in {@code META-INF/services/com.questrail.amie.packet.registry.PacketCatalog}.
 * </p>
 */
public interface PacketCatalog
{
    /**
     * Returns the packet types this catalog declares.
     */
    List<PacketType<?>> packetTypes();
}
