package com.questrail.amie.packet.registry;

import com.questrail.amie.packet.Packet;
import com.questrail.amie.packet.PacketIdentity;
import com.questrail.amie.packet.PacketSchema;

import java.util.Map;
import java.util.Objects;

/**
 * Registry entry binding a {@link PacketSchema} to the class and factory of
 * its concrete packet type.
 *
 * @param schema      the static declaration of the type
 * @param packetClass the concrete packet class
 * @param factory     creates empty instances of {@code packetClass}
 */
public record PacketType<P extends Packet>(
        PacketSchema schema,
        Class<P> packetClass,
        PacketFactory<P> factory
) {
    public PacketType {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(packetClass, "packetClass");
        Objects.requireNonNull(factory, "factory");
    }

    public static <P extends Packet> PacketType<P> of(PacketSchema schema,
                                                      Class<P> packetClass,
                                                      PacketFactory<P> factory) {
        return new PacketType<>(schema, packetClass, factory);
    }

    /**
     * Returns the type identifier declared by the schema.
     */
    public String name() {
        return schema.type();
    }

    /**
     * Creates an instance carrying only identity and reply linkage.
     */
    public P create(PacketIdentity identity) {
        P packet = factory.create(identity);
        if (packet.schema() != schema) {
            throw new IllegalStateException(
                    "Factory for '" + name() + "' produced a packet of type '"
                            + packet.packetType() + "'");
        }
        return packet;
    }

    /**
     * Creates an instance and routes the named field values into it.
     */
    public P create(PacketIdentity identity, Map<String, ?> fields) {
        P packet = create(identity);
        packet.applyFields(fields);
        return packet;
    }

    /**
     * Creates an instance seeded with additional data, then routes the named
     * field values into it. The seed is copied; the caller's map is not retained.
     *
     * @throws IllegalArgumentException if the seed contains a schema-declared name
     */
    public P create(PacketIdentity identity, Map<String, ?> additionalData, Map<String, ?> fields) {
        P packet = create(identity);
        additionalData.forEach(packet::putAdditional);
        packet.applyFields(fields);
        return packet;
    }
}
